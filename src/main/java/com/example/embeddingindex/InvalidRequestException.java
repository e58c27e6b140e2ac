package com.example.embeddingindex;

/**
 * Caller input was rejected before anything was written.
 */
public class InvalidRequestException extends EmbeddingIndexException {

    public InvalidRequestException(String code, String message) {
        super(code, message);
    }
}
