package com.example.embeddingindex;

/**
 * The embedding model failed to produce a vector.
 */
public class InferenceException extends EmbeddingIndexException {

    public InferenceException(String message) {
        super("INFERENCE_FAILED", message);
    }

    public InferenceException(String message, Throwable cause) {
        super("INFERENCE_FAILED", message, cause);
    }
}
