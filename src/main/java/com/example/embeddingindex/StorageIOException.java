package com.example.embeddingindex;

/**
 * A durable write or read failed. The operation is considered failed and
 * nothing it started is left visible.
 */
public class StorageIOException extends EmbeddingIndexException {

    public StorageIOException(String message, Throwable cause) {
        super("STORAGE_IO", message, cause);
    }
}
