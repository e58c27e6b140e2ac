package com.example.embeddingindex;

/**
 * Base exception for store, gate and embedding failures.
 *
 * <p>Every subclass carries a stable error code that the REST layer puts in the
 * error envelope, so callers can branch on the code instead of the message.</p>
 */
public class EmbeddingIndexException extends RuntimeException {

    private final String code;

    public EmbeddingIndexException(String code, String message) {
        super(message);
        this.code = code;
    }

    public EmbeddingIndexException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
