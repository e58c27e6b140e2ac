package com.example.embeddingindex;

/**
 * Thrown when an embedding's length does not match the store dimension.
 * Embeddings are never resized or truncated to fit.
 */
public class DimensionMismatchException extends EmbeddingIndexException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("DIMENSION_MISMATCH", "Dimension mismatch: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
