package com.example.embeddingindex;

/**
 * The vector index holds its configured maximum number of live items.
 */
public class CapacityExceededException extends EmbeddingIndexException {

    public CapacityExceededException(int capacity) {
        super("INDEX_FULL", "Vector index is full (capacity " + capacity + ")");
    }
}
