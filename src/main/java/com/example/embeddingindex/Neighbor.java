package com.example.embeddingindex;

/**
 * One index hit: internal id and cosine similarity ({@code 1 - cosine distance}).
 */
public final class Neighbor {

    private final long internalId;
    private final double similarity;

    public Neighbor(long internalId, double similarity) {
        this.internalId = internalId;
        this.similarity = similarity;
    }

    public long getInternalId() { return internalId; }
    public double getSimilarity() { return similarity; }

    @Override
    public String toString() {
        return "Neighbor{" + internalId + ", " + similarity + "}";
    }
}
