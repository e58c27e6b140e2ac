package com.example.embeddingindex;

public final class SearchHit {

    private final StoredItem item;
    private final double similarity;

    public SearchHit(StoredItem item, double similarity) {
        this.item = item;
        this.similarity = similarity;
    }

    public StoredItem getItem() { return item; }
    public String getItemId() { return item.getItemId(); }
    public double getSimilarity() { return similarity; }

    @Override
    public String toString() {
        return "SearchHit{" + item.getItemId() + ", " + similarity + "}";
    }
}
