package com.example.embeddingindex;

public final class StoreStats {

    private final long projects;
    private final long items;
    private final long ledgerRows;
    private final long indexSize;
    private final int dimension;

    public StoreStats(long projects, long items, long ledgerRows, long indexSize, int dimension) {
        this.projects = projects;
        this.items = items;
        this.ledgerRows = ledgerRows;
        this.indexSize = indexSize;
        this.dimension = dimension;
    }

    public long getProjects() { return projects; }
    public long getItems() { return items; }
    public long getLedgerRows() { return ledgerRows; }
    public long getIndexSize() { return indexSize; }
    public int getDimension() { return dimension; }
}
