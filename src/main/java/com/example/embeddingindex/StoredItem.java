package com.example.embeddingindex;

import java.util.Objects;

/**
 * Caller-facing view of one indexed item: its identifiers plus the metadata
 * record kept next to the embedding.
 */
public final class StoredItem {

    private final String projectId;
    private final String itemId;
    private final String blobKey;
    private final String contentType;
    private final String originalFilename;
    private final long sizeBytes;

    public StoredItem(String projectId, String itemId, String blobKey, String contentType,
                      String originalFilename, long sizeBytes) {
        this.projectId = projectId;
        this.itemId = itemId;
        this.blobKey = blobKey;
        this.contentType = contentType;
        this.originalFilename = originalFilename;
        this.sizeBytes = sizeBytes;
    }

    public String getProjectId() { return projectId; }
    public String getItemId() { return itemId; }
    public String getBlobKey() { return blobKey; }
    public String getContentType() { return contentType; }
    public String getOriginalFilename() { return originalFilename; }
    public long getSizeBytes() { return sizeBytes; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoredItem)) return false;
        StoredItem that = (StoredItem) o;
        return sizeBytes == that.sizeBytes
                && Objects.equals(projectId, that.projectId)
                && Objects.equals(itemId, that.itemId)
                && Objects.equals(blobKey, that.blobKey)
                && Objects.equals(contentType, that.contentType)
                && Objects.equals(originalFilename, that.originalFilename);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, itemId, blobKey, contentType, originalFilename, sizeBytes);
    }

    @Override
    public String toString() {
        return "StoredItem{" + projectId + "/" + itemId + ", blobKey=" + blobKey
                + ", contentType=" + contentType + ", sizeBytes=" + sizeBytes + "}";
    }
}
