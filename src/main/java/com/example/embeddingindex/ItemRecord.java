package com.example.embeddingindex;

import jakarta.persistence.*;

@Entity
@Table(name = "item_records")
public class ItemRecord {

    @Id
    @Column(name = "internal_id")
    private Long internalId;

    @Column(name = "blob_key", nullable = false)
    private String blobKey;

    @Column(name = "content_type", nullable = false)
    private String contentType;

    @Column(name = "original_filename")
    private String originalFilename;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    public ItemRecord() {}

    public ItemRecord(long internalId, StoredItem item) {
        this.internalId = internalId;
        this.blobKey = item.getBlobKey();
        this.contentType = item.getContentType();
        this.originalFilename = item.getOriginalFilename();
        this.sizeBytes = item.getSizeBytes();
    }

    public StoredItem toStoredItem(IdentityRecord identity) {
        return new StoredItem(identity.getProjectId(), identity.getItemId(), blobKey, contentType, originalFilename, sizeBytes);
    }

    public Long getInternalId() { return internalId; }
    public void setInternalId(Long internalId) { this.internalId = internalId; }
    public String getBlobKey() { return blobKey; }
    public void setBlobKey(String blobKey) { this.blobKey = blobKey; }
    public String getContentType() { return contentType; }
    public void setContentType(String contentType) { this.contentType = contentType; }
    public String getOriginalFilename() { return originalFilename; }
    public void setOriginalFilename(String originalFilename) { this.originalFilename = originalFilename; }
    public long getSizeBytes() { return sizeBytes; }
    public void setSizeBytes(long sizeBytes) { this.sizeBytes = sizeBytes; }
}
