package com.example.embeddingindex;

import jakarta.persistence.*;

/**
 * Ledger row: the authoritative copy of one embedding.
 */
@Entity
@Table(name = "item_vectors")
public class VectorRecord {

    @Id
    @Column(name = "internal_id")
    private Long internalId;

    // D little-endian float32 values, see VectorCodec
    @Column(name = "embedding", nullable = false)
    private byte[] embedding;

    public VectorRecord() {}

    public VectorRecord(long internalId, byte[] embedding) {
        this.internalId = internalId;
        this.embedding = embedding;
    }

    public Long getInternalId() { return internalId; }
    public void setInternalId(Long internalId) { this.internalId = internalId; }
    public byte[] getEmbedding() { return embedding; }
    public void setEmbedding(byte[] embedding) { this.embedding = embedding; }
}
