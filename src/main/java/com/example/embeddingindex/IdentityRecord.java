package com.example.embeddingindex;

import jakarta.persistence.*;

/**
 * Maps a caller-facing (project, item) pair to the internal id shared by the
 * index, the ledger and the metadata table.
 */
@Entity
@Table(name = "identity_mapping", uniqueConstraints = {
        @UniqueConstraint(name = "uq_identity_project_item", columnNames = {"project_id", "item_id"})
})
public class IdentityRecord {

    @Id
    @Column(name = "internal_id")
    private Long internalId;

    @Column(name = "project_id", nullable = false)
    private String projectId;

    @Column(name = "item_id", nullable = false)
    private String itemId;

    public IdentityRecord() {}

    public IdentityRecord(long internalId, String projectId, String itemId) {
        this.internalId = internalId;
        this.projectId = projectId;
        this.itemId = itemId;
    }

    public Long getInternalId() { return internalId; }
    public void setInternalId(Long internalId) { this.internalId = internalId; }
    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }
    public String getItemId() { return itemId; }
    public void setItemId(String itemId) { this.itemId = itemId; }
}
