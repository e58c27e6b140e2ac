package com.example.embeddingindex;

import jakarta.persistence.*;

@Entity
@Table(name = "projects")
public class ProjectRecord {

    @Id
    @Column(name = "project_id")
    private String projectId;

    // epoch millis
    @Column(name = "created_at", nullable = false)
    private long createdAt;

    public ProjectRecord() {}

    public ProjectRecord(String projectId, long createdAt) {
        this.projectId = projectId;
        this.createdAt = createdAt;
    }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }
    public long getCreatedAt() { return createdAt; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }
}
