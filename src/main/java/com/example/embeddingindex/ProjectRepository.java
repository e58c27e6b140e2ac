package com.example.embeddingindex;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectRepository extends JpaRepository<ProjectRecord, String> {
}
