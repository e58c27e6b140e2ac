package com.example.embeddingindex;

import org.springframework.data.jpa.repository.JpaRepository;

public interface VectorRepository extends JpaRepository<VectorRecord, Long> {
}
