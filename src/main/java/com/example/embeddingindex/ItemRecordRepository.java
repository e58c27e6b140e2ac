package com.example.embeddingindex;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ItemRecordRepository extends JpaRepository<ItemRecord, Long> {
}
