package com.example.embeddingindex;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface IdentityRepository extends JpaRepository<IdentityRecord, Long> {

    Optional<IdentityRecord> findByProjectIdAndItemId(String projectId, String itemId);

    List<IdentityRecord> findByProjectIdOrderByItemIdAsc(String projectId);

    @Query("select i.internalId from IdentityRecord i where i.projectId = :projectId")
    List<Long> findInternalIdsByProjectId(@Param("projectId") String projectId);
}
