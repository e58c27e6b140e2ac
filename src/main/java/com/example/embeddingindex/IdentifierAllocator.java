package com.example.embeddingindex;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Hands out internal ids for (project, item) pairs. Ids come from a database
 * sequence, so a released id is never handed out again.
 */
@Component
public class IdentifierAllocator {

    private final ProjectRepository projects;
    private final IdentityRepository identities;
    private final JdbcTemplate jdbc;
    private final StoreLock storeLock;

    public IdentifierAllocator(ProjectRepository projects, IdentityRepository identities,
                               JdbcTemplate jdbc, StoreLock storeLock) {
        this.projects = projects;
        this.identities = identities;
        this.jdbc = jdbc;
        this.storeLock = storeLock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void ensureProject(String projectId) {
        storeLock.requireHeld();
        if (!projects.existsById(projectId)) {
            projects.save(new ProjectRecord(projectId, System.currentTimeMillis()));
        }
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public long resolveOrCreate(String projectId, String itemId) {
        storeLock.requireHeld();
        Optional<IdentityRecord> existing = identities.findByProjectIdAndItemId(projectId, itemId);
        if (existing.isPresent()) return existing.get().getInternalId();
        ensureProject(projectId);
        Long next = jdbc.queryForObject("SELECT NEXT VALUE FOR internal_id_seq", Long.class);
        if (next == null) throw new IllegalStateException("internal_id_seq returned no value");
        identities.save(new IdentityRecord(next, projectId, itemId));
        return next;
    }

    @Transactional(readOnly = true)
    public Optional<Long> resolve(String projectId, String itemId) {
        return identities.findByProjectIdAndItemId(projectId, itemId).map(IdentityRecord::getInternalId);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void release(long internalId) {
        storeLock.requireHeld();
        identities.deleteById(internalId);
    }
}
