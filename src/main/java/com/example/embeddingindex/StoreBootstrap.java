package com.example.embeddingindex;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Startup order: probe the embedding dimension, restore a remote snapshot if
 * there is no local store, open the schema, load the index from the ledger,
 * then start periodic backups.
 */
@Slf4j
@Component
public class StoreBootstrap {

    private final EmbeddingGateway embeddings;
    private final SnapshotManager snapshots;
    private final SchemaVersionManager schema;
    private final EmbeddingStore store;
    private final SnapshotScheduler scheduler;

    private SchemaVersionManager.OpenResult openResult;
    private SnapshotManager.RestoreOutcome restoreOutcome;

    public StoreBootstrap(EmbeddingGateway embeddings, SnapshotManager snapshots, SchemaVersionManager schema,
                          EmbeddingStore store, SnapshotScheduler scheduler) {
        this.embeddings = embeddings;
        this.snapshots = snapshots;
        this.schema = schema;
        this.store = store;
        this.scheduler = scheduler;
    }

    @PostConstruct
    public void init() {
        int dimension = embeddings.probeDimension();
        restoreOutcome = snapshots.restoreFromRemoteIfAbsent();
        openResult = schema.openOrInitialize(dimension);
        store.open(dimension);
        scheduler.start();
        log.info("Store ready: dimension={} restore={} schema={}", dimension, restoreOutcome, openResult);
    }

    public SchemaVersionManager.OpenResult getOpenResult() { return openResult; }
    public SnapshotManager.RestoreOutcome getRestoreOutcome() { return restoreOutcome; }
}
