package com.example.embeddingindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keeps the vector index, the vector ledger, the identity mapping and the item
 * records consistent. Every public operation runs under the {@link StoreLock};
 * writes run in one database transaction whose last step mutates the index, and
 * the index change is undone when the transaction does not commit.
 */
@Service
public class EmbeddingStore implements RecordStore, ScopedSearch {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingStore.class);

    private final VectorIndex vectorIndex;
    private final VectorRepository vectors;
    private final ItemRecordRepository records;
    private final IdentityRepository identities;
    private final ProjectRepository projects;
    private final IdentifierAllocator allocator;
    private final StoreLock storeLock;
    private final TransactionTemplate tx;

    @Value("${embeddingindex.rebuild.page-size:1000}")
    private int rebuildPageSize = 1000;

    private volatile int dimension = -1;

    public EmbeddingStore(VectorIndex vectorIndex, VectorRepository vectors, ItemRecordRepository records,
                          IdentityRepository identities, ProjectRepository projects,
                          IdentifierAllocator allocator, StoreLock storeLock, TransactionTemplate tx) {
        this.vectorIndex = vectorIndex;
        this.vectors = vectors;
        this.records = records;
        this.identities = identities;
        this.projects = projects;
        this.allocator = allocator;
        this.storeLock = storeLock;
        this.tx = tx;
    }

    /**
     * Fixes the dimension and brings the index in line with the ledger. Called
     * once the schema has been opened.
     */
    public void open(int dimension) {
        try (StoreLock.Guard ignored = storeLock.acquire()) {
            this.dimension = dimension;
            vectorIndex.reset(dimension);
            long ledgerRows = vectors.count();
            if (ledgerRows > 0) {
                int n = rebuildLocked();
                log.info("Opened embedding store: dimension={} rebuilt {} of {} ledger rows", dimension, n, ledgerRows);
            } else {
                log.info("Opened embedding store: dimension={} (empty)", dimension);
            }
        } catch (DataAccessException e) {
            throw new StorageIOException("Failed to open embedding store", e);
        }
    }

    public int getDimension() {
        return dimension;
    }

    @Override
    public StoredItem upsertItem(StoredItem item, float[] embedding) {
        String projectId = Identifiers.requireProjectId(item.getProjectId());
        String itemId = Identifiers.requireItemId(item.getItemId());
        requireOpen();
        if (embedding == null) throw new IllegalArgumentException("embedding is required");
        if (embedding.length != dimension) throw new DimensionMismatchException(dimension, embedding.length);
        VectorCodec.requireUsable(embedding);
        if (item.getBlobKey() == null || item.getContentType() == null) {
            throw new InvalidRequestException("INVALID_RECORD", "blob key and content type are required");
        }

        try (StoreLock.Guard ignored = storeLock.acquire()) {
            IndexUndo undo = new IndexUndo();
            try {
                tx.executeWithoutResult(status -> {
                    long id = allocator.resolveOrCreate(projectId, itemId);
                    vectors.save(new VectorRecord(id, VectorCodec.encode(embedding)));
                    records.save(new ItemRecord(id, item));
                    records.flush();
                    undo.capture(id, vectorIndex.get(id).orElse(null));
                    vectorIndex.upsert(id, embedding);
                });
            } catch (RuntimeException e) {
                undo.revert(vectorIndex);
                throw translate("upsert " + projectId + "/" + itemId, e);
            }
        }
        return new StoredItem(projectId, itemId, item.getBlobKey(), item.getContentType(),
                item.getOriginalFilename(), item.getSizeBytes());
    }

    @Override
    public Optional<StoredItem> getRecord(String projectId, String itemId) {
        try (StoreLock.Guard ignored = storeLock.acquire()) {
            Optional<IdentityRecord> identity = identities.findByProjectIdAndItemId(projectId, itemId);
            if (identity.isEmpty()) return Optional.empty();
            return records.findById(identity.get().getInternalId()).map(r -> r.toStoredItem(identity.get()));
        } catch (DataAccessException e) {
            throw new StorageIOException("Failed to read " + projectId + "/" + itemId, e);
        }
    }

    @Override
    public List<StoredItem> listRecords(String projectId) {
        try (StoreLock.Guard ignored = storeLock.acquire()) {
            List<IdentityRecord> ids = identities.findByProjectIdOrderByItemIdAsc(projectId);
            if (ids.isEmpty()) return Collections.emptyList();
            Map<Long, ItemRecord> byId = byInternalId(ids.stream().map(IdentityRecord::getInternalId).collect(Collectors.toList()));
            List<StoredItem> out = new ArrayList<>(ids.size());
            for (IdentityRecord identity : ids) {
                ItemRecord r = byId.get(identity.getInternalId());
                if (r != null) out.add(r.toStoredItem(identity));
            }
            return out;
        } catch (DataAccessException e) {
            throw new StorageIOException("Failed to list project " + projectId, e);
        }
    }

    @Override
    public boolean deleteItem(String projectId, String itemId) {
        try (StoreLock.Guard ignored = storeLock.acquire()) {
            IndexUndo undo = new IndexUndo();
            try {
                Boolean existed = tx.execute(status -> {
                    Optional<IdentityRecord> identity = identities.findByProjectIdAndItemId(projectId, itemId);
                    if (identity.isEmpty()) return false;
                    long id = identity.get().getInternalId();
                    records.deleteById(id);
                    vectors.deleteById(id);
                    allocator.release(id);
                    identities.flush();
                    undo.capture(id, vectorIndex.get(id).orElse(null));
                    vectorIndex.delete(id);
                    return true;
                });
                return Boolean.TRUE.equals(existed);
            } catch (RuntimeException e) {
                undo.revert(vectorIndex);
                throw translate("delete " + projectId + "/" + itemId, e);
            }
        }
    }

    @Override
    public boolean projectExists(String projectId) {
        try (StoreLock.Guard ignored = storeLock.acquire()) {
            return projects.existsById(projectId);
        } catch (DataAccessException e) {
            throw new StorageIOException("Failed to look up project " + projectId, e);
        }
    }

    @Override
    public List<SearchHit> search(String projectId, float[] query, int k) {
        requireOpen();
        if (query == null) throw new IllegalArgumentException("query is required");
        if (query.length != dimension) throw new DimensionMismatchException(dimension, query.length);
        if (k <= 0) return Collections.emptyList();

        try (StoreLock.Guard ignored = storeLock.acquire()) {
            Set<Long> members = new HashSet<>(identities.findInternalIdsByProjectId(projectId));
            if (members.isEmpty()) return Collections.emptyList();
            if (vectorIndex.size() == 0 && vectors.count() > 0) {
                log.warn("Vector index is empty but the ledger is not; rebuilding before search");
                rebuildLocked();
            }
            List<Neighbor> neighbors = vectorIndex.search(query, k, members::contains);
            if (neighbors.isEmpty()) return Collections.emptyList();

            List<Long> ids = neighbors.stream().map(Neighbor::getInternalId).collect(Collectors.toList());
            Map<Long, IdentityRecord> identityById = identities.findAllById(ids).stream()
                    .collect(Collectors.toMap(IdentityRecord::getInternalId, Function.identity()));
            Map<Long, ItemRecord> recordById = byInternalId(ids);
            List<SearchHit> hits = new ArrayList<>(neighbors.size());
            for (Neighbor n : neighbors) {
                IdentityRecord identity = identityById.get(n.getInternalId());
                ItemRecord record = recordById.get(n.getInternalId());
                if (identity == null || record == null) {
                    log.warn("Index returned id {} with no identity or record; skipping", n.getInternalId());
                    continue;
                }
                hits.add(new SearchHit(record.toStoredItem(identity), n.getSimilarity()));
            }
            return hits;
        } catch (DataAccessException e) {
            throw new StorageIOException("Search failed for project " + projectId, e);
        }
    }

    /**
     * Clears the live index and reinserts every ledger row.
     *
     * @return number of vectors indexed
     */
    public int rebuildFromLedger() {
        requireOpen();
        try (StoreLock.Guard ignored = storeLock.acquire()) {
            int n = rebuildLocked();
            log.info("Rebuilt vector index from ledger: {} vectors", n);
            return n;
        } catch (DataAccessException e) {
            throw new StorageIOException("Failed to rebuild vector index", e);
        }
    }

    // paged scan so the whole ledger is never loaded at once
    private int rebuildLocked() {
        vectorIndex.clear();
        int added = 0;
        int page = 0;
        while (true) {
            Page<VectorRecord> p = vectors.findAll(PageRequest.of(page, rebuildPageSize, Sort.by("internalId")));
            if (!p.hasContent()) break;
            for (VectorRecord r : p.getContent()) {
                float[] v = VectorCodec.decode(r.getEmbedding());
                if (v.length != dimension) {
                    log.warn("Skipping ledger row {}: dimension {} != {}", r.getInternalId(), v.length, dimension);
                    continue;
                }
                try {
                    vectorIndex.upsert(r.getInternalId(), v);
                } catch (CapacityExceededException e) {
                    log.error("Vector index capacity is below the ledger size: indexed {} of {} ledger rows. "
                            + "Raise hnsw.max.items and rebuild; vectors past the limit are not searchable",
                            added, vectors.count());
                    return added;
                }
                added++;
            }
            if (!p.hasNext()) break;
            page++;
        }
        return added;
    }

    public StoreStats stats() {
        try (StoreLock.Guard ignored = storeLock.acquire()) {
            return new StoreStats(projects.count(), records.count(), vectors.count(), vectorIndex.size(), dimension);
        } catch (DataAccessException e) {
            throw new StorageIOException("Failed to read store stats", e);
        }
    }

    private Map<Long, ItemRecord> byInternalId(List<Long> ids) {
        return records.findAllById(ids).stream()
                .collect(Collectors.toMap(ItemRecord::getInternalId, Function.identity()));
    }

    private void requireOpen() {
        if (dimension < 1) throw new IllegalStateException("embedding store has not been opened");
    }

    private static RuntimeException translate(String what, RuntimeException e) {
        if (e instanceof EmbeddingIndexException) return e;
        if (e instanceof DataAccessException || e instanceof TransactionException) {
            return new StorageIOException("Failed to " + what, e);
        }
        return e;
    }

    // what the index held for an id before a write touched it
    private static final class IndexUndo {
        private boolean touched;
        private long id;
        private float[] previous;

        void capture(long id, float[] previous) {
            this.touched = true;
            this.id = id;
            this.previous = previous;
        }

        void revert(VectorIndex index) {
            if (!touched) return;
            try {
                if (previous != null) {
                    index.upsert(id, previous);
                } else {
                    index.delete(id);
                }
            } catch (RuntimeException e) {
                // the ledger still holds the committed state; a rebuild repairs the index
                log.error("Failed to revert index entry {} after a failed write: {}", id, e.getMessage(), e);
            }
        }
    }
}
