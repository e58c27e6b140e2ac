package com.example.embeddingindex;

import com.github.jelmerk.knn.DistanceFunctions;
import com.github.jelmerk.knn.Item;
import com.github.jelmerk.knn.SearchResult;
import com.github.jelmerk.knn.hnsw.HnswIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongPredicate;

@Service
@Profile("!ann-dev")
public class HnswVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(HnswVectorIndex.class);

    // smallest candidate pool fetched before project filtering
    private static final int MIN_CANDIDATES = 32;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private HnswIndex<Long, float[], LedgerItem, Float> index;
    private volatile int dimension = -1;

    // graph slots consumed since the last build; hnswlib keeps removed nodes in the graph
    private int slotsUsed;

    @Value("${hnsw.m:16}")
    private int m;

    @Value("${hnsw.efConstruction:200}")
    private int efConstruction;

    @Value("${hnsw.ef:64}")
    private int ef;

    @Value("${hnsw.max.items:100000}")
    private int maxItems;

    public HnswVectorIndex() {
    }

    // package-private constructor for tests to configure small HNSW params without a Spring context
    HnswVectorIndex(int m, int efConstruction, int ef, int maxItems) {
        this.m = m;
        this.efConstruction = efConstruction;
        this.ef = ef;
        this.maxItems = maxItems;
    }

    private HnswIndex<Long, float[], LedgerItem, Float> newIndex(int dim) {
        return HnswIndex.newBuilder(dim, DistanceFunctions.FLOAT_COSINE_DISTANCE, maxItems)
                .withM(m)
                .withEf(ef)
                .withEfConstruction(efConstruction)
                .withRemoveEnabled()
                .build();
    }

    @Override
    public void reset(int dimensions) {
        if (dimensions < 1) throw new IllegalArgumentException("dimensions must be >= 1");
        lock.writeLock().lock();
        try {
            this.dimension = dimensions;
            this.index = newIndex(dimensions);
            this.slotsUsed = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int dimensions() {
        return dimension;
    }

    @Override
    public void upsert(long internalId, float[] vector) {
        lock.writeLock().lock();
        try {
            requireOpen();
            if (vector.length != dimension) throw new DimensionMismatchException(dimension, vector.length);
            boolean present = index.get(internalId).isPresent();
            if (present) {
                index.remove(internalId, 0L);
            } else if (index.size() >= maxItems) {
                throw new CapacityExceededException(maxItems);
            }
            if (slotsUsed >= maxItems) compact();
            index.add(new LedgerItem(internalId, Arrays.copyOf(vector, vector.length)));
            slotsUsed++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // rebuild the graph from its live items so slots held by removed nodes become free again
    private void compact() {
        Collection<LedgerItem> live = new ArrayList<>(index.items());
        HnswIndex<Long, float[], LedgerItem, Float> fresh = newIndex(dimension);
        for (LedgerItem it : live) {
            fresh.add(it);
        }
        this.index = fresh;
        this.slotsUsed = live.size();
        log.info("Compacted HNSW index: live={} capacity={}", live.size(), maxItems);
    }

    @Override
    public boolean delete(long internalId) {
        lock.writeLock().lock();
        try {
            if (index == null) return false;
            return index.remove(internalId, 0L);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<float[]> get(long internalId) {
        lock.readLock().lock();
        try {
            if (index == null) return Optional.empty();
            return index.get(internalId).map(it -> Arrays.copyOf(it.vector(), it.vector().length));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Neighbor> search(float[] query, int topK, LongPredicate filter) {
        if (query == null || topK <= 0) return Collections.emptyList();
        lock.readLock().lock();
        try {
            if (index == null || index.size() == 0) return Collections.emptyList();
            if (query.length != dimension) throw new DimensionMismatchException(dimension, query.length);

            int total = index.size();
            int candidates = Math.min(total, Math.max(topK * 4, MIN_CANDIDATES));
            while (true) {
                List<SearchResult<LedgerItem, Float>> results = index.findNearest(query, candidates);
                List<Neighbor> accepted = new ArrayList<>(Math.min(results.size(), topK));
                for (SearchResult<LedgerItem, Float> r : results) {
                    long id = r.item().id();
                    if (filter.test(id)) {
                        accepted.add(new Neighbor(id, 1.0 - r.distance()));
                    }
                }
                if (accepted.size() >= topK || candidates >= total) {
                    accepted.sort(Comparator.comparingDouble(Neighbor::getSimilarity).reversed()
                            .thenComparingLong(Neighbor::getInternalId));
                    return accepted.size() > topK ? new ArrayList<>(accepted.subList(0, topK)) : accepted;
                }
                candidates = (int) Math.min(total, (long) candidates * 2);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            if (dimension > 0) {
                this.index = newIndex(dimension);
                this.slotsUsed = 0;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try {
            return index == null ? 0 : index.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void requireOpen() {
        if (index == null) throw new IllegalStateException("vector index has not been opened");
    }

    public Map<String, Integer> getHnswParams() {
        Map<String, Integer> out = new LinkedHashMap<>();
        out.put("m", m);
        out.put("efConstruction", efConstruction);
        out.put("ef", ef);
        out.put("maxItems", maxItems);
        return out;
    }
}

// ledger row as seen by hnswlib
class LedgerItem implements Item<Long, float[]> {
    private final Long id;
    private final float[] vector;

    LedgerItem(long id, float[] vector) {
        this.id = id;
        this.vector = vector;
    }

    @Override
    public Long id() { return id; }

    @Override
    public float[] vector() { return vector; }

    @Override
    public int dimensions() { return vector.length; }

    @Override
    public long version() { return 0L; }
}
