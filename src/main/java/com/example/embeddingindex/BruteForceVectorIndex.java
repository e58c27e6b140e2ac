package com.example.embeddingindex;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongPredicate;

/**
 * Exact cosine scan over every stored vector. Slow, but handy for small data
 * sets and for checking HNSW recall.
 */
@Service
@Profile("ann-dev")
public class BruteForceVectorIndex implements VectorIndex {

    private final Map<Long, float[]> store = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile int dimension = -1;

    @Override
    public void reset(int dimensions) {
        if (dimensions < 1) throw new IllegalArgumentException("dimensions must be >= 1");
        lock.writeLock().lock();
        try {
            store.clear();
            this.dimension = dimensions;
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
            if (dimension < 1) throw new IllegalStateException("vector index has not been opened");
            if (vector.length != dimension) throw new DimensionMismatchException(dimension, vector.length);
            store.put(internalId, Arrays.copyOf(vector, vector.length));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(long internalId) {
        lock.writeLock().lock();
        try {
            return store.remove(internalId) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<float[]> get(long internalId) {
        lock.readLock().lock();
        try {
            float[] v = store.get(internalId);
            return v == null ? Optional.empty() : Optional.of(Arrays.copyOf(v, v.length));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Neighbor> search(float[] query, int topK, LongPredicate filter) {
        if (query == null || topK <= 0) return Collections.emptyList();
        lock.readLock().lock();
        try {
            if (store.isEmpty()) return Collections.emptyList();
            if (query.length != dimension) throw new DimensionMismatchException(dimension, query.length);
            List<Neighbor> all = new ArrayList<>();
            for (Map.Entry<Long, float[]> e : store.entrySet()) {
                if (filter.test(e.getKey())) {
                    all.add(new Neighbor(e.getKey(), VectorCodec.cosine(query, e.getValue())));
                }
            }
            all.sort(Comparator.comparingDouble(Neighbor::getSimilarity).reversed()
                    .thenComparingLong(Neighbor::getInternalId));
            return all.size() > topK ? new ArrayList<>(all.subList(0, topK)) : all;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            store.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try { return store.size(); } finally { lock.readLock().unlock(); }
    }
}
