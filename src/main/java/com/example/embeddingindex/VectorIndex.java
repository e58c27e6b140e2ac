package com.example.embeddingindex;

import java.util.List;
import java.util.Optional;
import java.util.function.LongPredicate;

/**
 * Derived nearest-neighbour structure keyed by internal id. It is a cache over
 * the vector ledger and can be cleared and rebuilt at any time.
 */
public interface VectorIndex {

    /** Drops every entry and fixes the dimension for subsequent inserts. */
    void reset(int dimensions);

    int dimensions();

    void upsert(long internalId, float[] vector);

    /** @return whether the id was a member; removing a non-member is a no-op */
    boolean delete(long internalId);

    Optional<float[]> get(long internalId);

    /**
     * Nearest members accepted by {@code filter}, best first. Never returns
     * more than {@code topK} entries.
     */
    List<Neighbor> search(float[] query, int topK, LongPredicate filter);

    /** Drops every entry, keeping the dimension. */
    void clear();

    long size();
}
