package com.example.embeddingindex;

import java.util.List;
import java.util.Optional;

/**
 * Durable, project-scoped item records with their embeddings.
 */
public interface RecordStore {

    /**
     * Writes the embedding and the record for {@code item} as one atomic unit,
     * creating the project and the internal id on first use.
     */
    StoredItem upsertItem(StoredItem item, float[] embedding);

    Optional<StoredItem> getRecord(String projectId, String itemId);

    /** Records of one project ordered by item id. */
    List<StoredItem> listRecords(String projectId);

    /** @return whether the item existed */
    boolean deleteItem(String projectId, String itemId);

    boolean projectExists(String projectId);
}
