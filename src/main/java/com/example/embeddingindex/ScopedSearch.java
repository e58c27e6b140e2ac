package com.example.embeddingindex;

import java.util.List;

/**
 * Similarity search restricted to one project.
 */
public interface ScopedSearch {

    /**
     * At most {@code k} hits ordered by descending cosine similarity. An
     * unknown or empty project, or {@code k == 0}, gives an empty list.
     */
    List<SearchHit> search(String projectId, float[] query, int k);
}
