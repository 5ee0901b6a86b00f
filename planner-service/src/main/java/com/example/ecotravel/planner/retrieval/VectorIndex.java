package com.example.ecotravel.planner.retrieval;

import java.util.List;
import java.util.Map;

/**
 * Shared similarity index over document chunks. Reads may run concurrently with writes.
 */
public interface VectorIndex {

    /**
     * Top {@code k} chunks by cosine similarity to {@code vector}, highest first; equal
     * similarities are ordered by chunk id ascending.
     */
    List<ScoredChunk> query(float[] vector, int k);

    /** Inserts or replaces the chunk with the given id. */
    void upsert(String id, float[] vector, String text, Map<String, Object> metadata);

    /** Inserts or replaces several chunks; implementations may publish them together. */
    default void upsertAll(List<DocumentChunk> chunks) {
        for (DocumentChunk c : chunks) upsert(c.getId(), c.getVector(), c.getText(), c.getMetadata());
    }

    int size();
}
