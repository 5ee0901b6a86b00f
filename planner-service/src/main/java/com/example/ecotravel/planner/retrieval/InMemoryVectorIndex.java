package com.example.ecotravel.planner.retrieval;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copy-on-write in-memory index. Each write publishes a new snapshot; readers score against
 * whichever snapshot they picked up and are never blocked.
 */
@Component
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    static final Comparator<ScoredChunk> RANKING = Comparator
            .comparingDouble(ScoredChunk::getSimilarity).reversed()
            .thenComparing(ScoredChunk::getId);

    private volatile Map<String, DocumentChunk> snapshot = Map.of();

    @Override
    public List<ScoredChunk> query(float[] vector, int k) {
        if (k <= 0) return List.of();
        Map<String, DocumentChunk> current = snapshot;
        if (current.isEmpty()) return List.of();
        Embedding query = Embedding.from(vector);
        List<ScoredChunk> scored = new ArrayList<>(current.size());
        for (DocumentChunk chunk : current.values()) {
            float[] v = chunk.vectorView();
            if (v.length != vector.length) {
                log.warn("[InMemoryVectorIndex] Skipping {}: dimension {} != query dimension {}", chunk.getId(), v.length, vector.length);
                continue;
            }
            scored.add(new ScoredChunk(chunk, CosineSimilarity.between(query, Embedding.from(v))));
        }
        scored.sort(RANKING);
        return scored.size() > k ? List.copyOf(scored.subList(0, k)) : List.copyOf(scored);
    }

    @Override
    public synchronized void upsert(String id, float[] vector, String text, Map<String, Object> metadata) {
        Map<String, DocumentChunk> next = new LinkedHashMap<>(snapshot);
        next.put(id, new DocumentChunk(id, vector, text, metadata));
        snapshot = Map.copyOf(next);
    }

    /** Publishes several chunks as a single snapshot. */
    @Override
    public synchronized void upsertAll(List<DocumentChunk> chunks) {
        Map<String, DocumentChunk> next = new LinkedHashMap<>(snapshot);
        for (DocumentChunk c : chunks) next.put(c.getId(), c);
        snapshot = Map.copyOf(next);
        log.debug("[InMemoryVectorIndex] Published snapshot with {} chunks", next.size());
    }

    @Override
    public int size() {
        return snapshot.size();
    }
}
