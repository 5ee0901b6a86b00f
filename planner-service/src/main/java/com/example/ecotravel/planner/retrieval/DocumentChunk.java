package com.example.ecotravel.planner.retrieval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One indexed piece of knowledge. Immutable once indexed. */
public final class DocumentChunk {
    private final String id;
    private final float[] vector;
    private final String text;
    private final Map<String, Object> metadata;

    public DocumentChunk(String id, float[] vector, String text, Map<String, Object> metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.vector = Objects.requireNonNull(vector, "vector").clone();
        this.text = text == null ? "" : text;
        this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String getId() { return id; }
    public float[] getVector() { return vector.clone(); }
    float[] vectorView() { return vector; }
    public String getText() { return text; }
    public Map<String, Object> getMetadata() { return metadata; }

    @Override
    public String toString() {
        return "DocumentChunk{" + id + ", " + text.length() + " chars}";
    }
}
