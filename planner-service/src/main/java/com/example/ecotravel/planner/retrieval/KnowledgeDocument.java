package com.example.ecotravel.planner.retrieval;

import java.util.LinkedHashMap;
import java.util.Map;

/** Source document for ingestion, as posted to the knowledge API or loaded from the seed file. */
public class KnowledgeDocument {
    private String id;
    private String text;
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public KnowledgeDocument() {}

    public KnowledgeDocument(String id, String text, Map<String, Object> metadata) {
        this.id = id;
        this.text = text;
        if (metadata != null) this.metadata = new LinkedHashMap<>(metadata);
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getText() { return text; }
    public void setText(String text) { this.text = text; }
    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }
}
