package com.example.ecotravel.common.nlu;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One possible real-world resolution of an extracted entity, as reported by the NLU front-end
 * or a gazetteer lookup.
 */
public class NluCandidate {
    private String id;
    private String name;
    private Map<String, Object> attributes = new LinkedHashMap<>();
    private double confidence;

    public NluCandidate() {}

    public NluCandidate(String id, String name, Map<String, Object> attributes, double confidence) {
        this.id = id;
        this.name = name;
        if (attributes != null) this.attributes = new LinkedHashMap<>(attributes);
        this.confidence = confidence;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Map<String, Object> getAttributes() { return attributes; }
    public void setAttributes(Map<String, Object> attributes) { this.attributes = attributes; }
    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }
}
