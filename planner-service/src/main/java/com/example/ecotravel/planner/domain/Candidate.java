package com.example.ecotravel.planner.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A candidate resolution of an entity: a stable external id plus the attributes that tell
 * same-named candidates apart (region, country, population, coordinates).
 */
public final class Candidate {
    private final String id;
    private final String name;
    private final Map<String, Object> attributes;
    private final double confidence;

    public Candidate(String id, String name, Map<String, Object> attributes, double confidence) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name != null ? name : id;
        this.attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.confidence = confidence;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public Map<String, Object> getAttributes() { return attributes; }
    public double getConfidence() { return confidence; }

    public String attribute(String key) {
        Object v = attributes.get(key);
        return v == null ? null : String.valueOf(v);
    }

    /** Numeric attribute value, or {@code null} when absent or not a number. */
    public Double numericAttribute(String key) {
        Object v = attributes.get(key);
        if (v instanceof Number n) return n.doubleValue();
        if (v == null) return null;
        try {
            return Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Candidate other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Candidate{" + id + ", " + name + ", conf=" + confidence + "}";
    }
}
