package com.example.ecotravel.planner.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable record of one user message after classification.
 */
public final class Turn {
    private final String intent;
    private final List<Entity> entities;
    private final String rawText;
    private final Instant timestamp;

    public Turn(String intent, List<Entity> entities, String rawText, Instant timestamp) {
        this.intent = Objects.requireNonNull(intent, "intent");
        this.entities = entities == null ? List.of() : List.copyOf(entities);
        this.rawText = rawText == null ? "" : rawText;
        this.timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public String getIntent() { return intent; }
    public List<Entity> getEntities() { return entities; }
    public String getRawText() { return rawText; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return "Turn{intent=" + intent + ", entities=" + entities + "}";
    }
}
