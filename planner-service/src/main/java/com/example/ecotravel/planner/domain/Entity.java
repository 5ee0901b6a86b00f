package com.example.ecotravel.planner.domain;

import java.util.List;

public final class Entity {
    private final String type;
    private final String role;
    private final String surfaceText;
    private final List<Candidate> candidates;
    private final double confidence;

    public Entity(String type, String role, String surfaceText, List<Candidate> candidates, double confidence) {
        this.type = type;
        this.role = role;
        this.surfaceText = surfaceText;
        this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
        this.confidence = confidence;
    }

    public String getType() { return type; }
    /** Slot role assigned by the NLU (e.g. origin, destination), or {@code null}. */
    public String getRole() { return role; }
    public String getSurfaceText() { return surfaceText; }
    public List<Candidate> getCandidates() { return candidates; }
    public double getConfidence() { return confidence; }

    @Override
    public String toString() {
        return "Entity{" + type + (role != null ? "/" + role : "") + " '" + surfaceText + "' candidates=" + candidates.size() + "}";
    }
}
