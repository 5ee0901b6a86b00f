package com.example.ecotravel.common.nlu;

import java.util.ArrayList;
import java.util.List;

public class NluEntity {
    private String type;
    private String role;
    private String text;
    private double confidence = 1.0;
    private List<NluCandidate> candidates = new ArrayList<>();

    public NluEntity() {}

    public NluEntity(String type, String role, String text, double confidence, List<NluCandidate> candidates) {
        this.type = type;
        this.role = role;
        this.text = text;
        this.confidence = confidence;
        if (candidates != null) this.candidates = new ArrayList<>(candidates);
    }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }
    public String getText() { return text; }
    public void setText(String text) { this.text = text; }
    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }
    public List<NluCandidate> getCandidates() { return candidates; }
    public void setCandidates(List<NluCandidate> candidates) { this.candidates = candidates; }
}
