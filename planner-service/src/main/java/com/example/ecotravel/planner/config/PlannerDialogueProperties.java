package com.example.ecotravel.planner.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Component
@Validated
@ConfigurationProperties(prefix = "planner.dialogue")
public class PlannerDialogueProperties {
    // lead the top candidate needs over the runner-up to be picked without asking
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceMargin = 0.2;
    @Min(2)
    private int clarificationCandidates = 3;
    @Min(1)
    private int maxClarificationAttempts = 3;
    // answered without resetting slot collection of an in-progress intent
    private List<String> backgroundIntents = new ArrayList<>(List.of("ask_travel_knowledge"));
    // always read as an answer to a pending clarification question
    private List<String> clarificationReplyIntents = new ArrayList<>(List.of("inform", "choose_option"));
    @Min(1)
    private long lockTimeoutMs = 30000;
    @Min(1)
    private long idleTimeoutMinutes = 30;

    public double getConfidenceMargin() { return confidenceMargin; }
    public void setConfidenceMargin(double confidenceMargin) { this.confidenceMargin = confidenceMargin; }
    public int getClarificationCandidates() { return clarificationCandidates; }
    public void setClarificationCandidates(int clarificationCandidates) { this.clarificationCandidates = clarificationCandidates; }
    public int getMaxClarificationAttempts() { return maxClarificationAttempts; }
    public void setMaxClarificationAttempts(int maxClarificationAttempts) { this.maxClarificationAttempts = maxClarificationAttempts; }
    public List<String> getBackgroundIntents() { return backgroundIntents; }
    public void setBackgroundIntents(List<String> backgroundIntents) { this.backgroundIntents = backgroundIntents; }
    public List<String> getClarificationReplyIntents() { return clarificationReplyIntents; }
    public void setClarificationReplyIntents(List<String> clarificationReplyIntents) { this.clarificationReplyIntents = clarificationReplyIntents; }
    public long getLockTimeoutMs() { return lockTimeoutMs; }
    public void setLockTimeoutMs(long lockTimeoutMs) { this.lockTimeoutMs = lockTimeoutMs; }
    public long getIdleTimeoutMinutes() { return idleTimeoutMinutes; }
    public void setIdleTimeoutMinutes(long idleTimeoutMinutes) { this.idleTimeoutMinutes = idleTimeoutMinutes; }
}
