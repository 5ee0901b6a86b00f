package com.example.ecotravel.planner.dialogue;

import com.example.ecotravel.planner.resolve.ClarificationOption;

import java.util.List;

/** A clarification question that is waiting for the user's answer. Immutable. */
public final class PendingClarification {
    private final String slotName;
    private final String surfaceText;
    private final List<ClarificationOption> options;
    private final int failedAttempts;

    public PendingClarification(String slotName, String surfaceText, List<ClarificationOption> options, int failedAttempts) {
        this.slotName = slotName;
        this.surfaceText = surfaceText;
        this.options = List.copyOf(options);
        this.failedAttempts = failedAttempts;
    }

    public PendingClarification withFailedAttempt() {
        return new PendingClarification(slotName, surfaceText, options, failedAttempts + 1);
    }

    public String getSlotName() { return slotName; }
    /** What the user originally said, e.g. "London". */
    public String getSurfaceText() { return surfaceText; }
    public List<ClarificationOption> getOptions() { return options; }
    public int getFailedAttempts() { return failedAttempts; }

    @Override
    public String toString() {
        return "PendingClarification{" + slotName + ", options=" + options + ", failed=" + failedAttempts + "}";
    }
}
