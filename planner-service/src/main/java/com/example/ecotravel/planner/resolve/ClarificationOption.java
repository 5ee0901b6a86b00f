package com.example.ecotravel.planner.resolve;

import com.example.ecotravel.planner.domain.Candidate;

/**
 * A candidate offered back to the user, with a label that distinguishes it from the
 * other offered candidates (e.g. "London, Ontario").
 */
public final class ClarificationOption {
    private final Candidate candidate;
    private final String label;

    public ClarificationOption(Candidate candidate, String label) {
        this.candidate = candidate;
        this.label = label;
    }

    public Candidate getCandidate() { return candidate; }
    public String getLabel() { return label; }

    @Override
    public String toString() {
        return label + " [" + candidate.getId() + "]";
    }
}
