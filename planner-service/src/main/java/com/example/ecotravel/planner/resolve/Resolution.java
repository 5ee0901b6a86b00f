package com.example.ecotravel.planner.resolve;

import com.example.ecotravel.planner.domain.Candidate;

import java.util.List;

/**
 * Outcome of resolving one entity: exactly one of resolved, ambiguous or unresolved.
 */
public final class Resolution {

    public enum Kind { RESOLVED, AMBIGUOUS, UNRESOLVED }

    private static final Resolution UNRESOLVED = new Resolution(Kind.UNRESOLVED, null, List.of());

    private final Kind kind;
    private final Candidate candidate;
    private final List<ClarificationOption> options;

    private Resolution(Kind kind, Candidate candidate, List<ClarificationOption> options) {
        this.kind = kind;
        this.candidate = candidate;
        this.options = options;
    }

    public static Resolution resolved(Candidate candidate) {
        return new Resolution(Kind.RESOLVED, candidate, List.of());
    }

    public static Resolution ambiguous(List<ClarificationOption> options) {
        return new Resolution(Kind.AMBIGUOUS, null, List.copyOf(options));
    }

    public static Resolution unresolved() {
        return UNRESOLVED;
    }

    public Kind getKind() { return kind; }
    public Candidate getCandidate() { return candidate; }
    public List<ClarificationOption> getOptions() { return options; }

    @Override
    public String toString() {
        return switch (kind) {
            case RESOLVED -> "Resolved(" + candidate.getId() + ")";
            case AMBIGUOUS -> "Ambiguous(" + options + ")";
            case UNRESOLVED -> "Unresolved";
        };
    }
}
