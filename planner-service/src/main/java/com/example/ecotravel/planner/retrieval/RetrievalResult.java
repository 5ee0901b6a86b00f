package com.example.ecotravel.planner.retrieval;

import com.example.ecotravel.planner.domain.ErrorKind;

import java.util.List;

/**
 * Outcome of one knowledge query. A grounded result carries the generated answer and the
 * context it was generated from; every other result carries an error kind and no answer.
 */
public final class RetrievalResult {

    public enum Status { GROUNDED, UNGROUNDED, FAILED }

    private final Status status;
    private final ErrorKind errorKind;
    private final List<ScoredChunk> context;
    private final String answer;
    private final double bestSimilarity;

    private RetrievalResult(Status status, ErrorKind errorKind, List<ScoredChunk> context, String answer, double bestSimilarity) {
        this.status = status;
        this.errorKind = errorKind;
        this.context = context == null ? List.of() : List.copyOf(context);
        this.answer = answer;
        this.bestSimilarity = bestSimilarity;
    }

    public static RetrievalResult grounded(String answer, List<ScoredChunk> context, double bestSimilarity) {
        return new RetrievalResult(Status.GROUNDED, null, context, answer, bestSimilarity);
    }

    /** Nothing relevant to answer from: {@code EMPTY_INDEX} or {@code NO_RELEVANT_CONTEXT}. */
    public static RetrievalResult ungrounded(ErrorKind kind, double bestSimilarity) {
        return new RetrievalResult(Status.UNGROUNDED, kind, List.of(), null, bestSimilarity);
    }

    /** A collaborator timed out or failed. */
    public static RetrievalResult failed(ErrorKind kind) {
        return new RetrievalResult(Status.FAILED, kind, List.of(), null, Double.NaN);
    }

    public Status getStatus() { return status; }
    public ErrorKind getErrorKind() { return errorKind; }
    public List<ScoredChunk> getContext() { return context; }
    public String getAnswer() { return answer; }
    public double getBestSimilarity() { return bestSimilarity; }
    public boolean isGrounded() { return status == Status.GROUNDED; }

    @Override
    public String toString() {
        return "RetrievalResult{" + status + (errorKind != null ? " " + errorKind : "") + ", context=" + context + "}";
    }
}
