package com.example.ecotravel.planner.retrieval;

import java.util.List;

/** Produces an answer to {@code question} using only the given context chunks. */
public interface GroundedAnswerGenerator {
    String generate(String question, List<ScoredChunk> context);
}
