package com.example.ecotravel.planner.domain;

/**
 * Typed failure kinds surfaced by tools, the retrieval pipeline and the clarification loop.
 */
public enum ErrorKind {
    UNKNOWN_INTENT,
    INCOMPLETE_INPUT,
    TOOL_TIMEOUT,
    TOOL_UNAVAILABLE,
    EMPTY_INDEX,
    NO_RELEVANT_CONTEXT,
    CLARIFICATION_EXHAUSTED
}
