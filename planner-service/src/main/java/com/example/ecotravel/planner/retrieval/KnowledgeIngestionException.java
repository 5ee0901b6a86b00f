package com.example.ecotravel.planner.retrieval;

public class KnowledgeIngestionException extends RuntimeException {
    public KnowledgeIngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
