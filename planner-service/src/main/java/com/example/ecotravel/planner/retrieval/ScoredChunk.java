package com.example.ecotravel.planner.retrieval;

import java.util.Locale;

/** A chunk with its cosine similarity to the query. */
public final class ScoredChunk {
    private final DocumentChunk chunk;
    private final double similarity;

    public ScoredChunk(DocumentChunk chunk, double similarity) {
        this.chunk = chunk;
        this.similarity = similarity;
    }

    public DocumentChunk getChunk() { return chunk; }
    public double getSimilarity() { return similarity; }

    public String getId() { return chunk.getId(); }
    public String getText() { return chunk.getText(); }

    @Override
    public String toString() {
        return chunk.getId() + "@" + String.format(Locale.ROOT, "%.3f", similarity);
    }
}
