package com.example.ecotravel.planner.retrieval;

import com.example.ecotravel.planner.config.PlannerRetrievalProperties;
import com.example.ecotravel.planner.domain.ErrorKind;
import com.example.ecotravel.planner.support.ExternalCallGuard;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Answers open-domain travel questions from the knowledge index:
 * embed the query, take the top-k chunks, assemble a bounded context, generate a grounded answer.
 *
 * The first three steps are deterministic for fixed index contents, query, k and threshold.
 * No answer is generated when the index is empty or nothing relevant enough was found.
 */
@Service
public class RetrievalPipeline {

    private static final Logger log = LoggerFactory.getLogger(RetrievalPipeline.class);

    private final EmbeddingModel embeddingModel;
    private final VectorIndex index;
    private final GroundedAnswerGenerator generator;
    private final ExternalCallGuard guard;
    private final PlannerRetrievalProperties props;

    public RetrievalPipeline(EmbeddingModel embeddingModel, VectorIndex index, GroundedAnswerGenerator generator,
                             ExternalCallGuard guard, PlannerRetrievalProperties props) {
        this.embeddingModel = embeddingModel;
        this.index = index;
        this.generator = generator;
        this.guard = guard;
        this.props = props;
    }

    public RetrievalResult answer(String question) {
        Selection selection;
        try {
            selection = retrieve(question);
        } catch (TimeoutException e) {
            return RetrievalResult.failed(ErrorKind.TOOL_TIMEOUT);
        } catch (ExecutionException e) {
            log.warn("[RetrievalPipeline] Retrieval failed: {}", String.valueOf(e.getCause()));
            return RetrievalResult.failed(ErrorKind.TOOL_UNAVAILABLE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RetrievalResult.failed(ErrorKind.TOOL_UNAVAILABLE);
        }
        if (selection.getFailure() != null) {
            log.debug("[RetrievalPipeline] Ungrounded ({}), best similarity {}", selection.getFailure(), selection.getBestSimilarity());
            return RetrievalResult.ungrounded(selection.getFailure(), selection.getBestSimilarity());
        }

        List<ScoredChunk> context = selection.getContext();
        try {
            String answer = guard.call("generate", () -> generator.generate(question, context), props.getGenerationTimeoutMs());
            if (answer == null || answer.isBlank()) {
                log.warn("[RetrievalPipeline] Generator returned an empty answer");
                return RetrievalResult.failed(ErrorKind.TOOL_UNAVAILABLE);
            }
            return RetrievalResult.grounded(answer.trim(), context, selection.getBestSimilarity());
        } catch (TimeoutException e) {
            return RetrievalResult.failed(ErrorKind.TOOL_TIMEOUT);
        } catch (ExecutionException e) {
            log.warn("[RetrievalPipeline] Generation failed: {}", String.valueOf(e.getCause()));
            return RetrievalResult.failed(ErrorKind.TOOL_UNAVAILABLE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RetrievalResult.failed(ErrorKind.TOOL_UNAVAILABLE);
        }
    }

    /**
     * Embedding, similarity search and context assembly, without generation.
     */
    public Selection retrieve(String question) throws TimeoutException, ExecutionException, InterruptedException {
        if (index.size() == 0) {
            return Selection.failure(ErrorKind.EMPTY_INDEX, Double.NaN);
        }
        float[] vector = guard.call("embed", () -> embed(question), props.getEmbeddingTimeoutMs());
        List<ScoredChunk> ranked = guard.call("vector-query", () -> index.query(vector, props.getTopK()), props.getQueryTimeoutMs());
        if (ranked.isEmpty()) {
            return Selection.failure(ErrorKind.EMPTY_INDEX, Double.NaN);
        }
        double best = ranked.get(0).getSimilarity();
        if (best < props.getRelevanceThreshold()) {
            return Selection.failure(ErrorKind.NO_RELEVANT_CONTEXT, best);
        }
        List<ScoredChunk> relevant = new ArrayList<>();
        for (ScoredChunk c : ranked) {
            if (c.getSimilarity() >= props.getRelevanceThreshold()) relevant.add(c);
        }
        List<ScoredChunk> context = assembleContext(relevant, props.getMaxContextChars());
        if (context.isEmpty()) {
            return Selection.failure(ErrorKind.NO_RELEVANT_CONTEXT, best);
        }
        log.debug("[RetrievalPipeline] Selected {} of {} chunks, best similarity {}", context.size(), ranked.size(), best);
        return Selection.of(context, best);
    }

    /**
     * Takes chunks in rank order until the next one would push the total text length past
     * {@code maxChars}. Chunks are never truncated and nothing after the first overflow is taken.
     */
    public static List<ScoredChunk> assembleContext(List<ScoredChunk> ranked, int maxChars) {
        List<ScoredChunk> out = new ArrayList<>();
        int used = 0;
        for (ScoredChunk c : ranked) {
            int len = c.getText().length();
            if (used + len > maxChars) break;
            out.add(c);
            used += len;
        }
        return out;
    }

    private float[] embed(String text) {
        Response<Embedding> response = embeddingModel.embed(text);
        if (response == null || response.content() == null) {
            throw new IllegalStateException("Embedding model returned no vector");
        }
        return response.content().vector();
    }

    /** Context picked for one question, or the reason there is none. */
    public static final class Selection {
        private final List<ScoredChunk> context;
        private final ErrorKind failure;
        private final double bestSimilarity;

        private Selection(List<ScoredChunk> context, ErrorKind failure, double bestSimilarity) {
            this.context = context;
            this.failure = failure;
            this.bestSimilarity = bestSimilarity;
        }

        static Selection of(List<ScoredChunk> context, double best) {
            return new Selection(List.copyOf(context), null, best);
        }

        static Selection failure(ErrorKind kind, double best) {
            return new Selection(List.of(), kind, best);
        }

        public List<ScoredChunk> getContext() { return context; }
        public ErrorKind getFailure() { return failure; }
        public double getBestSimilarity() { return bestSimilarity; }
    }
}
