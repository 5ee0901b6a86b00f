package com.example.ecotravel.planner.retrieval;

import com.example.ecotravel.planner.config.PlannerRetrievalProperties;
import com.example.ecotravel.planner.support.ExternalCallGuard;
import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Administrative write path of the knowledge index: split, embed, upsert.
 * Chunk ids are {@code <documentId>#<segmentIndex>}, so re-ingesting a document replaces its chunks.
 */
@Service
public class KnowledgeIngestionService {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeIngestionService.class);

    private final EmbeddingModel embeddingModel;
    private final VectorIndex index;
    private final ExternalCallGuard guard;
    private final PlannerRetrievalProperties props;

    public KnowledgeIngestionService(EmbeddingModel embeddingModel, VectorIndex index,
                                     ExternalCallGuard guard, PlannerRetrievalProperties props) {
        this.embeddingModel = embeddingModel;
        this.index = index;
        this.guard = guard;
        this.props = props;
    }

    /**
     * @return number of chunks written
     * @throws IllegalArgumentException    a document has no id or no text
     * @throws KnowledgeIngestionException embedding failed or timed out; nothing is written
     */
    public int ingest(List<KnowledgeDocument> documents) {
        if (documents == null || documents.isEmpty()) return 0;
        DocumentSplitter splitter = DocumentSplitters.recursive(props.getChunkSize(), props.getChunkOverlap());

        List<String> ids = new ArrayList<>();
        List<TextSegment> segments = new ArrayList<>();
        List<Map<String, Object>> metadata = new ArrayList<>();
        for (KnowledgeDocument doc : documents) {
            if (doc == null || doc.getId() == null || doc.getId().isBlank()) {
                throw new IllegalArgumentException("Knowledge document id must not be blank");
            }
            if (doc.getText() == null || doc.getText().isBlank()) {
                throw new IllegalArgumentException("Knowledge document '" + doc.getId() + "' has no text");
            }
            List<TextSegment> parts = splitter.split(Document.from(normalize(doc.getText())));
            for (int i = 0; i < parts.size(); i++) {
                ids.add(doc.getId() + "#" + i);
                segments.add(parts.get(i));
                Map<String, Object> meta = new LinkedHashMap<>();
                if (doc.getMetadata() != null) meta.putAll(doc.getMetadata());
                meta.put("source", doc.getId());
                meta.put("segment", i);
                metadata.add(meta);
            }
        }

        List<Embedding> embeddings = embedAll(segments);
        List<DocumentChunk> chunks = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            chunks.add(new DocumentChunk(ids.get(i), embeddings.get(i).vector(), segments.get(i).text(), metadata.get(i)));
        }
        index.upsertAll(chunks);
        log.info("[KnowledgeIngestionService] Ingested {} documents as {} chunks (index size {})",
                documents.size(), chunks.size(), index.size());
        return chunks.size();
    }

    public int indexSize() {
        return index.size();
    }

    private List<Embedding> embedAll(List<TextSegment> segments) {
        long timeoutMs = props.getEmbeddingTimeoutMs() * Math.max(1, segments.size());
        try {
            Response<List<Embedding>> response = guard.call("embed-all", () -> embeddingModel.embedAll(segments), timeoutMs);
            List<Embedding> out = response == null ? null : response.content();
            if (out == null || out.size() != segments.size()) {
                throw new KnowledgeIngestionException("Embedding model returned "
                        + (out == null ? 0 : out.size()) + " vectors for " + segments.size() + " segments", null);
            }
            return out;
        } catch (TimeoutException e) {
            throw new KnowledgeIngestionException("Embedding timed out after " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            throw new KnowledgeIngestionException("Embedding failed: " + e.getCause(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KnowledgeIngestionException("Interrupted while embedding", e);
        }
    }

    // seed texts are wrapped across lines
    private static String normalize(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }
}
