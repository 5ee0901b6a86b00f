package com.example.ecotravel.planner.api;

import com.example.ecotravel.planner.retrieval.KnowledgeDocument;
import com.example.ecotravel.planner.retrieval.KnowledgeIngestionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Administrative access to the knowledge index. */
@RestController
@RequestMapping("/api/knowledge")
public class KnowledgeController {

    private final KnowledgeIngestionService ingestion;

    public KnowledgeController(KnowledgeIngestionService ingestion) {
        this.ingestion = ingestion;
    }

    @PostMapping("/documents")
    public ResponseEntity<Map<String, Object>> ingest(@RequestBody(required = false) List<KnowledgeDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            throw new IllegalArgumentException("Please provide at least one document.");
        }
        int chunks = ingestion.ingest(documents);
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("documents", documents.size());
        resp.put("chunks", chunks);
        resp.put("indexSize", ingestion.indexSize());
        return ResponseEntity.ok(resp);
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("indexSize", ingestion.indexSize());
        return resp;
    }
}
