package com.example.ecotravel.planner.config;

import com.example.ecotravel.planner.retrieval.KnowledgeDocument;
import com.example.ecotravel.planner.retrieval.KnowledgeIngestionService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads the bundled sustainable-travel knowledge base into the index on startup, off the main thread.
 */
@Configuration
public class KnowledgeDataSeeder {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeDataSeeder.class);

    @Bean
    CommandLineRunner seedKnowledge(KnowledgeIngestionService ingestion, PlannerRetrievalProperties props,
                                    ResourceLoader resourceLoader, ObjectMapper mapper) {
        return args -> {
            if (!props.isSeedOnStartup()) {
                log.info("[KnowledgeDataSeeder] Seeding disabled");
                return;
            }
            Thread t = new Thread(() -> seed(ingestion, resourceLoader.getResource(props.getSeedResource()), mapper),
                    "knowledge-seeder");
            t.setDaemon(true);
            t.start();
        };
    }

    static int seed(KnowledgeIngestionService ingestion, Resource resource, ObjectMapper mapper) {
        if (ingestion.indexSize() > 0) {
            log.info("[KnowledgeDataSeeder] Skipping seed: {} chunks already indexed", ingestion.indexSize());
            return 0;
        }
        List<KnowledgeDocument> docs;
        try (InputStream in = resource.getInputStream()) {
            docs = mapper.readValue(in, new TypeReference<List<KnowledgeDocument>>() {});
        } catch (IOException e) {
            log.warn("[KnowledgeDataSeeder] Cannot read {}: {}", resource.getDescription(), e.toString());
            return 0;
        }
        try {
            int chunks = ingestion.ingest(docs);
            log.info("[KnowledgeDataSeeder] Seeded {} documents ({} chunks)", docs.size(), chunks);
            return chunks;
        } catch (RuntimeException e) {
            log.warn("[KnowledgeDataSeeder] Seeding failed, knowledge questions will go unanswered until documents are ingested: {}", e.toString());
            return 0;
        }
    }
}
