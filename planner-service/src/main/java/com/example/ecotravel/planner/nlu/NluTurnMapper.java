package com.example.ecotravel.planner.nlu;

import com.example.ecotravel.common.nlu.NluCandidate;
import com.example.ecotravel.common.nlu.NluEntity;
import com.example.ecotravel.common.nlu.NluResult;
import com.example.ecotravel.planner.domain.Candidate;
import com.example.ecotravel.planner.domain.Entity;
import com.example.ecotravel.planner.domain.Turn;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns an NLU payload (from the built-in classifiers or an external NLU) into an immutable
 * {@link Turn}. Place entities that arrive without candidates are looked up in the gazetteer.
 */
@Component
public class NluTurnMapper {

    private final PlaceGazetteer gazetteer;

    public NluTurnMapper(PlaceGazetteer gazetteer) {
        this.gazetteer = gazetteer;
    }

    public Turn toTurn(NluResult nlu, String rawText) {
        String intent = nlu == null || nlu.getIntent() == null || nlu.getIntent().isBlank()
                ? NluResult.FALLBACK_INTENT
                : nlu.getIntent().trim();
        List<Entity> entities = new ArrayList<>();
        if (nlu != null && nlu.getEntities() != null) {
            for (NluEntity e : nlu.getEntities()) {
                if (e == null || e.getType() == null) continue;
                entities.add(toEntity(e));
            }
        }
        return new Turn(intent, entities, rawText, Instant.now());
    }

    private Entity toEntity(NluEntity e) {
        List<NluCandidate> source = e.getCandidates();
        if ((source == null || source.isEmpty()) && "place".equals(e.getType())) {
            source = gazetteer.lookup(e.getText());
        }
        List<Candidate> candidates = new ArrayList<>();
        if (source != null) {
            for (NluCandidate c : source) {
                if (c == null || c.getId() == null || c.getId().isBlank()) continue;
                candidates.add(new Candidate(c.getId(), c.getName(), c.getAttributes(), clamp(c.getConfidence())));
            }
        }
        String role = e.getRole() == null || e.getRole().isBlank() ? null : e.getRole().trim();
        return new Entity(e.getType().trim(), role, e.getText(), candidates, clamp(e.getConfidence()));
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
