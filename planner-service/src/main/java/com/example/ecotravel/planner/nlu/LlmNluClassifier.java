package com.example.ecotravel.planner.nlu;

import com.example.ecotravel.common.nlu.NluEntity;
import com.example.ecotravel.common.nlu.NluResult;
import com.example.ecotravel.planner.support.ExternalCallGuard;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatLanguageModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Asks the chat model to classify the message as strict JSON. Anything unusable (timeout,
 * malformed JSON, unknown intent) falls back to the rule-based classifier.
 */
public class LlmNluClassifier implements NluClassifier {

    private static final Logger log = LoggerFactory.getLogger(LlmNluClassifier.class);

    private static final Set<String> ENTITY_TYPES = Set.of("place", "date", "transport_mode");

    private final ChatLanguageModel model;
    private final RuleBasedNluClassifier fallback;
    private final ExternalCallGuard guard;
    private final ObjectMapper mapper;
    private final Collection<String> intents;
    private final long timeoutMs;

    public LlmNluClassifier(ChatLanguageModel model, RuleBasedNluClassifier fallback, ExternalCallGuard guard,
                            ObjectMapper mapper, Collection<String> intents, long timeoutMs) {
        this.model = model;
        this.fallback = fallback;
        this.guard = guard;
        this.mapper = mapper;
        this.intents = List.copyOf(intents);
        this.timeoutMs = timeoutMs;
    }

    @Override
    public NluResult classify(String text) {
        if (text == null || text.isBlank()) return NluResult.fallback();
        try {
            String raw = guard.call("nlu", () -> model.generate(prompt(text)), timeoutMs);
            NluResult parsed = parse(raw);
            if (parsed != null) return parsed;
            log.warn("[LlmNluClassifier] Unusable model output, using rules: {}", abbreviate(raw));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[LlmNluClassifier] Interrupted, using rules");
        } catch (TimeoutException | ExecutionException e) {
            log.warn("[LlmNluClassifier] Model classification failed, using rules: {}", e.toString());
        }
        return fallback.classify(text);
    }

    String prompt(String text) {
        return "Classify the travel assistant user message. Reply with JSON only, no prose, in the form "
                + "{\"intent\": string, \"entities\": [{\"type\": string, \"role\": string or null, \"text\": string}]}. "
                + "intent is one of " + intents + ", or \"inform\" when the message only gives information, "
                + "or \"choose_option\" when it picks an option from a list. "
                + "Entity types: place (role origin or destination), date (YYYY-MM-DD), transport_mode "
                + "(train, bus, car, ferry, flight, bike, walk). Message: " + text;
    }

    NluResult parse(String raw) {
        if (raw == null) return null;
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) return null;
        JsonNode root;
        try {
            root = mapper.readTree(raw.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            return null;
        }
        String intent = root.path("intent").asText("").trim();
        if (!intents.contains(intent) && !"inform".equals(intent) && !"choose_option".equals(intent)) return null;
        List<NluEntity> entities = new ArrayList<>();
        for (JsonNode e : root.path("entities")) {
            String type = e.path("type").asText("").trim();
            String value = e.path("text").asText("").trim();
            if (!ENTITY_TYPES.contains(type) || value.isEmpty()) continue;
            String role = e.path("role").isTextual() ? e.path("role").asText().trim() : null;
            entities.add(new NluEntity(type, role == null || role.isEmpty() ? null : role, value, 1.0, List.of()));
        }
        return new NluResult(intent, entities);
    }

    private static String abbreviate(String s) {
        if (s == null) return "null";
        return s.length() > 200 ? s.substring(0, 200) + "..." : s;
    }
}
