package com.example.ecotravel.planner.retrieval;

import com.example.ecotravel.planner.agent.TravelKnowledgeAgent;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class LlmGroundedAnswerGenerator implements GroundedAnswerGenerator {

    static final String CHUNK_SEPARATOR = "\n\n---\n\n";

    private final TravelKnowledgeAgent agent;

    public LlmGroundedAnswerGenerator(TravelKnowledgeAgent agent) {
        this.agent = agent;
    }

    @Override
    public String generate(String question, List<ScoredChunk> context) {
        return agent.answer(renderContext(context), question);
    }

    static String renderContext(List<ScoredChunk> context) {
        StringBuilder sb = new StringBuilder();
        for (ScoredChunk c : context) {
            if (sb.length() > 0) sb.append(CHUNK_SEPARATOR);
            sb.append(c.getText());
        }
        return sb.toString();
    }
}
