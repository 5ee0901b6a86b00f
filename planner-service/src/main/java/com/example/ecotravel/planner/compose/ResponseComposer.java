package com.example.ecotravel.planner.compose;

import com.example.ecotravel.common.turn.ResponseMessage;
import com.example.ecotravel.planner.dialogue.DialogueAction;
import com.example.ecotravel.planner.domain.ErrorKind;
import com.example.ecotravel.planner.resolve.ClarificationOption;
import com.example.ecotravel.planner.retrieval.RetrievalResult;
import com.example.ecotravel.planner.retrieval.ScoredChunk;
import com.example.ecotravel.planner.slots.SlotDefinition;
import com.example.ecotravel.planner.tools.EmissionsTool;
import com.example.ecotravel.planner.tools.RoutingTool;
import com.example.ecotravel.planner.tools.ToolResult;
import com.example.ecotravel.planner.tools.WeatherTool;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a dialogue action as reply messages. Pure: the same action always yields the same messages.
 * Failures name the capability that failed, never internal details.
 */
@Component
public class ResponseComposer {

    static final String FAILURE_TEXT = "I couldn't complete that, please try again.";
    static final String BUSY_TEXT = "I'm still working on your previous message, please give me a moment.";
    static final String UNKNOWN_TEXT = "Sorry, I didn't understand that. I can plan routes, check the weather at "
            + "your destination, estimate the carbon footprint of a trip or answer sustainable travel questions.";
    static final String NARROWING_TEXT = "Could you narrow it down? For example, ask about a destination, "
            + "getting there by train, or eco-friendly places to stay.";

    private static final Map<String, String> CAPABILITIES = Map.of(
            RoutingTool.NAME, "route planning",
            WeatherTool.NAME, "weather",
            EmissionsTool.NAME, "emissions estimate"
    );

    public List<ResponseMessage> compose(DialogueAction action) {
        List<ResponseMessage> out = new ArrayList<>();
        render(action, out);
        return out;
    }

    private void render(DialogueAction action, List<ResponseMessage> out) {
        switch (action.getKind()) {
            case ASK_FOR_SLOT -> askForSlot(action, out);
            case ASK_CLARIFICATION -> askClarification(action, out);
            case TOOL_RESULT -> toolResult(action.getToolResult(), out);
            case RETRIEVAL_RESULT -> retrievalResult(action.getRetrievalResult(), out);
            case CLARIFICATION_EXHAUSTED -> out.add(ResponseMessage.text(exhaustedText(action.getSlot())));
            case UNKNOWN_INTENT -> out.add(ResponseMessage.text(UNKNOWN_TEXT));
            case CONVERSATIONAL -> out.add(ResponseMessage.text(action.getReply()));
            case FAILURE -> out.add(ResponseMessage.text(FAILURE_TEXT));
            case BUSY -> out.add(ResponseMessage.text(BUSY_TEXT));
        }
        if (action.getResume() != null) {
            render(action.getResume(), out);
        }
    }

    private void askForSlot(DialogueAction action, List<ResponseMessage> out) {
        SlotDefinition slot = action.getSlot();
        StringBuilder sb = new StringBuilder();
        for (String s : action.getUnrecognized()) {
            if (s != null && !s.isBlank()) sb.append("I couldn't find \"").append(s.trim()).append("\". ");
        }
        sb.append(slot.getPrompt() != null ? slot.getPrompt() : "What is your " + slot.getLabel() + "?");
        out.add(ResponseMessage.text(sb.toString()));
    }

    static String exhaustedText(SlotDefinition slot) {
        String hint = switch (slot.getType()) {
            case PLACE -> "Tell me the full name, for example \"London, Ontario\", whenever you're ready.";
            case DATE -> "Tell me the exact date, for example \"2024-05-02\", whenever you're ready.";
            default -> "Tell me your " + slot.getLabel() + " again whenever you're ready.";
        };
        return "I still couldn't tell which " + kindOf(slot) + " you meant for your " + slot.getLabel()
                + ", so I've set that request aside. " + hint;
    }

    private static String kindOf(SlotDefinition slot) {
        return switch (slot.getType()) {
            case PLACE -> "place";
            case DATE -> "date";
            case NUMBER -> "value";
            case TEXT -> slot.getEntityType().replace('_', ' ');
        };
    }

    private void askClarification(DialogueAction action, List<ResponseMessage> out) {
        String what = action.getSurfaceText() != null && !action.getSurfaceText().isBlank()
                ? action.getSurfaceText().trim()
                : "place";
        String question = (action.isRetry() ? "Sorry, I didn't catch which one you meant. " : "")
                + "Which " + what + " do you mean for your " + action.getSlot().getLabel() + "?";
        List<String> labels = new ArrayList<>();
        StringBuilder sb = new StringBuilder(question);
        int i = 1;
        for (ClarificationOption o : action.getOptions()) {
            labels.add(o.getLabel());
            sb.append(i == 1 ? " " : " or ").append(i).append(") ").append(o.getLabel());
            i++;
        }
        out.add(ResponseMessage.choices(sb.toString(), labels));
    }

    private void toolResult(ToolResult result, List<ResponseMessage> out) {
        String capability = CAPABILITIES.getOrDefault(result.getToolName(), "planning");
        if (!result.isSuccess()) {
            out.add(ResponseMessage.text(failureText(capability, result.getErrorKind())));
            return;
        }
        Map<String, Object> payload = result.getPayload();
        Object summary = payload.get("summary");
        if (summary != null) out.add(ResponseMessage.text(String.valueOf(summary)));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tool", result.getToolName());
        data.putAll(payload);
        data.remove("summary");
        out.add(ResponseMessage.data(data));

        String followUp = followUp(result.getToolName(), payload);
        if (followUp != null) out.add(ResponseMessage.text(followUp));
    }

    private void retrievalResult(RetrievalResult result, List<ResponseMessage> out) {
        if (result.isGrounded()) {
            out.add(ResponseMessage.text(result.getAnswer()));
            Set<Object> sources = new LinkedHashSet<>();
            for (ScoredChunk c : result.getContext()) {
                Object source = c.getChunk().getMetadata().get("source");
                sources.add(source != null ? source : c.getId());
            }
            out.add(ResponseMessage.data(Map.of("sources", new ArrayList<>(sources))));
            return;
        }
        ErrorKind kind = result.getErrorKind();
        if (kind == ErrorKind.EMPTY_INDEX) {
            out.add(ResponseMessage.text("My travel knowledge base isn't loaded yet, so I can't answer that reliably right now."));
        } else if (kind == ErrorKind.NO_RELEVANT_CONTEXT) {
            out.add(ResponseMessage.text("I don't have reliable information about that. " + NARROWING_TEXT));
        } else {
            out.add(ResponseMessage.text(failureText("travel knowledge", kind)));
        }
    }

    static String failureText(String capability, ErrorKind kind) {
        if (kind == ErrorKind.TOOL_TIMEOUT) {
            return "Sorry, the " + capability + " service is taking too long right now. Please try again in a moment.";
        }
        if (kind == ErrorKind.TOOL_UNAVAILABLE) {
            return "Sorry, the " + capability + " service isn't available right now. Please try again later.";
        }
        return "Sorry, I couldn't get the " + capability + " done. " + FAILURE_TEXT;
    }

    @SuppressWarnings("unchecked")
    private static String followUp(String tool, Map<String, Object> payload) {
        if (WeatherTool.NAME.equals(tool)) {
            String best = null;
            int bestScore = 0;
            Object s = payload.get("suitability");
            if (s instanceof Map<?, ?> scores) {
                for (Map.Entry<String, Object> e : ((Map<String, Object>) scores).entrySet()) {
                    if (e.getValue() instanceof Number n && n.intValue() > bestScore) {
                        best = e.getKey();
                        bestScore = n.intValue();
                    }
                }
            }
            String lead = best != null && bestScore >= 80 ? "Conditions look great for " + best + ". " : "";
            return lead + "Want me to estimate the carbon footprint of getting there?";
        }
        if (RoutingTool.NAME.equals(tool)) {
            return "Would you like the weather at " + payload.get("destination") + " or the carbon footprint of this trip?";
        }
        if (EmissionsTool.NAME.equals(tool)) {
            Object recs = payload.get("recommendations");
            if (recs instanceof List<?> list && !list.isEmpty()) {
                StringBuilder sb = new StringBuilder();
                for (Object r : list) {
                    if (sb.length() > 0) sb.append(' ');
                    sb.append(r);
                }
                return sb.toString();
            }
        }
        return null;
    }
}
