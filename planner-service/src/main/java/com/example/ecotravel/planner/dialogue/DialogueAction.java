package com.example.ecotravel.planner.dialogue;

import com.example.ecotravel.planner.domain.ErrorKind;
import com.example.ecotravel.planner.resolve.ClarificationOption;
import com.example.ecotravel.planner.retrieval.RetrievalResult;
import com.example.ecotravel.planner.slots.SlotDefinition;
import com.example.ecotravel.planner.tools.ToolResult;

import java.util.List;

/**
 * What the state machine decided to do with a turn, with everything needed to phrase the reply.
 * A background answer carries a {@code resume} action that re-asks for the interrupted collection.
 */
public final class DialogueAction {

    public enum Kind {
        ASK_FOR_SLOT,
        ASK_CLARIFICATION,
        TOOL_RESULT,
        RETRIEVAL_RESULT,
        CLARIFICATION_EXHAUSTED,
        UNKNOWN_INTENT,
        CONVERSATIONAL,
        FAILURE,
        BUSY
    }

    private final Kind kind;
    private final String intent;
    private SlotDefinition slot;
    private String surfaceText;
    private List<ClarificationOption> options = List.of();
    private boolean retry;
    private ToolResult toolResult;
    private RetrievalResult retrievalResult;
    private String reply;
    private List<String> unrecognized = List.of();
    private DialogueAction resume;

    private DialogueAction(Kind kind, String intent) {
        this.kind = kind;
        this.intent = intent;
    }

    public static DialogueAction askForSlot(String intent, SlotDefinition slot, List<String> unrecognized) {
        DialogueAction a = new DialogueAction(Kind.ASK_FOR_SLOT, intent);
        a.slot = slot;
        a.unrecognized = unrecognized == null ? List.of() : List.copyOf(unrecognized);
        return a;
    }

    public static DialogueAction askClarification(String intent, SlotDefinition slot, PendingClarification pending, boolean retry) {
        DialogueAction a = new DialogueAction(Kind.ASK_CLARIFICATION, intent);
        a.slot = slot;
        a.surfaceText = pending.getSurfaceText();
        a.options = pending.getOptions();
        a.retry = retry;
        return a;
    }

    public static DialogueAction toolResult(String intent, ToolResult result) {
        DialogueAction a = new DialogueAction(Kind.TOOL_RESULT, intent);
        a.toolResult = result;
        return a;
    }

    public static DialogueAction retrievalResult(String intent, RetrievalResult result) {
        DialogueAction a = new DialogueAction(Kind.RETRIEVAL_RESULT, intent);
        a.retrievalResult = result;
        return a;
    }

    public static DialogueAction clarificationExhausted(String intent, SlotDefinition slot) {
        DialogueAction a = new DialogueAction(Kind.CLARIFICATION_EXHAUSTED, intent);
        a.slot = slot;
        return a;
    }

    public static DialogueAction unknownIntent(String intent) {
        return new DialogueAction(Kind.UNKNOWN_INTENT, intent);
    }

    public static DialogueAction conversational(String intent, String reply) {
        DialogueAction a = new DialogueAction(Kind.CONVERSATIONAL, intent);
        a.reply = reply;
        return a;
    }

    public static DialogueAction failure() {
        return new DialogueAction(Kind.FAILURE, null);
    }

    public static DialogueAction busy() {
        return new DialogueAction(Kind.BUSY, null);
    }

    /** Same action, followed by {@code next} in the reply. */
    public DialogueAction thenResume(DialogueAction next) {
        this.resume = next;
        return this;
    }

    public Kind getKind() { return kind; }
    public String getIntent() { return intent; }
    public SlotDefinition getSlot() { return slot; }
    public String getSurfaceText() { return surfaceText; }
    public List<ClarificationOption> getOptions() { return options; }
    /** The previous answer did not match any option. */
    public boolean isRetry() { return retry; }
    public ToolResult getToolResult() { return toolResult; }
    public RetrievalResult getRetrievalResult() { return retrievalResult; }
    public String getReply() { return reply; }
    /** Surface texts the user gave that could not be resolved to anything. */
    public List<String> getUnrecognized() { return unrecognized; }
    public DialogueAction getResume() { return resume; }

    public ErrorKind getErrorKind() {
        if (kind == Kind.CLARIFICATION_EXHAUSTED) return ErrorKind.CLARIFICATION_EXHAUSTED;
        if (kind == Kind.UNKNOWN_INTENT) return ErrorKind.UNKNOWN_INTENT;
        if (toolResult != null) return toolResult.getErrorKind();
        if (retrievalResult != null) return retrievalResult.getErrorKind();
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DialogueAction{").append(kind);
        if (intent != null) sb.append(", intent=").append(intent);
        if (slot != null) sb.append(", slot=").append(slot.getName());
        if (toolResult != null) sb.append(", ").append(toolResult);
        if (retrievalResult != null) sb.append(", ").append(retrievalResult);
        if (resume != null) sb.append(", resume=").append(resume);
        return sb.append('}').toString();
    }
}
