package com.example.ecotravel.planner.dialogue;

import com.example.ecotravel.common.nlu.NluResult;
import com.example.ecotravel.planner.config.PlannerDialogueProperties;
import com.example.ecotravel.planner.domain.Candidate;
import com.example.ecotravel.planner.domain.Entity;
import com.example.ecotravel.planner.domain.Turn;
import com.example.ecotravel.planner.resolve.ClarificationOption;
import com.example.ecotravel.planner.resolve.EntityResolver;
import com.example.ecotravel.planner.resolve.Resolution;
import com.example.ecotravel.planner.retrieval.RetrievalPipeline;
import com.example.ecotravel.planner.retrieval.RetrievalResult;
import com.example.ecotravel.planner.slots.IntentSchema;
import com.example.ecotravel.planner.slots.IntentSchemaTable;
import com.example.ecotravel.planner.slots.SlotDefinition;
import com.example.ecotravel.planner.slots.SlotStatus;
import com.example.ecotravel.planner.slots.SlotStore;
import com.example.ecotravel.planner.slots.SlotType;
import com.example.ecotravel.planner.slots.TargetKind;
import com.example.ecotravel.planner.tools.ToolCallCache;
import com.example.ecotravel.planner.tools.ToolDispatcher;
import com.example.ecotravel.planner.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides, per turn, whether to ask for a slot, ask a clarification question, or dispatch the
 * active intent to its tool or to the retrieval pipeline.
 *
 * The caller must hold the conversation's lock. Any unexpected runtime failure restores the
 * slot store and dialogue state to what they were before the turn and yields a FAILURE action.
 */
@Service
public class DialogueStateMachine {

    private static final Logger log = LoggerFactory.getLogger(DialogueStateMachine.class);

    private final IntentSchemaTable schemas;
    private final EntityResolver resolver;
    private final ToolDispatcher dispatcher;
    private final RetrievalPipeline retrieval;
    private final ClarificationMatcher matcher;
    private final PlannerDialogueProperties props;

    public DialogueStateMachine(IntentSchemaTable schemas, EntityResolver resolver, ToolDispatcher dispatcher,
                                RetrievalPipeline retrieval, ClarificationMatcher matcher,
                                PlannerDialogueProperties props) {
        this.schemas = schemas;
        this.resolver = resolver;
        this.dispatcher = dispatcher;
        this.retrieval = retrieval;
        this.matcher = matcher;
        this.props = props;
    }

    public DialogueAction handle(Turn turn, SlotStore slots, DialogueState state) {
        SlotStore slotSnapshot = slots.copy();
        DialogueState stateSnapshot = state.copy();
        try {
            DialogueAction action = decide(turn, slots, state, new ToolCallCache());
            log.debug("[DialogueStateMachine] {} at {} -> {} ({})", turn, turn.getTimestamp(), action, state);
            return action;
        } catch (RuntimeException e) {
            log.warn("[DialogueStateMachine] Turn failed, restoring previous state: {}", e.toString(), e);
            slots.restoreFrom(slotSnapshot);
            state.restoreFrom(stateSnapshot);
            return DialogueAction.failure();
        }
    }

    private DialogueAction decide(Turn turn, SlotStore slots, DialogueState state, ToolCallCache cache) {
        String intent = turn.getIntent();
        IntentSchema schema = schemas.find(intent).orElse(null);

        if (state.isAwaitingClarification()) {
            IntentSchema active = schemas.find(state.getActiveIntent()).orElse(null);
            if (active != null) {
                List<ClarificationOption> options = state.getPending().getOptions();
                boolean ownIntent = hasOwnIntent(turn, schema, state);
                Optional<ClarificationOption> choice = ownIntent
                        ? matcher.matchMentioned(turn, options)
                        : matcher.match(turn, options);
                if (!ownIntent || choice.isPresent()) {
                    return answerClarification(turn, choice, active, slots, state, cache);
                }
            }
        }

        // a bare answer ("Berlin", "by train") to the slot question of the active intent
        boolean answerOnly = schema == null || props.getClarificationReplyIntents().contains(intent);
        if (answerOnly && state.getActiveIntent() != null && !turn.getEntities().isEmpty()) {
            IntentSchema active = schemas.find(state.getActiveIntent()).orElse(null);
            if (active != null) {
                List<String> unrecognized = collect(turn.getEntities(), active, slots, state);
                return advance(active, slots, state, unrecognized, turn, cache);
            }
        }

        if (schema == null) {
            log.warn("[DialogueStateMachine] Unknown intent '{}'", intent);
            return DialogueAction.unknownIntent(intent);
        }

        if (schema.getTarget() == TargetKind.CONVERSATIONAL) {
            if (schema.isResetsConversation()) {
                slots.clearAll();
                state.reset();
                return DialogueAction.conversational(intent, schema.getReply());
            }
            return DialogueAction.conversational(intent, schema.getReply()).thenResume(resumeAction(slots, state));
        }

        boolean collecting = state.getActiveIntent() != null && !intent.equals(state.getActiveIntent());
        if (collecting && props.getBackgroundIntents().contains(intent)) {
            DialogueAction answer = serve(turn, schema, slots, cache);
            return answer.thenResume(resumeAction(slots, state));
        }
        if (collecting) {
            switchContext(schema, slots, state);
        }

        state.setActiveIntent(intent);
        state.setPhase(DialoguePhase.COLLECTING_SLOTS);
        List<String> unrecognized = collect(turn.getEntities(), schema, slots, state);
        return advance(schema, slots, state, unrecognized, turn, cache);
    }

    /**
     * While a question is pending, a turn is a plain reply if its intent is a reply intent, the
     * active intent or unknown. Any other known intent only answers the question when it names
     * one of the offered options.
     */
    private boolean hasOwnIntent(Turn turn, IntentSchema schema, DialogueState state) {
        String intent = turn.getIntent();
        if (schema == null || NluResult.FALLBACK_INTENT.equals(intent)) return false;
        if (props.getClarificationReplyIntents().contains(intent)) return false;
        return !intent.equals(state.getActiveIntent());
    }

    private DialogueAction answerClarification(Turn turn, Optional<ClarificationOption> choice, IntentSchema schema,
                                               SlotStore slots, DialogueState state, ToolCallCache cache) {
        PendingClarification pending = state.getPending();
        SlotDefinition slot = schema.slot(pending.getSlotName())
                .orElseThrow(() -> new IllegalStateException("Pending slot '" + pending.getSlotName()
                        + "' is not declared by intent '" + schema.getIntent() + "'"));

        if (choice.isEmpty()) {
            PendingClarification failed = pending.withFailedAttempt();
            if (failed.getFailedAttempts() >= props.getMaxClarificationAttempts()) {
                log.debug("[DialogueStateMachine] Giving up on '{}' after {} attempts", slot.getName(), failed.getFailedAttempts());
                slots.clear(slot.getName());
                for (PendingClarification q : state.queuedClarifications()) slots.clear(q.getSlotName());
                String intent = state.getActiveIntent();
                state.reset();
                return DialogueAction.clarificationExhausted(intent, slot);
            }
            state.setPending(failed);
            return DialogueAction.askClarification(schema.getIntent(), slot, failed, true);
        }

        Candidate chosen = choice.get().getCandidate();
        slots.fill(slot.getName(), slot.getType().convert(chosen));
        state.setPending(null);
        state.setPhase(DialoguePhase.COLLECTING_SLOTS);

        // other information given alongside the answer, e.g. "the Ontario one, by train"
        List<Entity> rest = new ArrayList<>();
        for (Entity e : turn.getEntities()) {
            if (!slot.getEntityType().equals(e.getType())) rest.add(e);
        }
        List<String> unrecognized = collect(rest, schema, slots, state);
        return advance(schema, slots, state, unrecognized, turn, cache);
    }

    /**
     * Drops collection for the interrupted intent. Only slots the new intent declares are kept.
     */
    private void switchContext(IntentSchema next, SlotStore slots, DialogueState state) {
        log.debug("[DialogueStateMachine] Switching from '{}' to '{}'", state.getActiveIntent(), next.getIntent());
        if (state.getPending() != null) slots.clear(state.getPending().getSlotName());
        for (PendingClarification q : state.queuedClarifications()) slots.clear(q.getSlotName());
        slots.retainOnly(next.slotNames());
        state.reset();
    }

    /**
     * Maps each entity to a slot of the schema, resolves it and fills the slot or queues a
     * clarification. Returns the surface texts that could not be resolved.
     */
    private List<String> collect(List<Entity> entities, IntentSchema schema, SlotStore slots, DialogueState state) {
        List<String> unrecognized = new ArrayList<>();
        Set<String> claimed = new HashSet<>();
        for (Entity entity : entities) {
            SlotDefinition slot = slotFor(entity, schema, slots, state, claimed);
            if (slot == null) {
                log.debug("[DialogueStateMachine] No slot of '{}' takes {}", schema.getIntent(), entity);
                continue;
            }
            claimed.add(slot.getName());
            List<Candidate> candidates = candidatesOf(entity, slot);
            Resolution resolution = slot.getType() == SlotType.PLACE
                    ? resolver.resolve(new Entity(entity.getType(), entity.getRole(), entity.getSurfaceText(), candidates, entity.getConfidence()))
                    : (candidates.isEmpty() ? Resolution.unresolved() : Resolution.resolved(candidates.get(0)));

            switch (resolution.getKind()) {
                case RESOLVED -> {
                    Object value = convert(slot, resolution.getCandidate());
                    if (value == null) {
                        unrecognized.add(entity.getSurfaceText());
                    } else {
                        slots.fill(slot.getName(), value);
                        state.discardClarification(slot.getName());
                    }
                }
                case AMBIGUOUS -> {
                    slots.markPending(slot.getName());
                    PendingClarification pending = new PendingClarification(slot.getName(), entity.getSurfaceText(),
                            resolution.getOptions(), 0);
                    if (state.getPending() == null) {
                        state.setPending(pending);
                        state.setPhase(DialoguePhase.AWAITING_CLARIFICATION);
                    } else {
                        state.queue(pending);
                    }
                }
                case UNRESOLVED -> unrecognized.add(entity.getSurfaceText());
            }
        }
        return unrecognized;
    }

    private DialogueAction advance(IntentSchema schema, SlotStore slots, DialogueState state,
                                   List<String> unrecognized, Turn turn, ToolCallCache cache) {
        if (state.getPending() == null && state.advanceQueue()) {
            state.setPhase(DialoguePhase.AWAITING_CLARIFICATION);
        }
        if (state.getPending() != null) {
            SlotDefinition slot = schema.slot(state.getPending().getSlotName()).orElseThrow();
            state.setPhase(DialoguePhase.AWAITING_CLARIFICATION);
            return DialogueAction.askClarification(schema.getIntent(), slot, state.getPending(), false);
        }

        List<String> missing = slots.missingRequired(schema);
        if (!missing.isEmpty()) {
            SlotDefinition slot = schema.slot(missing.get(0)).orElseThrow();
            state.setPhase(DialoguePhase.COLLECTING_SLOTS);
            state.setLastRequestedSlot(slot.getName());
            return DialogueAction.askForSlot(schema.getIntent(), slot, unrecognized);
        }

        state.setPhase(DialoguePhase.READY_TO_DISPATCH);
        DialogueAction answer = serve(turn, schema, slots, cache);
        state.setPhase(DialoguePhase.RESPONDING);
        state.reset();
        return answer;
    }

    private DialogueAction serve(Turn turn, IntentSchema schema, SlotStore slots, ToolCallCache cache) {
        if (schema.getTarget() == TargetKind.RETRIEVAL) {
            RetrievalResult result = retrieval.answer(turn.getRawText());
            return DialogueAction.retrievalResult(schema.getIntent(), result);
        }
        Map<String, Object> filled = slots.filled();
        ToolResult result = dispatcher.dispatch(schema.getIntent(), filled, cache);
        return DialogueAction.toolResult(schema.getIntent(), result);
    }

    /** Re-asks for whatever the in-progress intent is still waiting on, or {@code null}. */
    private DialogueAction resumeAction(SlotStore slots, DialogueState state) {
        IntentSchema active = schemas.find(state.getActiveIntent()).orElse(null);
        if (active == null) return null;
        if (state.isAwaitingClarification()) {
            SlotDefinition slot = active.slot(state.getPending().getSlotName()).orElse(null);
            return slot == null ? null : DialogueAction.askClarification(active.getIntent(), slot, state.getPending(), false);
        }
        List<String> missing = slots.missingRequired(active);
        if (missing.isEmpty()) return null;
        return DialogueAction.askForSlot(active.getIntent(), active.slot(missing.get(0)).orElseThrow(), List.of());
    }

    /**
     * Slot for an entity, first match wins: the entity's role, the slot last asked for, a slot
     * named after the entity type, the first missing required slot of that type, the first
     * unfilled optional slot of that type, the only slot of that type. Slots already claimed by
     * another entity of the same turn are skipped.
     */
    SlotDefinition slotFor(Entity entity, IntentSchema schema, SlotStore slots, DialogueState state, Set<String> claimed) {
        String type = entity.getType();
        Optional<SlotDefinition> byRole = schema.slot(entity.getRole());
        if (byRole.isPresent() && takes(byRole.get(), type, claimed)) return byRole.get();

        Optional<SlotDefinition> asked = schema.slot(state.getLastRequestedSlot());
        if (asked.isPresent() && takes(asked.get(), type, claimed)) return asked.get();

        Optional<SlotDefinition> named = schema.slot(type);
        if (named.isPresent() && takes(named.get(), type, claimed)) return named.get();

        for (SlotDefinition d : schema.getRequired()) {
            if (takes(d, type, claimed) && slots.status(d.getName()) != SlotStatus.FILLED) return d;
        }
        for (SlotDefinition d : schema.getOptional()) {
            if (takes(d, type, claimed) && slots.status(d.getName()) != SlotStatus.FILLED) return d;
        }
        SlotDefinition only = null;
        for (SlotDefinition d : schema.allSlots()) {
            if (!d.getEntityType().equals(type)) continue;
            if (only != null) return null;
            only = d;
        }
        return only != null && !claimed.contains(only.getName()) ? only : null;
    }

    private static boolean takes(SlotDefinition slot, String entityType, Set<String> claimed) {
        return slot.getEntityType().equals(entityType) && !claimed.contains(slot.getName());
    }

    /** Non-place values may arrive as bare surface text. */
    private static List<Candidate> candidatesOf(Entity entity, SlotDefinition slot) {
        if (!entity.getCandidates().isEmpty() || slot.getType() == SlotType.PLACE) return entity.getCandidates();
        String text = entity.getSurfaceText();
        if (text == null || text.isBlank()) return List.of();
        return List.of(new Candidate(text.trim(), text.trim(), Map.of(), entity.getConfidence()));
    }

    private static Object convert(SlotDefinition slot, Candidate candidate) {
        try {
            return slot.getType().convert(candidate);
        } catch (IllegalArgumentException | DateTimeException e) {
            log.debug("[DialogueStateMachine] '{}' is not a valid {} for {}", candidate.getId(), slot.getType(), slot.getName());
            return null;
        }
    }
}
