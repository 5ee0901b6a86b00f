package com.example.ecotravel.planner.dialogue;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Per-conversation orchestration state. Guarded by the owning conversation's lock.
 */
public class DialogueState {

    private DialoguePhase phase = DialoguePhase.AWAITING_INTENT;
    private String activeIntent;
    private PendingClarification pending;
    // further ambiguous entities from the same turn, asked about one at a time
    private final Deque<PendingClarification> queued = new ArrayDeque<>();
    private String lastRequestedSlot;

    public DialoguePhase getPhase() { return phase; }
    public void setPhase(DialoguePhase phase) { this.phase = phase; }
    public String getActiveIntent() { return activeIntent; }
    public void setActiveIntent(String activeIntent) { this.activeIntent = activeIntent; }
    public PendingClarification getPending() { return pending; }
    public void setPending(PendingClarification pending) { this.pending = pending; }
    public String getLastRequestedSlot() { return lastRequestedSlot; }
    public void setLastRequestedSlot(String lastRequestedSlot) { this.lastRequestedSlot = lastRequestedSlot; }

    public boolean isAwaitingClarification() {
        return phase == DialoguePhase.AWAITING_CLARIFICATION && pending != null;
    }

    public void queue(PendingClarification next) {
        queued.addLast(next);
    }

    /** Makes the next queued clarification current; returns {@code false} if none is left. */
    public boolean advanceQueue() {
        pending = queued.pollFirst();
        return pending != null;
    }

    /** Forgets any question about {@code slotName}, current or queued. */
    public void discardClarification(String slotName) {
        if (pending != null && pending.getSlotName().equals(slotName)) pending = null;
        queued.removeIf(q -> q.getSlotName().equals(slotName));
    }

    public List<PendingClarification> queuedClarifications() {
        return List.copyOf(queued);
    }

    /** Ends the current intent: back to waiting for a new one, collection state dropped. */
    public void reset() {
        phase = DialoguePhase.AWAITING_INTENT;
        activeIntent = null;
        pending = null;
        queued.clear();
        lastRequestedSlot = null;
    }

    public DialogueState copy() {
        DialogueState c = new DialogueState();
        c.restoreFrom(this);
        return c;
    }

    public void restoreFrom(DialogueState other) {
        phase = other.phase;
        activeIntent = other.activeIntent;
        pending = other.pending;
        queued.clear();
        queued.addAll(other.queued);
        lastRequestedSlot = other.lastRequestedSlot;
    }

    @Override
    public String toString() {
        return "DialogueState{" + phase + ", intent=" + activeIntent + ", pending=" + pending + "}";
    }
}
