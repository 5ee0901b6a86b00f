package com.example.ecotravel.planner.conversation;

import com.example.ecotravel.planner.dialogue.DialogueState;
import com.example.ecotravel.planner.slots.SlotStore;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State of one conversation. Slots and dialogue state may only be touched while holding
 * {@link #getLock()}; the lock is fair so queued turns run in arrival order.
 */
public class Conversation {

    private final String sessionId;
    private final SlotStore slots = new SlotStore();
    private final DialogueState state = new DialogueState();
    private final ReentrantLock lock = new ReentrantLock(true);
    private volatile Instant lastActivity;
    private volatile boolean closed;

    public Conversation(String sessionId, Instant createdAt) {
        this.sessionId = sessionId;
        this.lastActivity = createdAt;
    }

    public String getSessionId() { return sessionId; }
    public SlotStore getSlots() { return slots; }
    public DialogueState getState() { return state; }
    ReentrantLock getLock() { return lock; }
    public Instant getLastActivity() { return lastActivity; }
    /** Reset or evicted; a fresh conversation takes its place on the next turn. */
    public boolean isClosed() { return closed; }

    void touch(Instant now) {
        lastActivity = now;
    }

    void close() {
        closed = true;
    }
}
