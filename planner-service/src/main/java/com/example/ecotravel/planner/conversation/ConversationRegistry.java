package com.example.ecotravel.planner.conversation;

import com.example.ecotravel.planner.config.PlannerDialogueProperties;
import com.example.ecotravel.planner.dialogue.DialogueState;
import com.example.ecotravel.planner.dialogue.PendingClarification;
import com.example.ecotravel.planner.domain.Candidate;
import com.example.ecotravel.planner.resolve.ClarificationOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Per-session conversations with per-key mutual exclusion: turns of one session run one at a
 * time, turns of different sessions run in parallel. Idle conversations are evicted.
 */
@Component
public class ConversationRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConversationRegistry.class);

    private final ConcurrentHashMap<String, Conversation> conversations = new ConcurrentHashMap<>();
    private final long lockTimeoutMs;
    private final Duration idleTimeout;
    private final Clock clock;

    @Autowired
    public ConversationRegistry(PlannerDialogueProperties props) {
        this(props.getLockTimeoutMs(), Duration.ofMinutes(props.getIdleTimeoutMinutes()), Clock.systemUTC());
    }

    ConversationRegistry(long lockTimeoutMs, Duration idleTimeout, Clock clock) {
        this.lockTimeoutMs = lockTimeoutMs;
        this.idleTimeout = idleTimeout;
        this.clock = clock;
    }

    /**
     * Runs {@code work} on the session's conversation while holding its lock, creating the
     * conversation if needed. Returns {@code onBusy} if the lock cannot be had within the timeout.
     */
    public <T> T execute(String sessionId, Function<Conversation, T> work, Supplier<T> onBusy) {
        while (true) {
            Conversation c = conversations.computeIfAbsent(sessionId, id -> new Conversation(id, clock.instant()));
            boolean locked;
            try {
                locked = c.getLock().tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return onBusy.get();
            }
            if (!locked) {
                log.warn("[ConversationRegistry] Session {} still busy after {} ms", sessionId, lockTimeoutMs);
                return onBusy.get();
            }
            try {
                if (c.isClosed()) continue;
                c.touch(clock.instant());
                return work.apply(c);
            } finally {
                c.touch(clock.instant());
                c.getLock().unlock();
            }
        }
    }

    /** Destroys the conversation; the next turn starts a fresh one. */
    public boolean reset(String sessionId) {
        Conversation c = conversations.remove(sessionId);
        if (c == null) return false;
        c.close();
        log.info("[ConversationRegistry] Session {} reset", sessionId);
        return true;
    }

    @Scheduled(fixedDelayString = "${planner.dialogue.eviction-interval-ms:60000}")
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int evicted = 0;
        for (Map.Entry<String, Conversation> e : conversations.entrySet()) {
            Conversation c = e.getValue();
            if (!c.getLastActivity().isBefore(cutoff) || !c.getLock().tryLock()) continue;
            try {
                if (c.getLastActivity().isBefore(cutoff) && conversations.remove(e.getKey(), c)) {
                    c.close();
                    evicted++;
                }
            } finally {
                c.getLock().unlock();
            }
        }
        if (evicted > 0) {
            log.info("[ConversationRegistry] Evicted {} idle conversations, {} active", evicted, conversations.size());
        }
        return evicted;
    }

    public Set<String> sessionIds() {
        return new TreeSet<>(conversations.keySet());
    }

    /** Read-only view of a conversation, empty if the session is unknown. */
    public Optional<Map<String, Object>> snapshot(String sessionId) {
        Conversation c = conversations.get(sessionId);
        if (c == null) return Optional.empty();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("sessionId", sessionId);
        boolean locked;
        try {
            locked = c.getLock().tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            locked = false;
        }
        if (!locked) {
            out.put("busy", true);
            return Optional.of(out);
        }
        try {
            DialogueState state = c.getState();
            out.put("phase", state.getPhase().name());
            out.put("activeIntent", state.getActiveIntent());
            Map<String, Object> slots = new LinkedHashMap<>();
            c.getSlots().filled().forEach((k, v) -> slots.put(k, describe(v)));
            out.put("slots", slots);
            out.put("pendingSlots", new ArrayList<>(c.getSlots().pendingNames()));
            PendingClarification pending = state.getPending();
            if (pending != null) {
                Map<String, Object> p = new LinkedHashMap<>();
                p.put("slot", pending.getSlotName());
                List<String> labels = new ArrayList<>();
                for (ClarificationOption o : pending.getOptions()) labels.add(o.getLabel());
                p.put("options", labels);
                p.put("failedAttempts", pending.getFailedAttempts());
                out.put("pendingClarification", p);
            }
            out.put("lastActivity", c.getLastActivity().toString());
            return Optional.of(out);
        } finally {
            c.getLock().unlock();
        }
    }

    private static Object describe(Object value) {
        if (value instanceof Candidate c) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id", c.getId());
            m.put("name", c.getName());
            return m;
        }
        return String.valueOf(value);
    }
}
