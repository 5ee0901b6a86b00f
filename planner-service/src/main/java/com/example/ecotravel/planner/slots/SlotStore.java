package com.example.ecotravel.planner.slots;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-conversation slot memory. Not thread-safe: a conversation's store is only touched
 * by the turn currently holding that conversation's lock.
 */
public class SlotStore {

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Set<String> pending = new LinkedHashSet<>();

    /** Last write wins; a pending slot becomes filled. */
    public void fill(String name, Object value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        values.put(name, value);
        pending.remove(name);
    }

    public void clear(String name) {
        values.remove(name);
        pending.remove(name);
    }

    public void clearAll() {
        values.clear();
        pending.clear();
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /** Drops any value and marks the slot as waiting for a clarification answer. */
    public void markPending(String name) {
        values.remove(name);
        pending.add(name);
    }

    public SlotStatus status(String name) {
        if (values.containsKey(name)) return SlotStatus.FILLED;
        if (pending.contains(name)) return SlotStatus.PENDING_CLARIFICATION;
        return SlotStatus.UNSET;
    }

    /**
     * Required slot names, in schema order, that are unset or hold a value of the wrong type.
     * An empty list means the intent is ready for dispatch.
     */
    public List<String> missingRequired(IntentSchema schema) {
        List<String> out = new ArrayList<>();
        for (SlotDefinition def : schema.getRequired()) {
            Object v = values.get(def.getName());
            if (v == null || !def.getType().accepts(v)) out.add(def.getName());
        }
        return out;
    }

    /** Snapshot of the filled slots. */
    public Map<String, Object> filled() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Set<String> pendingNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(pending));
    }

    /** Keeps only the named slots, dropping values and pending marks of all others. */
    public void retainOnly(Set<String> names) {
        values.keySet().retainAll(names);
        pending.retainAll(names);
    }

    public SlotStore copy() {
        SlotStore c = new SlotStore();
        c.values.putAll(values);
        c.pending.addAll(pending);
        return c;
    }

    public void restoreFrom(SlotStore other) {
        values.clear();
        values.putAll(other.values);
        pending.clear();
        pending.addAll(other.pending);
    }

    @Override
    public String toString() {
        return "SlotStore{filled=" + values.keySet() + ", pending=" + pending + "}";
    }
}
