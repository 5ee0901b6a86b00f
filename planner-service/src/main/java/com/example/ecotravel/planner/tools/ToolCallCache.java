package com.example.ecotravel.planner.tools;

import com.example.ecotravel.planner.domain.Candidate;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Results of the tool calls made during a single turn, keyed by tool and normalized input.
 * Created per turn and dropped with it; weather and routes are time-sensitive, so nothing
 * is cached across turns.
 */
public class ToolCallCache {

    private final Map<String, ToolResult> results = new HashMap<>();

    public Optional<ToolResult> get(String toolName, Map<String, Object> inputs) {
        return Optional.ofNullable(results.get(key(toolName, inputs)));
    }

    public void put(String toolName, Map<String, Object> inputs, ToolResult result) {
        results.put(key(toolName, inputs), result);
    }

    public int size() {
        return results.size();
    }

    static String key(String toolName, Map<String, Object> inputs) {
        StringBuilder sb = new StringBuilder(toolName).append('|');
        for (Map.Entry<String, Object> e : new TreeMap<>(inputs).entrySet()) {
            sb.append(e.getKey()).append('=').append(normalize(e.getValue())).append(';');
        }
        return sb.toString();
    }

    private static String normalize(Object value) {
        if (value instanceof Candidate c) return "#" + c.getId();
        if (value instanceof String s) return s.trim().toLowerCase(Locale.ROOT);
        return String.valueOf(value);
    }
}
