package com.example.ecotravel.planner.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/** Registered tool handlers by name. */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolHandler> handlers;

    public ToolRegistry(List<ToolHandler> handlers) {
        Map<String, ToolHandler> map = new TreeMap<>();
        for (ToolHandler h : handlers) {
            if (map.putIfAbsent(h.name(), h) != null) {
                throw new IllegalStateException("Two tool handlers registered as '" + h.name() + "'");
            }
        }
        this.handlers = Collections.unmodifiableMap(map);
        log.info("[ToolRegistry] Registered tools: {}", this.handlers.keySet());
    }

    public Optional<ToolHandler> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(handlers.get(name));
    }

    /** Required inputs of the named tool, or {@code null} if no such tool is registered. */
    public Set<String> requiredInputsOf(String name) {
        ToolHandler h = handlers.get(name);
        return h == null ? null : h.requiredInputs();
    }

    public Set<String> names() {
        return handlers.keySet();
    }
}
