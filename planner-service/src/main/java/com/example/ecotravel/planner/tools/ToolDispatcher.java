package com.example.ecotravel.planner.tools;

import com.example.ecotravel.planner.config.PlannerToolsProperties;
import com.example.ecotravel.planner.domain.ErrorKind;
import com.example.ecotravel.planner.slots.IntentSchema;
import com.example.ecotravel.planner.slots.IntentSchemaTable;
import com.example.ecotravel.planner.slots.TargetKind;
import com.example.ecotravel.planner.support.ExternalCallGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches a ready intent to its tool handler. Always returns a {@link ToolResult}: unknown
 * intents, incomplete input, timeouts and handler faults come back as failed results.
 */
@Service
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final IntentSchemaTable schemas;
    private final ToolRegistry registry;
    private final ExternalCallGuard guard;
    private final PlannerToolsProperties props;

    public ToolDispatcher(IntentSchemaTable schemas, ToolRegistry registry,
                          ExternalCallGuard guard, PlannerToolsProperties props) {
        this.schemas = schemas;
        this.registry = registry;
        this.guard = guard;
        this.props = props;
    }

    public ToolResult dispatch(String intent, Map<String, Object> filledSlots) {
        return dispatch(intent, filledSlots, null);
    }

    /**
     * @param turnCache cache of the current turn, or {@code null} to always invoke the handler
     */
    public ToolResult dispatch(String intent, Map<String, Object> filledSlots, ToolCallCache turnCache) {
        IntentSchema schema = schemas.find(intent).orElse(null);
        if (schema == null || schema.getTarget() != TargetKind.TOOL) {
            log.warn("[ToolDispatcher] No tool registered for intent '{}'", intent);
            return ToolResult.failed(null, ErrorKind.UNKNOWN_INTENT);
        }
        ToolHandler handler = registry.find(schema.getToolName()).orElse(null);
        if (handler == null) {
            log.warn("[ToolDispatcher] Intent '{}' names unregistered tool '{}'", intent, schema.getToolName());
            return ToolResult.failed(schema.getToolName(), ErrorKind.UNKNOWN_INTENT);
        }

        Map<String, Object> inputs = new LinkedHashMap<>();
        for (String name : schema.slotNames()) {
            Object v = filledSlots.get(name);
            if (v != null) inputs.put(name, v);
        }
        List<String> missing = new ArrayList<>();
        for (String required : handler.requiredInputs()) {
            if (!inputs.containsKey(required)) missing.add(required);
        }
        if (!missing.isEmpty()) {
            log.warn("[ToolDispatcher] Invariant violated: '{}' dispatched to {} without {}", intent, handler.name(), missing);
            return ToolResult.failed(handler.name(), ErrorKind.INCOMPLETE_INPUT);
        }

        if (turnCache != null) {
            var cached = turnCache.get(handler.name(), inputs);
            if (cached.isPresent()) {
                log.debug("[ToolDispatcher] {} served from turn cache", handler.name());
                return cached.get();
            }
        }
        ToolResult result = invoke(handler, inputs);
        if (turnCache != null) turnCache.put(handler.name(), inputs, result);
        return result;
    }

    private ToolResult invoke(ToolHandler handler, Map<String, Object> inputs) {
        long timeoutMs = props.timeoutFor(handler.name());
        Map<String, Object> frozen = Map.copyOf(inputs);
        try {
            Map<String, Object> payload = guard.call("tool:" + handler.name(), () -> handler.execute(frozen), timeoutMs);
            return ToolResult.ok(handler.name(), payload);
        } catch (TimeoutException e) {
            return ToolResult.failed(handler.name(), ErrorKind.TOOL_TIMEOUT);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            ErrorKind kind = cause instanceof ToolException te ? te.getKind() : ErrorKind.TOOL_UNAVAILABLE;
            log.warn("[ToolDispatcher] {} failed ({}): {}", handler.name(), kind, cause.toString());
            return ToolResult.failed(handler.name(), kind);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[ToolDispatcher] Interrupted while waiting for {}", handler.name());
            return ToolResult.failed(handler.name(), ErrorKind.TOOL_UNAVAILABLE);
        }
    }
}
