package com.example.ecotravel.planner.tools;

import com.example.ecotravel.planner.domain.ErrorKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Immutable outcome of one tool dispatch. */
public final class ToolResult {
    private final String toolName;
    private final boolean success;
    private final Map<String, Object> payload;
    private final ErrorKind errorKind;

    private ToolResult(String toolName, boolean success, Map<String, Object> payload, ErrorKind errorKind) {
        this.toolName = toolName;
        this.success = success;
        this.payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.errorKind = errorKind;
    }

    public static ToolResult ok(String toolName, Map<String, Object> payload) {
        return new ToolResult(toolName, true, payload, null);
    }

    public static ToolResult failed(String toolName, ErrorKind kind) {
        return new ToolResult(toolName, false, null, kind);
    }

    public String getToolName() { return toolName; }
    public boolean isSuccess() { return success; }
    public Map<String, Object> getPayload() { return payload; }
    public ErrorKind getErrorKind() { return errorKind; }

    @Override
    public String toString() {
        return success ? "ToolResult{" + toolName + " OK}" : "ToolResult{" + toolName + " " + errorKind + "}";
    }
}
