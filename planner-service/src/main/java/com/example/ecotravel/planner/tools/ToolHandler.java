package com.example.ecotravel.planner.tools;

import java.util.Map;
import java.util.Set;

/**
 * A capability the dispatcher can invoke. Handlers are registered by name; the dispatcher
 * has no knowledge of individual tools beyond this contract.
 */
public interface ToolHandler {

    /** Registry name referenced from intent schemas. */
    String name();

    /** Input names that must be present before {@link #execute} is called. */
    Set<String> requiredInputs();

    /**
     * Runs the capability once. Implementations own their retry policy; the dispatcher never
     * retries. The returned payload should carry a {@code summary} entry with a one-line
     * human-readable result.
     */
    Map<String, Object> execute(Map<String, Object> inputs) throws ToolException;
}
