package com.example.ecotravel.planner.slots;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Explicit intent-to-target mapping. Each intent has exactly one entry; {@link #validate}
 * checks tool targets against the registered handlers at startup.
 */
public final class IntentSchemaTable {

    private final Map<String, IntentSchema> byIntent;

    private IntentSchemaTable(Map<String, IntentSchema> byIntent) {
        this.byIntent = Collections.unmodifiableMap(byIntent);
    }

    public static IntentSchemaTable of(IntentSchema... schemas) {
        Map<String, IntentSchema> map = new LinkedHashMap<>();
        for (IntentSchema s : schemas) {
            if (map.putIfAbsent(s.getIntent(), s) != null) {
                throw new IllegalStateException("Duplicate schema entry for intent '" + s.getIntent() + "'");
            }
        }
        return new IntentSchemaTable(map);
    }

    public Optional<IntentSchema> find(String intent) {
        if (intent == null) return Optional.empty();
        return Optional.ofNullable(byIntent.get(intent));
    }

    public Collection<IntentSchema> all() {
        return byIntent.values();
    }

    public Set<String> intents() {
        return byIntent.keySet();
    }

    /**
     * Fails fast when a tool intent names an unregistered tool, or when a tool requires an
     * input the intent does not declare as a slot.
     *
     * @param requiredInputsByTool registered tool name -> inputs the tool requires, {@code null} if unknown
     */
    public void validate(Function<String, Set<String>> requiredInputsByTool) {
        for (IntentSchema s : byIntent.values()) {
            if (s.getTarget() != TargetKind.TOOL) continue;
            Set<String> inputs = requiredInputsByTool.apply(s.getToolName());
            if (inputs == null) {
                throw new IllegalStateException("Intent '" + s.getIntent() + "' targets unregistered tool '" + s.getToolName() + "'");
            }
            for (String input : inputs) {
                if (!s.isRequired(input)) {
                    throw new IllegalStateException("Tool '" + s.getToolName() + "' requires input '" + input
                            + "' which intent '" + s.getIntent() + "' does not declare as a required slot");
                }
            }
        }
    }
}
