package com.example.ecotravel.planner.slots;

import java.util.Objects;

/**
 * Declaration of one slot in an intent schema.
 *
 * {@code entityType} is the NLU entity type that can fill the slot; {@code label} is the
 * human wording used in questions ("starting point"); {@code prompt} is the question asked
 * when the slot is missing.
 */
public final class SlotDefinition {
    private final String name;
    private final SlotType type;
    private final String entityType;
    private final String label;
    private final String prompt;

    public SlotDefinition(String name, SlotType type, String entityType, String label, String prompt) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.entityType = Objects.requireNonNull(entityType, "entityType");
        this.label = label != null ? label : name.replace('_', ' ');
        this.prompt = prompt;
    }

    public static SlotDefinition place(String name, String label, String prompt) {
        return new SlotDefinition(name, SlotType.PLACE, "place", label, prompt);
    }

    public String getName() { return name; }
    public SlotType getType() { return type; }
    public String getEntityType() { return entityType; }
    public String getLabel() { return label; }
    public String getPrompt() { return prompt; }

    @Override
    public String toString() {
        return name + ":" + type;
    }
}
