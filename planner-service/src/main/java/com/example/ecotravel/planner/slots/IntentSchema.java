package com.example.ecotravel.planner.slots;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Static description of an intent: the slots it needs, the slots it can use, and its target.
 */
public final class IntentSchema {
    private final String intent;
    private final List<SlotDefinition> required;
    private final List<SlotDefinition> optional;
    private final TargetKind target;
    private final String toolName;
    private final String reply;
    private final boolean resetsConversation;

    private IntentSchema(Builder b) {
        this.intent = Objects.requireNonNull(b.intent, "intent");
        this.required = List.copyOf(b.required);
        this.optional = List.copyOf(b.optional);
        this.target = Objects.requireNonNull(b.target, "target for intent " + b.intent);
        this.toolName = b.toolName;
        this.reply = b.reply;
        this.resetsConversation = b.resetsConversation;
        if (target == TargetKind.TOOL && (toolName == null || toolName.isBlank())) {
            throw new IllegalArgumentException("Intent '" + intent + "' targets a tool but names none");
        }
        Set<String> names = new LinkedHashSet<>();
        for (SlotDefinition d : allSlots()) {
            if (!names.add(d.getName())) {
                throw new IllegalArgumentException("Intent '" + intent + "' declares slot '" + d.getName() + "' twice");
            }
        }
    }

    public static Builder builder(String intent) {
        return new Builder(intent);
    }

    public String getIntent() { return intent; }
    public List<SlotDefinition> getRequired() { return required; }
    public List<SlotDefinition> getOptional() { return optional; }
    public TargetKind getTarget() { return target; }
    public String getToolName() { return toolName; }
    /** Fixed reply for conversational intents. */
    public String getReply() { return reply; }
    public boolean isResetsConversation() { return resetsConversation; }

    public List<SlotDefinition> allSlots() {
        List<SlotDefinition> all = new ArrayList<>(required.size() + optional.size());
        all.addAll(required);
        all.addAll(optional);
        return all;
    }

    public Optional<SlotDefinition> slot(String name) {
        if (name == null) return Optional.empty();
        for (SlotDefinition d : required) if (d.getName().equals(name)) return Optional.of(d);
        for (SlotDefinition d : optional) if (d.getName().equals(name)) return Optional.of(d);
        return Optional.empty();
    }

    public boolean isRequired(String name) {
        for (SlotDefinition d : required) if (d.getName().equals(name)) return true;
        return false;
    }

    public Set<String> slotNames() {
        Set<String> out = new LinkedHashSet<>();
        for (SlotDefinition d : allSlots()) out.add(d.getName());
        return out;
    }

    @Override
    public String toString() {
        return "IntentSchema{" + intent + " -> " + target + (toolName != null ? ":" + toolName : "")
                + ", required=" + required + ", optional=" + optional + "}";
    }

    public static final class Builder {
        private final String intent;
        private final List<SlotDefinition> required = new ArrayList<>();
        private final List<SlotDefinition> optional = new ArrayList<>();
        private TargetKind target;
        private String toolName;
        private String reply;
        private boolean resetsConversation;

        private Builder(String intent) {
            this.intent = intent;
        }

        public Builder required(SlotDefinition... defs) {
            required.addAll(List.of(defs));
            return this;
        }

        public Builder optional(SlotDefinition... defs) {
            optional.addAll(List.of(defs));
            return this;
        }

        public Builder tool(String toolName) {
            this.target = TargetKind.TOOL;
            this.toolName = toolName;
            return this;
        }

        public Builder retrieval() {
            this.target = TargetKind.RETRIEVAL;
            return this;
        }

        public Builder conversational(String reply, boolean resetsConversation) {
            this.target = TargetKind.CONVERSATIONAL;
            this.reply = reply;
            this.resetsConversation = resetsConversation;
            return this;
        }

        public IntentSchema build() {
            return new IntentSchema(this);
        }
    }
}
