package com.example.ecotravel.common.nlu;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of the NLU classifier for one user message: an intent label and the entities
 * extracted from the text, in order of appearance.
 */
public class NluResult {
    public static final String FALLBACK_INTENT = "nlu_fallback";

    private String intent;
    private List<NluEntity> entities = new ArrayList<>();

    public NluResult() {}

    public NluResult(String intent, List<NluEntity> entities) {
        this.intent = intent;
        if (entities != null) this.entities = new ArrayList<>(entities);
    }

    public static NluResult fallback() {
        return new NluResult(FALLBACK_INTENT, List.of());
    }

    public String getIntent() { return intent; }
    public void setIntent(String intent) { this.intent = intent; }
    public List<NluEntity> getEntities() { return entities; }
    public void setEntities(List<NluEntity> entities) { this.entities = entities; }
}
