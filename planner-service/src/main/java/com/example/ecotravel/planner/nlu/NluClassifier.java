package com.example.ecotravel.planner.nlu;

import com.example.ecotravel.common.nlu.NluResult;

/** Classifies a user message. Never throws: failures come back as {@link NluResult#fallback()}. */
public interface NluClassifier {
    NluResult classify(String text);
}
