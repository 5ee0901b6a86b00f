package com.example.ecotravel.planner.slots;

/** What an intent is routed to once its required slots are filled. */
public enum TargetKind {
    /** A registered tool handler, invoked through the dispatcher. */
    TOOL,
    /** The retrieval-augmented answer pipeline. */
    RETRIEVAL,
    /** Small talk with a fixed reply (greeting, goodbye, restart). */
    CONVERSATIONAL
}
