package com.example.ecotravel.planner.dialogue;

public enum DialoguePhase {
    AWAITING_INTENT,
    COLLECTING_SLOTS,
    READY_TO_DISPATCH,
    AWAITING_CLARIFICATION,
    RESPONDING
}
