package com.example.ecotravel.planner.slots;

public enum SlotStatus {
    UNSET,
    PENDING_CLARIFICATION,
    FILLED
}
