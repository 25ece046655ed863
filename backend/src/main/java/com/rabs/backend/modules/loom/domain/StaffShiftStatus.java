package com.rabs.backend.modules.loom.domain;

public enum StaffShiftStatus {
    PLANNED,
    REPLACED,
    FLAGGED,
    /** Support shift shed because the participant count dropped. */
    RELEASED
}
