package com.rabs.backend.modules.loom.domain;

/**
 * Outcome of one optimisation sub-step (staffing or transport) on an instance.
 */
public enum StepStatus {
    COMPLETE,
    INSUFFICIENT,
    NEEDS_ATTENTION;

    public boolean requiresAttention() {
        return switch (this) {
            case COMPLETE -> false;
            case INSUFFICIENT, NEEDS_ATTENTION -> true;
        };
    }
}
