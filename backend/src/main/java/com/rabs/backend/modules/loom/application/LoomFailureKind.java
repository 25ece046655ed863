package com.rabs.backend.modules.loom.application;

public enum LoomFailureKind {
    VALIDATION,
    NOT_FOUND,
    CONFLICT,
    /** Not enough staff or seats. The flagged state was committed. */
    INSUFFICIENT_RESOURCES,
    STORAGE
}
