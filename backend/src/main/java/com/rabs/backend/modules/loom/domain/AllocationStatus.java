package com.rabs.backend.modules.loom.domain;

public enum AllocationStatus {
    PLANNED,
    CANCELLED
}
