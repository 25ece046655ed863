package com.rabs.backend.modules.loom.domain;

public enum LoomInstanceStatus {
    PENDING,
    GENERATED,
    NEEDS_ATTENTION
}
