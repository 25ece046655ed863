package com.rabs.backend.modules.loom.domain;

public enum StaffRole {
    LEAD,
    SUPPORT,
    DRIVER
}
