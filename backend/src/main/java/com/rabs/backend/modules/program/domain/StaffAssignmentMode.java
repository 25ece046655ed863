package com.rabs.backend.modules.program.domain;

public enum StaffAssignmentMode {
    AUTO,
    MANUAL
}
