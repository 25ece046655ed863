package com.rabs.backend.modules.loom.presentation.dto;

import java.util.UUID;

public record SicknessResponse(
        UUID shiftId,
        UUID instanceId,
        String outcome,
        UUID replacementShiftId,
        UUID replacementStaffId,
        String replacementStaffName
) {

    public static final String REPLACED = "REPLACED";
    public static final String FLAGGED = "FLAGGED";
}
