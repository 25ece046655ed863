package com.rabs.backend.modules.loom.presentation.dto;

import java.util.List;
import java.util.UUID;

public record StaffAssignmentResponse(
        UUID instanceId,
        boolean skipped,
        long plannedParticipants,
        int requiredStaff,
        int availableCandidates,
        List<StaffShiftResponse> assignedShifts
) {
}
