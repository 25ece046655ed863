package com.rabs.backend.modules.loom.presentation.dto;

import java.util.List;
import java.util.UUID;

public record CancellationResponse(
        UUID allocationId,
        UUID instanceId,
        String cancellationType,
        long plannedParticipants,
        int requiredNonDriverStaff,
        List<UUID> releasedShiftIds
) {
}
