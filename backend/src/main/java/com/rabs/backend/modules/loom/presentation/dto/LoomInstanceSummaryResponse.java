package com.rabs.backend.modules.loom.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

public record LoomInstanceSummaryResponse(
        UUID id,
        UUID programId,
        String programName,
        LocalDate instanceDate,
        LocalTime startTime,
        LocalTime endTime,
        String venueName,
        String status,
        String staffingStatus,
        String vehicleStatus,
        boolean reoptimized,
        int capacity,
        long participantCount,
        long staffCount,
        long vehicleCount
) {
}
