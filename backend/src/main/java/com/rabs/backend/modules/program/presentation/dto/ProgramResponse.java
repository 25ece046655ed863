package com.rabs.backend.modules.program.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record ProgramResponse(
        UUID programId,
        String name,
        String programType,
        LocalDate startDate,
        LocalDate endDate,
        String repeatPattern,
        List<Integer> daysOfWeek,
        LocalTime startTime,
        LocalTime endTime,
        UUID venueId,
        String venueName,
        boolean centreBased,
        String staffAssignmentMode,
        int additionalStaffCount,
        boolean active,
        List<TimeSlot> timeSlots,
        int instancesCreated,
        int instancesRemoved,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public record TimeSlot(int seq, String label, LocalTime startTime, LocalTime endTime) {
    }
}
