package com.rabs.backend.modules.program.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateProgramRequest(
        @NotBlank(message = "NAME_REQUIRED")
        @Size(max = 160, message = "NAME_TOO_LONG")
        String name,
        @Size(max = 64, message = "PROGRAM_TYPE_TOO_LONG")
        String programType,
        @NotNull(message = "START_DATE_REQUIRED")
        LocalDate startDate,
        LocalDate endDate,
        String repeatPattern,
        List<Integer> daysOfWeek,
        @NotNull(message = "START_TIME_REQUIRED")
        LocalTime startTime,
        @NotNull(message = "END_TIME_REQUIRED")
        LocalTime endTime,
        UUID venueId,
        Boolean centreBased,
        String staffAssignmentMode,
        @Min(value = 0, message = "ADDITIONAL_STAFF_NEGATIVE")
        Integer additionalStaffCount,
        @Valid
        List<TimeSlotRequest> timeSlots
) {
}
