package com.rabs.backend.modules.program.presentation.dto;

import java.time.LocalTime;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record TimeSlotRequest(
        @NotBlank(message = "SLOT_LABEL_REQUIRED")
        @Size(max = 120, message = "SLOT_LABEL_TOO_LONG")
        String label,
        @NotNull(message = "SLOT_START_REQUIRED")
        LocalTime startTime,
        @NotNull(message = "SLOT_END_REQUIRED")
        LocalTime endTime
) {
}
