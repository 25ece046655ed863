package com.rabs.backend.modules.loom.presentation.dto;

import java.time.LocalDate;

public record LoomWindowResponse(
        int windowWeeks,
        int participantsPerSupportWorker,
        LocalDate startDate,
        LocalDate endDate,
        int instancesCreated,
        int instancesRemoved
) {
}
