package com.rabs.backend.modules.program.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Set;

/**
 * Date-level recurrence of a program. {@code endDate} is inclusive and may be null.
 */
public record ProgramSchedule(LocalDate startDate, LocalDate endDate, RepeatPattern pattern, Set<DayOfWeek> days) {

    public ProgramSchedule {
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(pattern, "pattern");
        days = days == null ? Set.of() : Set.copyOf(days);
    }
}
