package com.rabs.backend.modules.loom.domain;

import java.time.LocalDate;
import java.util.stream.Stream;

import com.rabs.backend.modules.program.domain.ProgramSchedule;

/**
 * Expands a program schedule into the concrete dates it occurs on.
 */
public final class RecurrenceExpander {

    private RecurrenceExpander() {
    }

    /**
     * Lazily yields every occurrence in {@code [rangeStart, rangeEnd)} that also falls
     * inside the program's own start and end dates. Each call returns a fresh stream.
     */
    public static Stream<LocalDate> expand(ProgramSchedule schedule, LocalDate rangeStart, LocalDate rangeEnd) {
        LocalDate from = rangeStart.isAfter(schedule.startDate()) ? rangeStart : schedule.startDate();
        LocalDate until = rangeEnd;
        if (schedule.endDate() != null && schedule.endDate().plusDays(1).isBefore(until)) {
            until = schedule.endDate().plusDays(1);
        }
        if (!from.isBefore(until)) {
            return Stream.empty();
        }
        return from.datesUntil(until)
                .filter(date -> schedule.pattern().occursOn(date, schedule.startDate(), schedule.days()));
    }

    public static Stream<LocalDate> expand(ProgramSchedule schedule, LoomWindow window) {
        return expand(schedule, window.startDate(), window.endDate());
    }
}
