package com.rabs.backend.modules.loom.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import com.rabs.backend.modules.program.domain.ProgramSchedule;
import com.rabs.backend.modules.program.domain.RepeatPattern;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RecurrenceExpanderTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 1, 6);

    @Test
    @DisplayName("weekly Tuesday program yields one date per week across the window")
    void weeklyTuesday() {
        ProgramSchedule schedule = new ProgramSchedule(MONDAY, null, RepeatPattern.WEEKLY, Set.of(DayOfWeek.TUESDAY));

        List<LocalDate> dates = RecurrenceExpander.expand(schedule, LoomWindow.of(MONDAY, 8)).toList();

        assertThat(dates).containsExactly(
                LocalDate.of(2025, 1, 7),
                LocalDate.of(2025, 1, 14),
                LocalDate.of(2025, 1, 21),
                LocalDate.of(2025, 1, 28),
                LocalDate.of(2025, 2, 4),
                LocalDate.of(2025, 2, 11),
                LocalDate.of(2025, 2, 18),
                LocalDate.of(2025, 2, 25)
        );
    }

    @Test
    @DisplayName("fortnightly program skips every second week counted from its start date")
    void fortnightlySkipsAlternateWeeks() {
        ProgramSchedule schedule = new ProgramSchedule(MONDAY, null, RepeatPattern.FORTNIGHTLY, Set.of(DayOfWeek.MONDAY));

        List<LocalDate> dates = RecurrenceExpander.expand(schedule, LoomWindow.of(MONDAY, 6)).toList();

        assertThat(dates).containsExactly(
                LocalDate.of(2025, 1, 6),
                LocalDate.of(2025, 1, 20),
                LocalDate.of(2025, 2, 3)
        );
    }

    @Test
    @DisplayName("fortnightly parity stays anchored to the start date when the range starts later")
    void fortnightlyParityFromLaterRange() {
        ProgramSchedule schedule = new ProgramSchedule(MONDAY, null, RepeatPattern.FORTNIGHTLY, Set.of(DayOfWeek.MONDAY));

        List<LocalDate> dates = RecurrenceExpander.expand(schedule, LocalDate.of(2025, 1, 13), LocalDate.of(2025, 2, 10)).toList();

        assertThat(dates).containsExactly(LocalDate.of(2025, 1, 20), LocalDate.of(2025, 2, 3));
    }

    @Test
    @DisplayName("monthly program needs both the weekday and the day of month to match")
    void monthlyMatchesDayOfMonthAndWeekday() {
        ProgramSchedule schedule = new ProgramSchedule(MONDAY, null, RepeatPattern.MONTHLY, Set.of(DayOfWeek.MONDAY));

        List<LocalDate> dates = RecurrenceExpander.expand(schedule, MONDAY, LocalDate.of(2025, 12, 31)).toList();

        assertThat(dates).containsExactly(LocalDate.of(2025, 1, 6), LocalDate.of(2025, 10, 6));
    }

    @Test
    @DisplayName("one-off program yields its start date only when inside the range")
    void oneOff() {
        LocalDate startDate = LocalDate.of(2025, 1, 8);
        ProgramSchedule schedule = new ProgramSchedule(startDate, null, RepeatPattern.NONE, Set.of());

        assertThat(RecurrenceExpander.expand(schedule, MONDAY, MONDAY.plusWeeks(2)).toList()).containsExactly(startDate);
        assertThat(RecurrenceExpander.expand(schedule, startDate.plusDays(1), MONDAY.plusWeeks(2)).toList()).isEmpty();
    }

    @Test
    @DisplayName("program end date is inclusive and clips the range")
    void endDateClipsRange() {
        ProgramSchedule schedule = new ProgramSchedule(
                MONDAY, LocalDate.of(2025, 1, 14), RepeatPattern.WEEKLY, Set.of(DayOfWeek.TUESDAY));

        List<LocalDate> dates = RecurrenceExpander.expand(schedule, LoomWindow.of(MONDAY, 8)).toList();

        assertThat(dates).containsExactly(LocalDate.of(2025, 1, 7), LocalDate.of(2025, 1, 14));
    }

    @Test
    @DisplayName("range end is exclusive and an empty range yields nothing")
    void rangeEndExclusive() {
        ProgramSchedule schedule = new ProgramSchedule(MONDAY, null, RepeatPattern.WEEKLY, Set.of(DayOfWeek.MONDAY));

        assertThat(RecurrenceExpander.expand(schedule, MONDAY, MONDAY.plusWeeks(1)).toList()).containsExactly(MONDAY);
        assertThat(RecurrenceExpander.expand(schedule, MONDAY, MONDAY).toList()).isEmpty();
    }

    @Test
    @DisplayName("each call returns a fresh stream over the same dates")
    void restartable() {
        ProgramSchedule schedule = new ProgramSchedule(MONDAY, null, RepeatPattern.WEEKLY, Set.of(DayOfWeek.WEDNESDAY));

        Stream<LocalDate> first = RecurrenceExpander.expand(schedule, LoomWindow.of(MONDAY, 3));
        Stream<LocalDate> second = RecurrenceExpander.expand(schedule, LoomWindow.of(MONDAY, 3));

        assertThat(first.toList()).isEqualTo(second.toList()).hasSize(3);
    }
}
