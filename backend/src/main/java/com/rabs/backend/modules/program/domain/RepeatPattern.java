package com.rabs.backend.modules.program.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Set;

/**
 * How a program repeats. Each pattern decides whether a single candidate date
 * is an occurrence, given the program's anchor date and weekdays.
 */
public enum RepeatPattern {
    NONE {
        @Override
        public boolean occursOn(LocalDate date, LocalDate anchor, Set<DayOfWeek> days) {
            return date.equals(anchor);
        }
    },
    WEEKLY {
        @Override
        public boolean occursOn(LocalDate date, LocalDate anchor, Set<DayOfWeek> days) {
            return days.contains(date.getDayOfWeek());
        }
    },
    FORTNIGHTLY {
        @Override
        public boolean occursOn(LocalDate date, LocalDate anchor, Set<DayOfWeek> days) {
            long weeksSinceAnchor = Math.floorDiv(ChronoUnit.DAYS.between(anchor, date), 7L);
            return days.contains(date.getDayOfWeek()) && Math.floorMod(weeksSinceAnchor, 2L) == 0;
        }
    },
    MONTHLY {
        @Override
        public boolean occursOn(LocalDate date, LocalDate anchor, Set<DayOfWeek> days) {
            return days.contains(date.getDayOfWeek()) && date.getDayOfMonth() == anchor.getDayOfMonth();
        }
    };

    public abstract boolean occursOn(LocalDate date, LocalDate anchor, Set<DayOfWeek> days);
}
