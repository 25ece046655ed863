package com.rabs.backend.modules.loom.domain;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Half-open date range {@code [startDate, endDate)} in which instances are materialised.
 */
public record LoomWindow(LocalDate startDate, LocalDate endDate) {

    public LoomWindow {
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("endDate must not precede startDate");
        }
    }

    public static LoomWindow of(LocalDate today, int weekCount) {
        if (weekCount < 0) {
            throw new IllegalArgumentException("weekCount must not be negative");
        }
        return new LoomWindow(today, today.plusDays(7L * weekCount));
    }

    public long weekCount() {
        return ChronoUnit.DAYS.between(startDate, endDate) / 7;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && date.isBefore(endDate);
    }
}
