package com.rabs.backend.modules.availability.domain;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Half-open instant range {@code [start, end)}. Back-to-back intervals do not overlap.
 */
public record TimeInterval(OffsetDateTime start, OffsetDateTime end) {

    public TimeInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("end must be after start");
        }
    }

    public static TimeInterval of(LocalDate date, LocalTime startTime, LocalTime endTime, ZoneId zone) {
        return new TimeInterval(
                date.atTime(startTime).atZone(zone).toOffsetDateTime(),
                date.atTime(endTime).atZone(zone).toOffsetDateTime()
        );
    }

    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && end.isAfter(other.start);
    }

    public boolean overlaps(OffsetDateTime otherStart, OffsetDateTime otherEnd) {
        return start.isBefore(otherEnd) && end.isAfter(otherStart);
    }
}
