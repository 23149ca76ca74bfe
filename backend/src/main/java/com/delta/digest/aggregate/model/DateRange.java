package com.delta.digest.aggregate.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Inclusive publication window; either bound may be open.
 */
public record DateRange(Instant start, Instant end) {
    public DateRange {
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("range start " + start + " is after end " + end);
        }
    }

    public static DateRange ofDay(LocalDate day) {
        Instant start = day.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant end = day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusNanos(1);
        return new DateRange(start, end);
    }

    public boolean contains(Instant instant) {
        if (instant == null) {
            return true;
        }
        if (start != null && instant.isBefore(start)) {
            return false;
        }
        return end == null || !instant.isAfter(end);
    }
}
