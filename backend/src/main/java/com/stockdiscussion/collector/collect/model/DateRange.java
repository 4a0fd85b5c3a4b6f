package com.stockdiscussion.collector.collect.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive range of calendar days.
 */
public record DateRange(LocalDate start, LocalDate end) {
    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start date " + start + " is after end date " + end);
        }
    }

    public static DateRange lastDays(int days, LocalDate today) {
        return new DateRange(today.minusDays(Math.max(0, days)), today);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    public boolean isBeforeStart(LocalDate date) {
        return date.isBefore(start);
    }

    public boolean isAfterEnd(LocalDate date) {
        return date.isAfter(end);
    }
}
