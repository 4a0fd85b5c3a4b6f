package com.stockdiscussion.collector.collect.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Calendar day a record belongs to, rendered as {@code YYYY-MM-DD}.
 */
public record DateKey(LocalDate date) implements Comparable<DateKey> {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    public DateKey {
        Objects.requireNonNull(date, "date");
    }

    public static DateKey of(Instant instant, ZoneId zone) {
        Objects.requireNonNull(instant, "instant");
        Objects.requireNonNull(zone, "zone");
        return new DateKey(instant.atZone(zone).toLocalDate());
    }

    public static DateKey parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("date key is required");
        }
        try {
            return new DateKey(LocalDate.parse(raw.trim(), FORMAT));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("date key must be YYYY-MM-DD: " + raw, e);
        }
    }

    @Override
    public int compareTo(DateKey other) {
        return date.compareTo(other.date);
    }

    @Override
    public String toString() {
        return date.format(FORMAT);
    }
}
