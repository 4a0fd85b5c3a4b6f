package com.stockdiscussion.collector.collect.scrape;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Parses the timestamp shapes the discussion sites emit. Values without an offset are read as
 * local time in the given zone.
 */
public final class TimestampParser {
    private static final Logger log = LoggerFactory.getLogger(TimestampParser.class);

    private static final List<DateTimeFormatter> OFFSET_FORMATS = List.of(
        DateTimeFormatter.ISO_OFFSET_DATE_TIME,
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss[.SSS]xx")
    );
    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]"),
        DateTimeFormatter.ofPattern("yyyy.MM.dd HH:mm[:ss]")
    );

    private TimestampParser() {
    }

    public static Instant parse(String raw, ZoneId zone) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        for (DateTimeFormatter format : OFFSET_FORMATS) {
            try {
                return OffsetDateTime.parse(value, format).toInstant();
            } catch (DateTimeParseException ignored) {
                // try the next shape
            }
        }
        for (DateTimeFormatter format : LOCAL_FORMATS) {
            try {
                return LocalDateTime.parse(value, format).atZone(zone).toInstant();
            } catch (DateTimeParseException ignored) {
                // try the next shape
            }
        }
        log.debug("Unparseable timestamp: {}", raw);
        return null;
    }
}
