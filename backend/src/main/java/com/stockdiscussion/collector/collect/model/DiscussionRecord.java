package com.stockdiscussion.collector.collect.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * One scraped post or comment, normalized across sources.
 *
 * <p>{@code writtenAt} is truncated to whole seconds. It is null only when the scraper could not
 * parse the source timestamp; such records are rejected or skipped at export time.
 */
public record DiscussionRecord(
    String stockCode,
    String isinCode,
    String stockName,
    long recordId,
    String authorName,
    Instant writtenAt,
    String content,
    long likes,
    long dislikes,
    String extra,
    RecordSource source
) {
    public static final String EMPTY_EXTRA = "[]";

    public DiscussionRecord {
        if (stockCode == null || stockCode.isBlank()) {
            throw new IllegalArgumentException("stockCode must not be blank");
        }
        Objects.requireNonNull(source, "source");
        writtenAt = writtenAt == null ? null : writtenAt.truncatedTo(ChronoUnit.SECONDS);
        authorName = authorName == null ? "" : authorName;
        content = content == null ? "" : content;
        likes = Math.max(0L, likes);
        dislikes = Math.max(0L, dislikes);
        extra = extra == null || extra.isBlank() ? EMPTY_EXTRA : extra;
    }

    public boolean hasTimestamp() {
        return writtenAt != null;
    }
}
