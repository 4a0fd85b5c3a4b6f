package com.stockdiscussion.collector.collect.model;

import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

public record Partition(DateKey dateKey, ZoneId zone, List<DiscussionRecord> records) {
    public Partition {
        Objects.requireNonNull(dateKey, "dateKey");
        Objects.requireNonNull(zone, "zone");
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
