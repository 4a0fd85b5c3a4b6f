package com.stockdiscussion.collector.collect.export;

import com.stockdiscussion.collector.collect.model.DateKey;
import com.stockdiscussion.collector.collect.model.DiscussionRecord;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class Partitioner {

    private Partitioner() {
    }

    /**
     * Groups records by the calendar day of their timestamp in {@code zone}. Keys appear in
     * first-seen order and records keep their input order inside each group.
     *
     * @throws RecordDataException if a record has no timestamp
     */
    public static Map<DateKey, List<DiscussionRecord>> partition(List<DiscussionRecord> records, ZoneId zone) {
        Objects.requireNonNull(zone, "zone");
        Map<DateKey, List<DiscussionRecord>> groups = new LinkedHashMap<>();
        if (records == null) {
            return groups;
        }
        for (DiscussionRecord record : records) {
            if (!record.hasTimestamp()) {
                throw new RecordDataException(
                    record.recordId(),
                    "record " + record.recordId() + " of " + record.stockCode() + " has no timestamp"
                );
            }
            DateKey key = DateKey.of(record.writtenAt(), zone);
            groups.computeIfAbsent(key, ignored -> new ArrayList<>()).add(record);
        }
        return groups;
    }
}
