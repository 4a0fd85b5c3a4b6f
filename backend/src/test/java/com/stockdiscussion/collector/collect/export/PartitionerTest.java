package com.stockdiscussion.collector.collect.export;

import com.stockdiscussion.collector.collect.model.DateKey;
import com.stockdiscussion.collector.collect.model.DiscussionRecord;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class PartitionerTest {
    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");

    @Test
    void groupsByLocalDayInTheRunZone() {
        DiscussionRecord lateEvening = TestRecords.naver(1, "2025-11-15T14:59:59Z");
        DiscussionRecord pastMidnight = TestRecords.naver(2, "2025-11-15T15:00:00Z");

        Map<DateKey, List<DiscussionRecord>> groups = Partitioner.partition(List.of(lateEvening, pastMidnight), SEOUL);

        assertThat(groups).containsOnlyKeys(DateKey.parse("2025-11-15"), DateKey.parse("2025-11-16"));
        assertThat(groups.get(DateKey.parse("2025-11-15"))).containsExactly(lateEvening);
        assertThat(groups.get(DateKey.parse("2025-11-16"))).containsExactly(pastMidnight);
    }

    @Test
    void sameInstantLandsOnDifferentDaysInDifferentZones() {
        DiscussionRecord record = TestRecords.naver(1, "2025-11-15T15:00:00Z");

        assertThat(Partitioner.partition(List.of(record), ZoneId.of("UTC"))).containsOnlyKeys(DateKey.parse("2025-11-15"));
        assertThat(Partitioner.partition(List.of(record), SEOUL)).containsOnlyKeys(DateKey.parse("2025-11-16"));
    }

    @Test
    void everyRecordAppearsExactlyOnceAndKeepsInputOrder() {
        List<DiscussionRecord> records = List.of(
            TestRecords.naver(1, "2025-11-14T01:00:00Z"),
            TestRecords.naver(2, "2025-11-13T01:00:00Z"),
            TestRecords.naver(3, "2025-11-14T02:00:00Z"),
            TestRecords.naver(4, "2025-11-13T03:00:00Z"),
            TestRecords.naver(5, "2025-11-12T23:30:00Z")
        );

        Map<DateKey, List<DiscussionRecord>> groups = Partitioner.partition(records, SEOUL);

        assertThat(groups.values().stream().mapToInt(List::size).sum()).isEqualTo(records.size());
        assertThat(groups.get(DateKey.parse("2025-11-14")))
            .extracting(DiscussionRecord::recordId)
            .containsExactly(1L, 3L);
        assertThat(groups.get(DateKey.parse("2025-11-13")))
            .extracting(DiscussionRecord::recordId)
            .containsExactly(2L, 4L, 5L);
        assertThat(groups.keySet()).containsExactly(DateKey.parse("2025-11-14"), DateKey.parse("2025-11-13"));
    }

    @Test
    void emptyInputGivesEmptyMap() {
        assertThat(Partitioner.partition(List.of(), SEOUL)).isEmpty();
    }

    @Test
    void recordWithoutTimestampIsRejected() {
        List<DiscussionRecord> records = List.of(
            TestRecords.naver(1, "2025-11-14T01:00:00Z"),
            TestRecords.naver(42, (String) null)
        );

        RecordDataException error = catchThrowableOfType(
            () -> Partitioner.partition(records, SEOUL),
            RecordDataException.class
        );

        assertThat(error).isNotNull();
        assertThat(error.getRecordId()).isEqualTo(42L);
    }
}
