package com.stockdiscussion.collector.collect.export;

import com.stockdiscussion.collector.collect.model.DiscussionRecord;
import com.stockdiscussion.collector.collect.model.RecordSource;

import java.time.Instant;

final class TestRecords {
    private TestRecords() {
    }

    static DiscussionRecord naver(long id, String writtenAt) {
        return naver(id, writtenAt == null ? null : Instant.parse(writtenAt));
    }

    static DiscussionRecord naver(long id, Instant writtenAt) {
        return new DiscussionRecord(
            "005930",
            "KR7005930003",
            "삼성전자",
            id,
            "author" + id,
            writtenAt,
            "content " + id,
            1,
            0,
            null,
            RecordSource.NAVER
        );
    }
}
