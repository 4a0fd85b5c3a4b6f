package com.stockdiscussion.collector.collect.api;

public record NaverDiscussionRequest(
    String stockCode,
    String stockName,
    String startDate,
    String endDate
) {
}
