package com.stockdiscussion.collector.collect.api;

public record NaverBatchRequest(
    String startDate,
    String endDate
) {
}
