package com.stockdiscussion.collector.collect.api;

public record TossCommentRequest(
    String stockCode,
    String start,
    String end,
    Integer maxItems
) {
}
