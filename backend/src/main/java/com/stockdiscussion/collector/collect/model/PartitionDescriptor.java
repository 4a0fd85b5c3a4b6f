package com.stockdiscussion.collector.collect.model;

public record PartitionDescriptor(
    DateKey dateKey,
    String uri,
    int recordCount
) {
}
