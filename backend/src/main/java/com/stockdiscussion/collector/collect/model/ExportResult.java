package com.stockdiscussion.collector.collect.model;

import java.util.List;

/**
 * Outcome of a successful export. {@code partitions} is ordered most recent day first.
 */
public record ExportResult(
    String stockCode,
    String stockName,
    RecordSource source,
    int totalRecords,
    int skippedRecords,
    List<PartitionDescriptor> partitions
) {
    public ExportResult {
        partitions = List.copyOf(partitions);
    }

    public List<String> urls() {
        return partitions.stream().map(PartitionDescriptor::uri).toList();
    }
}
