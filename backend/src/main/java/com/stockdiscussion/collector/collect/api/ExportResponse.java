package com.stockdiscussion.collector.collect.api;

import com.stockdiscussion.collector.collect.model.DateRange;
import com.stockdiscussion.collector.collect.model.ExportResult;
import com.stockdiscussion.collector.collect.model.PartitionDescriptor;

import java.time.LocalDate;
import java.util.List;

/**
 * Body returned for a single-stock export. Partitions and urls are most recent day first.
 */
public record ExportResponse(
    int code,
    String message,
    String stockCode,
    String stockName,
    String source,
    LocalDate startDate,
    LocalDate endDate,
    int totalRecords,
    int skippedRecords,
    List<PartitionView> partitions,
    List<String> urls
) {
    public record PartitionView(String dateKey, String uri, int recordCount) {
        static PartitionView of(PartitionDescriptor descriptor) {
            return new PartitionView(descriptor.dateKey().toString(), descriptor.uri(), descriptor.recordCount());
        }
    }

    public static ExportResponse of(ExportResult result, DateRange range) {
        return new ExportResponse(
            200,
            "success",
            result.stockCode(),
            result.stockName(),
            result.source().code(),
            range.start(),
            range.end(),
            result.totalRecords(),
            result.skippedRecords(),
            result.partitions().stream().map(PartitionView::of).toList(),
            result.urls()
        );
    }
}
