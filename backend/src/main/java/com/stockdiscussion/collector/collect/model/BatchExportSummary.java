package com.stockdiscussion.collector.collect.model;

import java.util.List;

public record BatchExportSummary(
    RecordSource source,
    DateRange range,
    int totalStocks,
    int successCount,
    int noDataCount,
    int failCount,
    List<StockExportOutcome> results) {}
