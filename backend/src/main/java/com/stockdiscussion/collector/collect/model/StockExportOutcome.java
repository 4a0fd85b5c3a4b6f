package com.stockdiscussion.collector.collect.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public record StockExportOutcome(
    String stockCode,
    Status status,
    int totalRecords,
    List<String> urls,
    String error
) {
    public enum Status {
        SUCCESS,
        NO_DATA,
        FAILED;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static StockExportOutcome success(String stockCode, ExportResult result) {
        return new StockExportOutcome(stockCode, Status.SUCCESS, result.totalRecords(), result.urls(), null);
    }

    public static StockExportOutcome noData(String stockCode) {
        return new StockExportOutcome(stockCode, Status.NO_DATA, 0, List.of(), null);
    }

    public static StockExportOutcome failed(String stockCode, String error) {
        return new StockExportOutcome(stockCode, Status.FAILED, 0, List.of(), error);
    }
}
