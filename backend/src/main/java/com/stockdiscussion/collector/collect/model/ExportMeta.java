package com.stockdiscussion.collector.collect.model;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Identifies what one export run is about.
 *
 * @param fileIdentifier identifier used in object names; the stock code for most sources, the
 *     ISIN code where the source keys stocks that way
 */
public record ExportMeta(
    String stockCode,
    String stockName,
    RecordSource source,
    ZoneId zone,
    String fileIdentifier
) {
    public ExportMeta {
        if (stockCode == null || stockCode.isBlank()) {
            throw new IllegalArgumentException("stockCode must not be blank");
        }
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(zone, "zone");
        fileIdentifier = fileIdentifier == null || fileIdentifier.isBlank() ? stockCode : fileIdentifier;
    }

    public static ExportMeta of(String stockCode, String stockName, RecordSource source, ZoneId zone) {
        return new ExportMeta(stockCode, stockName, source, zone, stockCode);
    }
}
