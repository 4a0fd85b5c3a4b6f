package com.stockdiscussion.collector.collect.model;

public record StockInfo(
    String stockCode,
    String stockName,
    String isinCode
) {
    public StockInfo {
        if (stockCode == null || stockCode.isBlank()) {
            throw new IllegalArgumentException("stockCode must not be blank");
        }
        stockCode = stockCode.trim();
    }

    public boolean hasIsinCode() {
        return isinCode != null && !isinCode.isBlank();
    }

    /**
     * Naver names files after the stock code; Toss keys stocks by ISIN, so its files follow.
     */
    public String fileIdentifierFor(RecordSource source) {
        if (source == RecordSource.TOSS && hasIsinCode()) {
            return isinCode;
        }
        return stockCode;
    }
}
