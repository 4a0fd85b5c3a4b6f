package com.stockdiscussion.collector.collect.scrape;

public class ScrapeException extends RuntimeException {
    private final String reasonCode;

    public ScrapeException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
