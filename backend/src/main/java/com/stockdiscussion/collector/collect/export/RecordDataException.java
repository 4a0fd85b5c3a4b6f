package com.stockdiscussion.collector.collect.export;

public class RecordDataException extends RuntimeException {
    private final long recordId;

    public RecordDataException(long recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    public long getRecordId() {
        return recordId;
    }
}
