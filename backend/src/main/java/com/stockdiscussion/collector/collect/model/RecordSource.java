package com.stockdiscussion.collector.collect.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecordSource {
    NAVER("naver"),
    TOSS("toss");

    private final String code;

    RecordSource(String code) {
        this.code = code;
    }

    /**
     * Lower-case tag written to the {@code source} column.
     */
    @JsonValue
    public String code() {
        return code;
    }
}
