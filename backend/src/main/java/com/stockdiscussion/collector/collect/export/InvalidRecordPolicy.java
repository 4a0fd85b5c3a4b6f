package com.stockdiscussion.collector.collect.export;

/**
 * What an export does with a record whose timestamp is missing.
 */
public enum InvalidRecordPolicy {
    /** Abort the export before anything is serialized. */
    FAIL,
    /** Drop the record, log it and count it in the result. */
    SKIP
}
