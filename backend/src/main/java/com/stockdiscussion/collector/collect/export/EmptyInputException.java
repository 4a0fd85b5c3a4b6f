package com.stockdiscussion.collector.collect.export;

/**
 * Nothing to export. Callers treat this as a no-op outcome, not a server failure.
 */
public class EmptyInputException extends RuntimeException {
    public EmptyInputException(String message) {
        super(message);
    }
}
