package com.stockdiscussion.collector.collect.model;

import java.net.URI;

/**
 * One HTTP exchange after retries. Transport failures carry an {@code errorCode} and status 0.
 */
public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    int attempts,
    String errorCode,
    String errorMessage
) {
    public static HttpFetchResult failure(String requestedUrl, int attempts, String errorCode, String errorMessage) {
        return new HttpFetchResult(requestedUrl, null, 0, null, null, attempts, errorCode, errorMessage);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    /**
     * Worth another attempt: transport trouble other than a bad URL or an interrupt, or a
     * 408, 429 or 5xx answer.
     */
    public boolean isTransient() {
        if (errorCode != null) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted");
        }
        return statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorCode + (errorMessage == null ? "" : ": " + errorMessage);
        }
        return "http_" + statusCode;
    }
}
