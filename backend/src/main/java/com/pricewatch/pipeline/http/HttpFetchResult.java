package com.pricewatch.pipeline.http;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of a source call. {@code failureClass} is decided by {@link PoliteFetchClient}; {@code retryAfter} is
 * the source's own {@code Retry-After} hint, when it sent one.
 */
public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage,
    FailureClass failureClass,
    Duration retryAfter
) {
    public boolean isSuccessful() {
        return failureClass == FailureClass.NONE;
    }

    public boolean isTransientFailure() {
        return failureClass == FailureClass.TRANSIENT;
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorMessage == null ? errorCode : errorCode + ": " + errorMessage;
        }
        return "http_" + statusCode;
    }
}
