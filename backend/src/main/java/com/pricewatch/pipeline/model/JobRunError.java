package com.pricewatch.pipeline.model;

import java.util.Map;

/**
 * Structured failure detail persisted as JSON on a job run.
 */
public record JobRunError(
    JobRunErrorType type,
    boolean transientFailure,
    String message,
    int partialCount,
    Map<String, String> entityErrors
) {
    public static JobRunError of(JobRunErrorType type, boolean transientFailure, String message) {
        return new JobRunError(type, transientFailure, message, 0, Map.of());
    }
}
