package com.pricewatch.pipeline.model;

import java.time.Instant;
import java.util.Map;

public record Job(
    long id,
    String tenantId,
    String name,
    String targetRef,
    SourceType sourceType,
    Map<String, String> sourceConfig,
    int rateLimitPerMin,
    int priority,
    JobStatus status,
    int successIntervalMinutes,
    int retryIntervalMinutes,
    Instant lastRunAt,
    Instant nextRunAt,
    JobRunStatus lastStatus,
    String lastError,
    int consecutiveFailures,
    Long runningRunId,
    Instant runningSince,
    Instant createdAt,
    Instant updatedAt
) {
    public String sourceSetting(String key) {
        if (sourceConfig == null) {
            return null;
        }
        String value = sourceConfig.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
