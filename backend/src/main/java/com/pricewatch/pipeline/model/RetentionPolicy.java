package com.pricewatch.pipeline.model;

import java.time.Instant;

public record RetentionPolicy(
    String tenantId,
    int retentionDaysSnapshots,
    int retentionDaysAlerts,
    int retentionDaysJobs,
    ArchivalStrategy archivalStrategy,
    Instant lastArchiveRunAt
) {
}
