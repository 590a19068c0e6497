package com.pricewatch.pipeline.model;

import java.time.Instant;

public record RetentionSweepResult(
    String tenantId,
    ArchivalStrategy strategy,
    int snapshotsAffected,
    int alertsAffected,
    int jobRunsArchived,
    Instant ranAt
) {
}
