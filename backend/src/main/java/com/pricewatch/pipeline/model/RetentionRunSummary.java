package com.pricewatch.pipeline.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record RetentionRunSummary(
    Instant startedAt,
    Instant finishedAt,
    List<RetentionSweepResult> results,
    Map<String, String> failedTenants
) {
}
