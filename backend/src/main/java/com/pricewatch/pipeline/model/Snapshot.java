package com.pricewatch.pipeline.model;

import java.math.BigDecimal;
import java.time.Instant;

public record Snapshot(
    long id,
    String tenantId,
    Long jobId,
    Long jobRunId,
    String entityRef,
    BigDecimal price,
    String currency,
    Boolean inStock,
    Instant observedAt,
    String rawMetadata,
    Instant createdAt
) {
}
