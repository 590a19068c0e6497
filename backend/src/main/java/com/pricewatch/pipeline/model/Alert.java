package com.pricewatch.pipeline.model;

import java.math.BigDecimal;
import java.time.Instant;

public record Alert(
    long id,
    String eventId,
    String tenantId,
    long snapshotId,
    String entityRef,
    String ruleId,
    AlertRuleType ruleType,
    BigDecimal previousPrice,
    BigDecimal currentPrice,
    BigDecimal deltaPercent,
    AlertSeverity severity,
    Instant detectedAt,
    AlertDeliveryStatus deliveryStatus
) {
}
