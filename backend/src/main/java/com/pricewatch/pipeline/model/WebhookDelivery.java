package com.pricewatch.pipeline.model;

import java.time.Instant;

public record WebhookDelivery(
    long id,
    String eventId,
    long alertId,
    long subscriptionId,
    String tenantId,
    String eventType,
    String payload,
    DeliveryStatus status,
    int attempts,
    Instant nextAttemptAt,
    Instant lastAttemptAt,
    Integer lastResponseCode,
    String lastError,
    Instant deliveredAt,
    Instant deadLetteredAt,
    Instant createdAt
) {
}
