package com.pricewatch.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Body posted to subscribers. Field names are part of the public contract.
 */
public record WebhookEvent(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("occurred_at") Instant occurredAt,
    @JsonProperty("payload") Map<String, Object> payload
) {
}
