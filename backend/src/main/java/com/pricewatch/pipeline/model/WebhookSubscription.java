package com.pricewatch.pipeline.model;

import java.util.Set;

public record WebhookSubscription(
    long id,
    String tenantId,
    String targetUrl,
    Set<String> eventTypes,
    String secret,
    boolean active
) {
    public static final String ALL_EVENTS = "*";

    public boolean accepts(String eventType) {
        if (eventTypes == null || eventTypes.isEmpty()) {
            return false;
        }
        return eventTypes.contains(ALL_EVENTS) || eventTypes.contains(eventType);
    }
}
