package com.pricewatch.pipeline.model;

public record TrackedEntity(
    String entityRef,
    String tenantId,
    String targetRef,
    String displayName,
    String sourceUrl,
    String sku
) {
}
