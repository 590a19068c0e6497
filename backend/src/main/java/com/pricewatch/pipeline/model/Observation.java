package com.pricewatch.pipeline.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

public record Observation(
    String entityRef,
    BigDecimal price,
    String currency,
    Boolean inStock,
    Instant observedAt,
    Map<String, Object> rawMetadata
) {
}
