package com.pricewatch.pipeline.model;

import java.util.Map;

public record JobDefinitionRequest(
    String tenantId,
    String name,
    String targetRef,
    SourceType sourceType,
    Map<String, String> sourceConfig,
    Integer rateLimitPerMin,
    Integer priority,
    Integer successIntervalMinutes,
    Integer retryIntervalMinutes
) {
}
