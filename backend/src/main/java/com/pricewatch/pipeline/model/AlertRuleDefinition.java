package com.pricewatch.pipeline.model;

import java.math.BigDecimal;

public record AlertRuleDefinition(
    String tenantId,
    String ruleId,
    AlertRuleType ruleType,
    BigDecimal thresholdPercent,
    AlertSeverity severity,
    boolean enabled
) {
}
