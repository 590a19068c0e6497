package com.pricewatch.pipeline.model;

import java.math.BigDecimal;

public record AlertMatch(
    String ruleId,
    AlertRuleType ruleType,
    BigDecimal previousPrice,
    BigDecimal currentPrice,
    BigDecimal deltaPercent,
    AlertSeverity severity
) {
}
