package com.pricewatch.pipeline.alert;

import com.pricewatch.pipeline.model.AlertMatch;
import com.pricewatch.pipeline.model.AlertRuleType;
import com.pricewatch.pipeline.model.AlertSeverity;
import com.pricewatch.pipeline.model.Snapshot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Matches when the price moved in the rule's direction by strictly more than the threshold. A move of at
 * least twice the threshold is escalated to {@link AlertSeverity#CRITICAL}.
 */
public class PercentChangeRule implements AlertRule {
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final String ruleId;
    private final AlertRuleType type;
    private final BigDecimal thresholdPercent;
    private final AlertSeverity severity;

    public PercentChangeRule(String ruleId, AlertRuleType type, BigDecimal thresholdPercent, AlertSeverity severity) {
        if (type != AlertRuleType.PRICE_DROP_PERCENT && type != AlertRuleType.PRICE_INCREASE_PERCENT) {
            throw new IllegalArgumentException("Not a percent rule type: " + type);
        }
        if (thresholdPercent == null || thresholdPercent.signum() < 0) {
            throw new IllegalArgumentException("Threshold must be a non-negative percentage");
        }
        this.ruleId = ruleId;
        this.type = type;
        this.thresholdPercent = thresholdPercent;
        this.severity = severity == null ? AlertSeverity.WARNING : severity;
    }

    @Override
    public String ruleId() {
        return ruleId;
    }

    @Override
    public AlertRuleType type() {
        return type;
    }

    @Override
    public Optional<AlertMatch> evaluate(Snapshot previous, Snapshot current) {
        if (previous == null || previous.price() == null || current.price() == null) {
            return Optional.empty();
        }
        if (previous.price().signum() <= 0) {
            return Optional.empty();
        }
        if (previous.currency() != null && current.currency() != null
            && !previous.currency().equalsIgnoreCase(current.currency())) {
            return Optional.empty();
        }
        BigDecimal delta = current.price()
            .subtract(previous.price())
            .multiply(HUNDRED)
            .divide(previous.price(), 3, RoundingMode.HALF_UP);
        BigDecimal movement = type == AlertRuleType.PRICE_DROP_PERCENT ? delta.negate() : delta;
        if (movement.compareTo(thresholdPercent) <= 0) {
            return Optional.empty();
        }
        AlertSeverity computed = thresholdPercent.signum() > 0
            && movement.compareTo(thresholdPercent.multiply(BigDecimal.valueOf(2))) >= 0
            ? AlertSeverity.CRITICAL
            : severity;
        return Optional.of(new AlertMatch(ruleId, type, previous.price(), current.price(), delta, computed));
    }
}
