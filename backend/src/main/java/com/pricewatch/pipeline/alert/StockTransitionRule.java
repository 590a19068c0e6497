package com.pricewatch.pipeline.alert;

import com.pricewatch.pipeline.model.AlertMatch;
import com.pricewatch.pipeline.model.AlertRuleType;
import com.pricewatch.pipeline.model.AlertSeverity;
import com.pricewatch.pipeline.model.Snapshot;

import java.util.Optional;

/**
 * Matches an availability flip between two known states. Unknown availability on either side never matches.
 */
public class StockTransitionRule implements AlertRule {
    private final String ruleId;
    private final AlertRuleType type;
    private final AlertSeverity severity;

    public StockTransitionRule(String ruleId, AlertRuleType type, AlertSeverity severity) {
        if (type != AlertRuleType.OUT_OF_STOCK && type != AlertRuleType.BACK_IN_STOCK) {
            throw new IllegalArgumentException("Not a stock rule type: " + type);
        }
        this.ruleId = ruleId;
        this.type = type;
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
        if (previous == null || previous.inStock() == null || current.inStock() == null) {
            return Optional.empty();
        }
        boolean wentOut = previous.inStock() && !current.inStock();
        boolean cameBack = !previous.inStock() && current.inStock();
        boolean matched = type == AlertRuleType.OUT_OF_STOCK ? wentOut : cameBack;
        if (!matched) {
            return Optional.empty();
        }
        return Optional.of(new AlertMatch(ruleId, type, previous.price(), current.price(), null, severity));
    }
}
