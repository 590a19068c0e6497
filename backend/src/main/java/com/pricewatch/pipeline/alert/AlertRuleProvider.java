package com.pricewatch.pipeline.alert;

import com.pricewatch.config.PipelineProperties;
import com.pricewatch.pipeline.model.AlertRuleDefinition;
import com.pricewatch.pipeline.model.AlertRuleType;
import com.pricewatch.pipeline.model.AlertSeverity;
import com.pricewatch.pipeline.persistence.AlertJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the rule set of a tenant from its {@code alert_rules} rows. A tenant with no rows at all gets the
 * configured defaults; a tenant whose rows are all disabled gets no rules.
 */
@Component
public class AlertRuleProvider {
    private static final Logger log = LoggerFactory.getLogger(AlertRuleProvider.class);

    private final AlertJdbcRepository repository;
    private final PipelineProperties.Alerts properties;

    public AlertRuleProvider(AlertJdbcRepository repository, PipelineProperties properties) {
        this.repository = repository;
        this.properties = properties.getAlerts();
    }

    public List<AlertRule> rulesFor(String tenantId) {
        List<AlertRuleDefinition> definitions = repository.findRuleDefinitions(tenantId);
        if (definitions.isEmpty()) {
            return defaultRules();
        }
        List<AlertRule> rules = new ArrayList<>();
        for (AlertRuleDefinition definition : definitions) {
            if (!definition.enabled()) {
                continue;
            }
            try {
                rules.add(toRule(definition));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping invalid alert rule {} of tenant {}: {}", definition.ruleId(), tenantId, e.getMessage());
            }
        }
        return rules;
    }

    List<AlertRule> defaultRules() {
        List<AlertRule> rules = new ArrayList<>();
        if (properties.getDefaultPriceDropPercent() > 0) {
            rules.add(new PercentChangeRule(
                "default-price-drop",
                AlertRuleType.PRICE_DROP_PERCENT,
                BigDecimal.valueOf(properties.getDefaultPriceDropPercent()),
                AlertSeverity.WARNING
            ));
        }
        if (properties.getDefaultPriceIncreasePercent() > 0) {
            rules.add(new PercentChangeRule(
                "default-price-increase",
                AlertRuleType.PRICE_INCREASE_PERCENT,
                BigDecimal.valueOf(properties.getDefaultPriceIncreasePercent()),
                AlertSeverity.INFO
            ));
        }
        if (properties.isDefaultOutOfStock()) {
            rules.add(new StockTransitionRule("default-out-of-stock", AlertRuleType.OUT_OF_STOCK, AlertSeverity.WARNING));
        }
        return rules;
    }

    static AlertRule toRule(AlertRuleDefinition definition) {
        return switch (definition.ruleType()) {
            case PRICE_DROP_PERCENT, PRICE_INCREASE_PERCENT -> new PercentChangeRule(
                definition.ruleId(),
                definition.ruleType(),
                definition.thresholdPercent(),
                definition.severity()
            );
            case OUT_OF_STOCK, BACK_IN_STOCK -> new StockTransitionRule(
                definition.ruleId(),
                definition.ruleType(),
                definition.severity()
            );
        };
    }
}
