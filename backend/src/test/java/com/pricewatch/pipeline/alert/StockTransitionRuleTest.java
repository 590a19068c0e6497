package com.pricewatch.pipeline.alert;

import com.pricewatch.pipeline.model.AlertRuleType;
import com.pricewatch.pipeline.model.AlertSeverity;
import com.pricewatch.pipeline.model.Snapshot;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class StockTransitionRuleTest {

    @Test
    void outOfStockMatchesOnlyTheTransition() {
        StockTransitionRule rule = new StockTransitionRule("oos", AlertRuleType.OUT_OF_STOCK, AlertSeverity.WARNING);

        assertThat(rule.evaluate(snapshot(true), snapshot(false))).isPresent();
        assertThat(rule.evaluate(snapshot(false), snapshot(false))).isEmpty();
        assertThat(rule.evaluate(snapshot(false), snapshot(true))).isEmpty();
        assertThat(rule.evaluate(null, snapshot(false))).isEmpty();
        assertThat(rule.evaluate(snapshot(null), snapshot(false))).isEmpty();
    }

    @Test
    void backInStockCarriesPricesAndNoDelta() {
        StockTransitionRule rule = new StockTransitionRule("back", AlertRuleType.BACK_IN_STOCK, AlertSeverity.INFO);

        assertThat(rule.evaluate(snapshot(false), snapshot(true)))
            .hasValueSatisfying(match -> {
                assertThat(match.ruleType()).isEqualTo(AlertRuleType.BACK_IN_STOCK);
                assertThat(match.deltaPercent()).isNull();
                assertThat(match.currentPrice()).isEqualByComparingTo("9.99");
                assertThat(match.severity()).isEqualTo(AlertSeverity.INFO);
            });
    }

    private Snapshot snapshot(Boolean inStock) {
        Instant at = Instant.parse("2026-02-01T10:00:00Z");
        return new Snapshot(1L, "t", null, null, "e", new BigDecimal("9.99"), "USD", inStock, at, null, at);
    }
}
