package com.pricewatch.pipeline.alert;

import com.pricewatch.pipeline.model.Alert;
import com.pricewatch.pipeline.model.AlertDeliveryStatus;
import com.pricewatch.pipeline.model.AlertRuleDefinition;
import com.pricewatch.pipeline.model.AlertRuleType;
import com.pricewatch.pipeline.model.AlertSeverity;
import com.pricewatch.pipeline.model.Snapshot;
import com.pricewatch.pipeline.persistence.AlertJdbcRepository;
import com.pricewatch.pipeline.persistence.SnapshotJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class AlertEvaluatorServiceTest {
    private static final Instant T0 = Instant.parse("2026-06-01T09:00:00Z");

    @Autowired
    private AlertEvaluatorService evaluator;

    @Autowired
    private AlertRuleProvider ruleProvider;

    @Autowired
    private SnapshotJdbcRepository snapshotRepository;

    @Autowired
    private AlertJdbcRepository alertRepository;

    @Test
    void priceDropRaisesOneAlertAndSuppressesRepeats() {
        String tenant = uniqueTenant();
        String entity = tenant + "-widget";
        snapshot(tenant, entity, "100.00", true, T0);
        Snapshot dropped = snapshot(tenant, entity, "80.00", true, T0.plusSeconds(60));
        Snapshot droppedAgain = snapshot(tenant, entity, "70.00", true, T0.plusSeconds(120));

        List<Alert> first = evaluator.evaluate(List.of(dropped));
        List<Alert> second = evaluator.evaluate(List.of(droppedAgain));

        assertThat(first).hasSize(1);
        Alert alert = first.get(0);
        assertThat(alert.ruleId()).isEqualTo("default-price-drop");
        assertThat(alert.ruleType()).isEqualTo(AlertRuleType.PRICE_DROP_PERCENT);
        assertThat(alert.previousPrice()).isEqualByComparingTo("100.00");
        assertThat(alert.currentPrice()).isEqualByComparingTo("80.00");
        assertThat(alert.deltaPercent()).isEqualByComparingTo("-20");
        assertThat(alert.severity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(alert.eventId()).isNotBlank();
        assertThat(second).isEmpty();
        assertThat(alertRepository.findAlertsForEntity(tenant, entity)).hasSize(1);
    }

    @Test
    void alertWithoutSubscribersIsSettledImmediately() {
        String tenant = uniqueTenant();
        String entity = tenant + "-lamp";
        snapshot(tenant, entity, "50.00", true, T0);
        Snapshot dropped = snapshot(tenant, entity, "40.00", true, T0.plusSeconds(60));

        Alert alert = evaluator.evaluate(List.of(dropped)).get(0);

        assertThat(alertRepository.findAlert(alert.id()).deliveryStatus()).isEqualTo(AlertDeliveryStatus.NO_SUBSCRIBERS);
    }

    @Test
    void suppressionWindowExpiryAllowsANewAlert() {
        String tenant = uniqueTenant();
        String entity = tenant + "-chair";
        snapshot(tenant, entity, "100.00", true, T0);
        Snapshot dropped = snapshot(tenant, entity, "85.00", true, T0.plusSeconds(60));
        Snapshot droppedAgain = snapshot(tenant, entity, "70.00", true, T0.plusSeconds(120));
        List<AlertRule> rules = ruleProvider.rulesFor(tenant);
        Instant now = Instant.now();

        assertThat(evaluator.evaluate(dropped, rules, now)).hasSize(1);
        assertThat(evaluator.evaluate(droppedAgain, rules, now.plus(Duration.ofMinutes(30)))).isEmpty();
        assertThat(evaluator.evaluate(droppedAgain, rules, now.plus(Duration.ofHours(7)))).hasSize(1);
        assertThat(alertRepository.findAlertsForEntity(tenant, entity)).hasSize(2);
    }

    @Test
    void firstObservationAndSmallMovesRaiseNothing() {
        String tenant = uniqueTenant();
        String entity = tenant + "-desk";
        Snapshot first = snapshot(tenant, entity, "200.00", true, T0);
        Snapshot small = snapshot(tenant, entity, "195.00", true, T0.plusSeconds(60));

        assertThat(evaluator.evaluate(List.of(first, small))).isEmpty();
    }

    @Test
    void anotherTenantsHistoryIsNotAPreviousObservation() {
        String tenantA = uniqueTenant();
        String tenantB = uniqueTenant();
        String entity = "shared-" + UUID.randomUUID().toString().substring(0, 8);
        snapshot(tenantA, entity, "100.00", true, T0);
        Snapshot firstForB = snapshot(tenantB, entity, "50.00", true, T0.plusSeconds(60));

        assertThat(evaluator.evaluate(List.of(firstForB))).isEmpty();
        assertThat(alertRepository.findAlertsForEntity(tenantB, entity)).isEmpty();
    }

    @Test
    void stockAndPriceRulesFireIndependently() {
        String tenant = uniqueTenant();
        String entity = tenant + "-kettle";
        snapshot(tenant, entity, "30.00", true, T0);
        Snapshot soldOutAndCheaper = snapshot(tenant, entity, "20.00", false, T0.plusSeconds(60));

        List<Alert> alerts = evaluator.evaluate(List.of(soldOutAndCheaper));

        assertThat(alerts).extracting(Alert::ruleType)
            .containsExactlyInAnyOrder(AlertRuleType.PRICE_DROP_PERCENT, AlertRuleType.OUT_OF_STOCK);
    }

    @Test
    void tenantRulesReplaceDefaults() {
        String tenant = uniqueTenant();
        String entity = tenant + "-lamp";
        alertRepository.insertRuleDefinition(new AlertRuleDefinition(
            tenant,
            "steep-increase",
            AlertRuleType.PRICE_INCREASE_PERCENT,
            new BigDecimal("50"),
            AlertSeverity.INFO,
            true
        ));
        snapshot(tenant, entity, "100.00", true, T0);
        Snapshot dropped = snapshot(tenant, entity, "10.00", true, T0.plusSeconds(60));
        Snapshot doubled = snapshot(tenant, entity, "30.00", true, T0.plusSeconds(120));

        assertThat(evaluator.evaluate(List.of(dropped))).isEmpty();
        assertThat(evaluator.evaluate(List.of(doubled)))
            .singleElement()
            .satisfies(alert -> assertThat(alert.ruleId()).isEqualTo("steep-increase"));
    }

    private Snapshot snapshot(String tenant, String entity, String price, boolean inStock, Instant observedAt) {
        return snapshotRepository.insertIfAbsent(
            tenant,
            null,
            null,
            entity,
            new BigDecimal(price),
            "USD",
            inStock,
            observedAt,
            null
        ).orElseThrow();
    }

    private static String uniqueTenant() {
        return "alert-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
