package com.pricewatch.pipeline.alert;

import com.pricewatch.config.PipelineProperties;
import com.pricewatch.pipeline.model.Alert;
import com.pricewatch.pipeline.model.AlertMatch;
import com.pricewatch.pipeline.model.Snapshot;
import com.pricewatch.pipeline.persistence.AlertJdbcRepository;
import com.pricewatch.pipeline.persistence.SnapshotJdbcRepository;
import com.pricewatch.pipeline.webhook.WebhookDispatcherService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Checks new snapshots against the tenant's rules and raises at most one alert per (entity, rule) per
 * suppression window.
 */
@Service
public class AlertEvaluatorService {
    private static final Logger log = LoggerFactory.getLogger(AlertEvaluatorService.class);

    private final SnapshotJdbcRepository snapshotRepository;
    private final AlertJdbcRepository alertRepository;
    private final AlertRuleProvider ruleProvider;
    private final WebhookDispatcherService dispatcher;
    private final TransactionTemplate transactionTemplate;
    private final PipelineProperties.Alerts properties;

    public AlertEvaluatorService(
        SnapshotJdbcRepository snapshotRepository,
        AlertJdbcRepository alertRepository,
        AlertRuleProvider ruleProvider,
        WebhookDispatcherService dispatcher,
        TransactionTemplate transactionTemplate,
        PipelineProperties properties
    ) {
        this.snapshotRepository = snapshotRepository;
        this.alertRepository = alertRepository;
        this.ruleProvider = ruleProvider;
        this.dispatcher = dispatcher;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties.getAlerts();
    }

    public List<Alert> evaluate(List<Snapshot> snapshots) {
        Map<String, List<AlertRule>> rulesByTenant = new HashMap<>();
        List<Alert> raised = new ArrayList<>();
        for (Snapshot snapshot : snapshots) {
            List<AlertRule> rules = rulesByTenant.computeIfAbsent(snapshot.tenantId(), ruleProvider::rulesFor);
            try {
                raised.addAll(evaluate(snapshot, rules, Instant.now()));
            } catch (Exception e) {
                log.warn("Alert evaluation failed for snapshot {} of {}", snapshot.id(), snapshot.entityRef(), e);
            }
        }
        return raised;
    }

    List<Alert> evaluate(Snapshot snapshot, List<AlertRule> rules, Instant now) {
        if (rules.isEmpty()) {
            return List.of();
        }
        Snapshot previous = snapshotRepository
            .findPrevious(snapshot.tenantId(), snapshot.entityRef(), snapshot.observedAt())
            .orElse(null);
        List<Alert> raised = new ArrayList<>();
        for (AlertRule rule : rules) {
            Optional<AlertMatch> match = rule.evaluate(previous, snapshot);
            if (match.isEmpty()) {
                continue;
            }
            Optional<Alert> alert = raise(snapshot, match.get(), now);
            if (alert.isEmpty()) {
                log.debug("Suppressed {} for {}: window still open", rule.ruleId(), snapshot.entityRef());
                continue;
            }
            raised.add(alert.get());
            log.info(
                "Raised alert {} rule={} entity={} delta={}%",
                alert.get().eventId(),
                rule.ruleId(),
                snapshot.entityRef(),
                match.get().deltaPercent()
            );
            try {
                dispatcher.enqueue(alert.get());
            } catch (Exception e) {
                log.warn("Failed to enqueue deliveries for alert {}", alert.get().eventId(), e);
            }
        }
        return raised;
    }

    /**
     * Claims the suppression slot and inserts the alert in one transaction. Two evaluators racing on the same
     * (entity, rule) cannot both claim: the first insert wins the primary key, and an expired slot is taken over
     * by a conditional update that only one of them can satisfy.
     */
    Optional<Alert> raise(Snapshot snapshot, AlertMatch match, Instant now) {
        Instant suppressedUntil = now.plus(Duration.ofMinutes(properties.getSuppressionWindowMinutes()));
        try {
            Alert alert = transactionTemplate.execute(status -> {
                boolean claimed;
                if (alertRepository.suppressionExists(snapshot.tenantId(), snapshot.entityRef(), match.ruleId())) {
                    claimed = alertRepository.claimExpiredSuppression(
                        snapshot.tenantId(),
                        snapshot.entityRef(),
                        match.ruleId(),
                        now,
                        suppressedUntil
                    );
                } else {
                    alertRepository.insertSuppression(
                        snapshot.tenantId(),
                        snapshot.entityRef(),
                        match.ruleId(),
                        now,
                        suppressedUntil
                    );
                    claimed = true;
                }
                if (!claimed) {
                    return null;
                }
                Alert inserted = alertRepository.insertAlert(UUID.randomUUID().toString(), snapshot, match, now);
                alertRepository.attachAlertToSuppression(snapshot.tenantId(), snapshot.entityRef(), match.ruleId(), inserted.id());
                return inserted;
            });
            return Optional.ofNullable(alert);
        } catch (DuplicateKeyException e) {
            // Another evaluator created the suppression row first.
            return Optional.empty();
        }
    }
}
