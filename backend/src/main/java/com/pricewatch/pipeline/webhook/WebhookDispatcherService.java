package com.pricewatch.pipeline.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricewatch.config.PipelineProperties;
import com.pricewatch.pipeline.model.Alert;
import com.pricewatch.pipeline.model.AlertDeliveryStatus;
import com.pricewatch.pipeline.model.DeliveryAttemptResult;
import com.pricewatch.pipeline.model.DeliveryQueueStats;
import com.pricewatch.pipeline.model.DeliveryStatus;
import com.pricewatch.pipeline.model.WebhookDelivery;
import com.pricewatch.pipeline.model.WebhookEvent;
import com.pricewatch.pipeline.model.WebhookSubscription;
import com.pricewatch.pipeline.persistence.AlertJdbcRepository;
import com.pricewatch.pipeline.persistence.WebhookJdbcRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fans alerts out to matching subscriptions and drives each delivery through
 * {@code pending -> delivering -> delivered}, or through {@code retrying} back to {@code delivering} until the
 * backoff policy gives up and parks it as {@code dead_lettered}.
 */
@Service
public class WebhookDispatcherService {
    private static final Logger log = LoggerFactory.getLogger(WebhookDispatcherService.class);
    public static final String EVENT_ID_HEADER = "X-PriceWatch-Event-Id";
    public static final String EVENT_TYPE_HEADER = "X-PriceWatch-Event-Type";
    public static final String ATTEMPT_HEADER = "X-PriceWatch-Delivery-Attempt";

    private final WebhookJdbcRepository webhookRepository;
    private final AlertJdbcRepository alertRepository;
    private final WebhookSigner signer;
    private final WebhookTransport transport;
    private final ObjectMapper objectMapper;
    private final PipelineProperties.Webhooks properties;
    private final BackoffPolicy backoffPolicy;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final String instanceId;

    private ExecutorService executor;

    public WebhookDispatcherService(
        WebhookJdbcRepository webhookRepository,
        AlertJdbcRepository alertRepository,
        WebhookSigner signer,
        WebhookTransport transport,
        ObjectMapper objectMapper,
        PipelineProperties properties
    ) {
        this.webhookRepository = webhookRepository;
        this.alertRepository = alertRepository;
        this.signer = signer;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.properties = properties.getWebhooks();
        this.backoffPolicy = BackoffPolicy.from(this.properties);
        this.instanceId = "dispatcher-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public BackoffPolicy backoffPolicy() {
        return backoffPolicy;
    }

    /**
     * Creates one pending delivery per active subscription of the alert's tenant that accepts its event type.
     * The serialized event is stored with each delivery so every attempt posts identical bytes.
     *
     * @return number of deliveries created
     */
    public int enqueue(Alert alert) {
        String eventType = alert.ruleType().eventType();
        List<WebhookSubscription> subscriptions = webhookRepository.findActiveSubscriptions(alert.tenantId()).stream()
            .filter(subscription -> subscription.accepts(eventType))
            .toList();
        if (subscriptions.isEmpty()) {
            alertRepository.updateDeliveryStatus(alert.id(), AlertDeliveryStatus.NO_SUBSCRIBERS);
            log.debug("Alert {} has no subscribers for {}", alert.eventId(), eventType);
            return 0;
        }
        String payload = serialize(toEvent(alert));
        Instant now = Instant.now();
        int created = 0;
        for (WebhookSubscription subscription : subscriptions) {
            if (webhookRepository.insertDelivery(
                alert.eventId(),
                alert.id(),
                subscription.id(),
                alert.tenantId(),
                eventType,
                payload,
                now
            )) {
                created++;
            }
        }
        log.info("Queued {} webhook deliveries for alert {} ({})", created, alert.eventId(), eventType);
        return created;
    }

    /**
     * Attempts every delivery due at {@code dueAt}, up to the configured batch size. Each attempt re-stamps its
     * own lock and clock, and a delivery whose lock was lost to another dispatcher mid-batch is skipped.
     *
     * @return number of deliveries attempted
     */
    public int deliverDue(Instant dueAt) {
        List<WebhookDelivery> claimed = webhookRepository.claimDue(
            dueAt,
            instanceId,
            properties.getLockTtlSeconds(),
            properties.getBatchSize()
        );
        int attempted = 0;
        for (WebhookDelivery delivery : claimed) {
            Instant lockedUntil = Instant.now().plusSeconds(properties.getLockTtlSeconds());
            if (!webhookRepository.refreshLock(delivery.id(), instanceId, lockedUntil)) {
                log.info("Delivery {} of event {} was taken over by another dispatcher", delivery.id(), delivery.eventId());
                continue;
            }
            attempted++;
            try {
                attempt(delivery);
            } catch (Exception e) {
                log.warn("Delivery {} of event {} failed unexpectedly", delivery.id(), delivery.eventId(), e);
                recordFailure(delivery, null, "dispatcher_exception=" + e.getClass().getSimpleName(), Instant.now());
            }
        }
        return attempted;
    }

    public List<WebhookDelivery> findDeadLetters(String tenantId, int limit) {
        return webhookRepository.findDeadLettered(tenantId, limit);
    }

    public DeliveryQueueStats getQueueStats() {
        return webhookRepository.fetchQueueStats(Instant.now());
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            executor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("webhook-dispatcher");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            executor.submit(this::dispatchLoop);
            log.info("Webhook dispatcher started, polling every {} ms", properties.getPollIntervalMs());
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            log.info("Webhook dispatcher stopped");
        }
    }

    private void dispatchLoop() {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            int attempted = 0;
            try {
                attempted = deliverDue(Instant.now());
            } catch (Exception e) {
                log.warn("Webhook dispatch pass failed", e);
            }
            if (attempted == 0) {
                sleep(properties.getPollIntervalMs());
            }
        }
    }

    private void attempt(WebhookDelivery delivery) {
        Optional<WebhookSubscription> subscription = webhookRepository.findSubscription(delivery.subscriptionId());
        if (subscription.isEmpty() || !subscription.get().active()) {
            webhookRepository.markDeadLettered(delivery.id(), instanceId, null, "subscription_inactive", Instant.now());
            rollUp(delivery.alertId());
            return;
        }
        byte[] body = delivery.payload().getBytes(StandardCharsets.UTF_8);
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(signer.headerName(), signer.sign(subscription.get().secret(), body));
        headers.put(EVENT_ID_HEADER, delivery.eventId());
        headers.put(EVENT_TYPE_HEADER, delivery.eventType());
        headers.put(ATTEMPT_HEADER, Integer.toString(delivery.attempts() + 1));

        DeliveryAttemptResult result = transport.post(subscription.get().targetUrl(), body, headers);
        Instant now = Instant.now();
        if (result.isSuccessful()) {
            webhookRepository.markDelivered(delivery.id(), instanceId, result.statusCode(), now);
            log.debug("Delivered event {} to subscription {}", delivery.eventId(), delivery.subscriptionId());
            rollUp(delivery.alertId());
            return;
        }
        recordFailure(delivery, result.statusCode() == 0 ? null : result.statusCode(), result.describeFailure(), now);
    }

    private void recordFailure(WebhookDelivery delivery, Integer responseCode, String error, Instant now) {
        int attemptsMade = delivery.attempts() + 1;
        if (backoffPolicy.isExhausted(attemptsMade)) {
            webhookRepository.markDeadLettered(delivery.id(), instanceId, responseCode, error, now);
            log.warn(
                "Dead-lettered event {} for subscription {} after {} attempts: {}",
                delivery.eventId(),
                delivery.subscriptionId(),
                attemptsMade,
                error
            );
        } else {
            Instant nextAttemptAt = now.plus(backoffPolicy.delayBeforeRetry(attemptsMade));
            webhookRepository.markRetrying(delivery.id(), instanceId, responseCode, error, now, nextAttemptAt);
            log.info(
                "Delivery {} of event {} failed (attempt {}): {}; retrying at {}",
                delivery.id(),
                delivery.eventId(),
                attemptsMade,
                error,
                nextAttemptAt
            );
        }
        rollUp(delivery.alertId());
    }

    private void rollUp(long alertId) {
        List<DeliveryStatus> statuses = webhookRepository.findStatusesForAlert(alertId);
        if (statuses.isEmpty()) {
            return;
        }
        AlertDeliveryStatus rolled;
        if (statuses.stream().anyMatch(status -> status != DeliveryStatus.DELIVERED && status != DeliveryStatus.DEAD_LETTERED)) {
            rolled = AlertDeliveryStatus.PENDING;
        } else if (statuses.contains(DeliveryStatus.DEAD_LETTERED)) {
            rolled = AlertDeliveryStatus.DEAD_LETTERED;
        } else {
            rolled = AlertDeliveryStatus.DELIVERED;
        }
        alertRepository.updateDeliveryStatus(alertId, rolled);
    }

    WebhookEvent toEvent(Alert alert) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("alert_id", alert.id());
        body.put("snapshot_id", alert.snapshotId());
        body.put("entity_ref", alert.entityRef());
        body.put("rule_id", alert.ruleId());
        body.put("rule_type", alert.ruleType().name());
        body.put("severity", alert.severity().name());
        body.put("previous_price", alert.previousPrice());
        body.put("current_price", alert.currentPrice());
        body.put("delta_percent", alert.deltaPercent());
        return new WebhookEvent(alert.eventId(), alert.ruleType().eventType(), alert.tenantId(), alert.detectedAt(), body);
    }

    private String serialize(WebhookEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize webhook event " + event.eventId(), e);
        }
    }

    private void sleep(int pollIntervalMs) {
        try {
            TimeUnit.MILLISECONDS.sleep(Math.max(100, pollIntervalMs));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
