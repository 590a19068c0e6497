package com.pricewatch.pipeline.persistence;

import com.pricewatch.pipeline.model.DeliveryQueueStats;
import com.pricewatch.pipeline.model.DeliveryStatus;
import com.pricewatch.pipeline.model.WebhookDelivery;
import com.pricewatch.pipeline.model.WebhookSubscription;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.pricewatch.pipeline.persistence.SqlValues.nullableInt;
import static com.pricewatch.pipeline.persistence.SqlValues.toInstant;
import static com.pricewatch.pipeline.persistence.SqlValues.truncate;

@Repository
public class WebhookJdbcRepository {
    private static final int MAX_ERROR_LENGTH = 1000;

    private static final String DELIVERY_COLUMNS = """
        id,
        event_id,
        alert_id,
        subscription_id,
        tenant_id,
        event_type,
        payload,
        status,
        attempts,
        next_attempt_at,
        last_attempt_at,
        last_response_code,
        last_error,
        delivered_at,
        dead_lettered_at,
        created_at
        """;

    private static final RowMapper<WebhookDelivery> DELIVERY_MAPPER = (rs, rowNum) -> new WebhookDelivery(
        rs.getLong("id"),
        rs.getString("event_id"),
        rs.getLong("alert_id"),
        rs.getLong("subscription_id"),
        rs.getString("tenant_id"),
        rs.getString("event_type"),
        rs.getString("payload"),
        DeliveryStatus.fromDbValue(rs.getString("status")),
        rs.getInt("attempts"),
        toInstant(rs.getTimestamp("next_attempt_at")),
        toInstant(rs.getTimestamp("last_attempt_at")),
        nullableInt(rs, "last_response_code"),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("delivered_at")),
        toInstant(rs.getTimestamp("dead_lettered_at")),
        toInstant(rs.getTimestamp("created_at"))
    );

    private static final RowMapper<WebhookSubscription> SUBSCRIPTION_MAPPER = (rs, rowNum) -> new WebhookSubscription(
        rs.getLong("id"),
        rs.getString("tenant_id"),
        rs.getString("target_url"),
        parseEventTypes(rs.getString("event_types")),
        rs.getString("secret"),
        rs.getBoolean("active")
    );

    private final NamedParameterJdbcTemplate jdbc;

    public WebhookJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertSubscription(String tenantId, String targetUrl, Set<String> eventTypes, String secret) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("targetUrl", targetUrl)
            .addValue("eventTypes", String.join(",", eventTypes))
            .addValue("secret", secret)
            .addValue("now", Timestamp.from(Instant.now()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO webhook_subscriptions (tenant_id, target_url, event_types, secret, active, created_at)
                VALUES (:tenantId, :targetUrl, :eventTypes, :secret, TRUE, :now)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert webhook subscription for tenant " + tenantId);
        }
        return key.longValue();
    }

    public List<WebhookSubscription> findActiveSubscriptions(String tenantId) {
        return jdbc.query(
            """
                SELECT id, tenant_id, target_url, event_types, secret, active
                FROM webhook_subscriptions
                WHERE tenant_id = :tenantId
                  AND active = TRUE
                ORDER BY id
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId),
            SUBSCRIPTION_MAPPER
        );
    }

    public Optional<WebhookSubscription> findSubscription(long subscriptionId) {
        List<WebhookSubscription> rows = jdbc.query(
            """
                SELECT id, tenant_id, target_url, event_types, secret, active
                FROM webhook_subscriptions
                WHERE id = :subscriptionId
                """,
            new MapSqlParameterSource().addValue("subscriptionId", subscriptionId),
            SUBSCRIPTION_MAPPER
        );
        return rows.stream().findFirst();
    }

    /**
     * Creates the delivery of one alert to one subscription. A second enqueue of the same pair is ignored.
     *
     * @return true when a new delivery row was written
     */
    public boolean insertDelivery(
        String eventId,
        long alertId,
        long subscriptionId,
        String tenantId,
        String eventType,
        String payload,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("alertId", alertId)
            .addValue("subscriptionId", subscriptionId)
            .addValue("tenantId", tenantId)
            .addValue("eventType", eventType)
            .addValue("payload", payload)
            .addValue("status", DeliveryStatus.PENDING.dbValue())
            .addValue("now", Timestamp.from(now));
        try {
            jdbc.update(
                """
                    INSERT INTO webhook_deliveries (
                        event_id,
                        alert_id,
                        subscription_id,
                        tenant_id,
                        event_type,
                        payload,
                        status,
                        attempts,
                        next_attempt_at,
                        created_at
                    )
                    VALUES (
                        :eventId,
                        :alertId,
                        :subscriptionId,
                        :tenantId,
                        :eventType,
                        :payload,
                        :status,
                        0,
                        :now,
                        :now
                    )
                    """,
                params
            );
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    /**
     * Claims up to {@code limit} deliveries that are due, moving each to {@code delivering}. A delivery left in
     * {@code delivering} by a dispatcher that died is claimable again once its lock has expired. Each row is
     * taken with its own conditional update, so a row is handed to at most one caller.
     */
    public List<WebhookDelivery> claimDue(Instant now, String owner, long lockTtlSeconds, int limit) {
        String safeOwner = (owner == null || owner.isBlank()) ? "unknown" : owner.trim();
        MapSqlParameterSource params = claimParams(now)
            .addValue("limit", Math.max(1, limit));
        List<Long> candidates = jdbc.query(
            """
                SELECT id
                FROM webhook_deliveries
                WHERE (status IN (:claimable) AND next_attempt_at <= :now)
                   OR (status = :delivering AND locked_until < :now)
                ORDER BY next_attempt_at ASC, id ASC
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> rs.getLong("id")
        );
        List<WebhookDelivery> claimed = new ArrayList<>();
        for (Long id : candidates) {
            MapSqlParameterSource claim = claimParams(now)
                .addValue("id", id)
                .addValue("owner", safeOwner)
                .addValue("lockedUntil", Timestamp.from(now.plusSeconds(Math.max(1, lockTtlSeconds))));
            int updated = jdbc.update(
                """
                    UPDATE webhook_deliveries
                    SET status = :delivering,
                        lock_owner = :owner,
                        locked_until = :lockedUntil
                    WHERE id = :id
                      AND ((status IN (:claimable) AND next_attempt_at <= :now)
                           OR (status = :delivering AND locked_until < :now))
                    """,
                claim
            );
            if (updated == 1) {
                findDelivery(id).ifPresent(claimed::add);
            }
        }
        return claimed;
    }

    /**
     * Extends the lock on a delivery this owner is still holding.
     *
     * @return false when the lock expired and another dispatcher has taken the delivery over
     */
    public boolean refreshLock(long deliveryId, String owner, Instant lockedUntil) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", deliveryId)
            .addValue("owner", owner)
            .addValue("delivering", DeliveryStatus.DELIVERING.dbValue())
            .addValue("lockedUntil", Timestamp.from(lockedUntil));
        int updated = jdbc.update(
            """
                UPDATE webhook_deliveries
                SET locked_until = :lockedUntil
                WHERE id = :id
                  AND status = :delivering
                  AND lock_owner = :owner
                """,
            params
        );
        return updated == 1;
    }

    public void markDelivered(long deliveryId, String owner, int responseCode, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", deliveryId)
            .addValue("owner", owner)
            .addValue("status", DeliveryStatus.DELIVERED.dbValue())
            .addValue("responseCode", responseCode)
            .addValue("now", Timestamp.from(now));
        jdbc.update(
            """
                UPDATE webhook_deliveries
                SET status = :status,
                    attempts = attempts + 1,
                    last_attempt_at = :now,
                    last_response_code = :responseCode,
                    last_error = NULL,
                    delivered_at = :now,
                    next_attempt_at = NULL,
                    locked_until = NULL,
                    lock_owner = NULL
                WHERE id = :id
                  AND lock_owner = :owner
                """,
            params
        );
    }

    public void markRetrying(
        long deliveryId,
        String owner,
        Integer responseCode,
        String error,
        Instant now,
        Instant nextAttemptAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", deliveryId)
            .addValue("owner", owner)
            .addValue("status", DeliveryStatus.RETRYING.dbValue())
            .addValue("responseCode", responseCode, Types.INTEGER)
            .addValue("error", truncate(error, MAX_ERROR_LENGTH))
            .addValue("now", Timestamp.from(now))
            .addValue("nextAttemptAt", Timestamp.from(nextAttemptAt));
        jdbc.update(
            """
                UPDATE webhook_deliveries
                SET status = :status,
                    attempts = attempts + 1,
                    last_attempt_at = :now,
                    last_response_code = :responseCode,
                    last_error = :error,
                    next_attempt_at = :nextAttemptAt,
                    locked_until = NULL,
                    lock_owner = NULL
                WHERE id = :id
                  AND lock_owner = :owner
                """,
            params
        );
    }

    public void markDeadLettered(long deliveryId, String owner, Integer responseCode, String error, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", deliveryId)
            .addValue("owner", owner)
            .addValue("status", DeliveryStatus.DEAD_LETTERED.dbValue())
            .addValue("responseCode", responseCode, Types.INTEGER)
            .addValue("error", truncate(error, MAX_ERROR_LENGTH))
            .addValue("now", Timestamp.from(now));
        jdbc.update(
            """
                UPDATE webhook_deliveries
                SET status = :status,
                    attempts = attempts + 1,
                    last_attempt_at = :now,
                    last_response_code = :responseCode,
                    last_error = :error,
                    dead_lettered_at = :now,
                    next_attempt_at = NULL,
                    locked_until = NULL,
                    lock_owner = NULL
                WHERE id = :id
                  AND lock_owner = :owner
                """,
            params
        );
    }

    public Optional<WebhookDelivery> findDelivery(long deliveryId) {
        List<WebhookDelivery> rows = jdbc.query(
            "SELECT " + DELIVERY_COLUMNS + " FROM webhook_deliveries WHERE id = :id",
            new MapSqlParameterSource().addValue("id", deliveryId),
            DELIVERY_MAPPER
        );
        return rows.stream().findFirst();
    }

    public List<WebhookDelivery> findDeliveriesForAlert(long alertId) {
        return jdbc.query(
            "SELECT " + DELIVERY_COLUMNS + " FROM webhook_deliveries WHERE alert_id = :alertId ORDER BY id",
            new MapSqlParameterSource().addValue("alertId", alertId),
            DELIVERY_MAPPER
        );
    }

    public List<DeliveryStatus> findStatusesForAlert(long alertId) {
        return jdbc.query(
            "SELECT status FROM webhook_deliveries WHERE alert_id = :alertId",
            new MapSqlParameterSource().addValue("alertId", alertId),
            (rs, rowNum) -> DeliveryStatus.fromDbValue(rs.getString("status"))
        );
    }

    public List<WebhookDelivery> findDeadLettered(String tenantId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("status", DeliveryStatus.DEAD_LETTERED.dbValue())
            .addValue("tenantId", tenantId)
            .addValue("limit", Math.max(1, Math.min(limit, 500)));
        String tenantFilter = tenantId == null ? "" : " AND tenant_id = :tenantId";
        return jdbc.query(
            "SELECT " + DELIVERY_COLUMNS + " FROM webhook_deliveries WHERE status = :status" + tenantFilter
                + " ORDER BY dead_lettered_at DESC, id DESC LIMIT :limit",
            params,
            DELIVERY_MAPPER
        );
    }

    public DeliveryQueueStats fetchQueueStats(Instant now) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (DeliveryStatus status : DeliveryStatus.values()) {
            counts.put(status.dbValue(), 0L);
        }
        jdbc.query(
            "SELECT status, COUNT(*) AS total FROM webhook_deliveries GROUP BY status",
            new MapSqlParameterSource(),
            rs -> {
                counts.put(rs.getString("status"), rs.getLong("total"));
            }
        );
        Long due = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM webhook_deliveries
                WHERE status IN (:claimable)
                  AND next_attempt_at <= :now
                """,
            claimParams(now),
            Long.class
        );
        return new DeliveryQueueStats(counts, due == null ? 0L : due);
    }

    private MapSqlParameterSource claimParams(Instant now) {
        return new MapSqlParameterSource()
            .addValue("now", Timestamp.from(now))
            .addValue("claimable", List.of(DeliveryStatus.PENDING.dbValue(), DeliveryStatus.RETRYING.dbValue()))
            .addValue("delivering", DeliveryStatus.DELIVERING.dbValue());
    }

    static Set<String> parseEventTypes(String raw) {
        if (raw == null || raw.isBlank()) {
            return Set.of();
        }
        Set<String> types = new LinkedHashSet<>();
        Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .forEach(types::add);
        return types;
    }
}
