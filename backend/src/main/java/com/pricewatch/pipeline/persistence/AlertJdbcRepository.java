package com.pricewatch.pipeline.persistence;

import com.pricewatch.pipeline.model.Alert;
import com.pricewatch.pipeline.model.AlertDeliveryStatus;
import com.pricewatch.pipeline.model.AlertMatch;
import com.pricewatch.pipeline.model.AlertRuleDefinition;
import com.pricewatch.pipeline.model.AlertRuleType;
import com.pricewatch.pipeline.model.AlertSeverity;
import com.pricewatch.pipeline.model.Snapshot;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

import static com.pricewatch.pipeline.persistence.SqlValues.toInstant;

@Repository
public class AlertJdbcRepository {
    private static final String ALERT_COLUMNS = """
        id,
        event_id,
        tenant_id,
        snapshot_id,
        entity_ref,
        rule_id,
        rule_type,
        previous_price,
        current_price,
        delta_percent,
        severity,
        detected_at,
        delivery_status
        """;

    private static final RowMapper<Alert> ALERT_MAPPER = (rs, rowNum) -> new Alert(
        rs.getLong("id"),
        rs.getString("event_id"),
        rs.getString("tenant_id"),
        rs.getLong("snapshot_id"),
        rs.getString("entity_ref"),
        rs.getString("rule_id"),
        AlertRuleType.valueOf(rs.getString("rule_type")),
        rs.getBigDecimal("previous_price"),
        rs.getBigDecimal("current_price"),
        rs.getBigDecimal("delta_percent"),
        AlertSeverity.valueOf(rs.getString("severity")),
        toInstant(rs.getTimestamp("detected_at")),
        AlertDeliveryStatus.fromDbValue(rs.getString("delivery_status"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public AlertJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<AlertRuleDefinition> findRuleDefinitions(String tenantId) {
        return jdbc.query(
            """
                SELECT tenant_id, rule_id, rule_type, threshold_percent, severity, enabled
                FROM alert_rules
                WHERE tenant_id = :tenantId
                ORDER BY rule_id
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId),
            (rs, rowNum) -> new AlertRuleDefinition(
                rs.getString("tenant_id"),
                rs.getString("rule_id"),
                AlertRuleType.valueOf(rs.getString("rule_type")),
                rs.getBigDecimal("threshold_percent"),
                AlertSeverity.valueOf(rs.getString("severity")),
                rs.getBoolean("enabled")
            )
        );
    }

    public void insertRuleDefinition(AlertRuleDefinition definition) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", definition.tenantId())
            .addValue("ruleId", definition.ruleId())
            .addValue("ruleType", definition.ruleType().name())
            .addValue("thresholdPercent", definition.thresholdPercent(), Types.NUMERIC)
            .addValue("severity", definition.severity().name())
            .addValue("enabled", definition.enabled())
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                INSERT INTO alert_rules (tenant_id, rule_id, rule_type, threshold_percent, severity, enabled, created_at)
                VALUES (:tenantId, :ruleId, :ruleType, :thresholdPercent, :severity, :enabled, :now)
                """,
            params
        );
    }

    /**
     * Takes over an expired suppression row for (tenant, entity, rule). The row is only reusable once its
     * window has passed and the alert it guards is no longer waiting for delivery.
     *
     * @return true when the existing row was claimed for a new alert
     */
    public boolean claimExpiredSuppression(
        String tenantId,
        String entityRef,
        String ruleId,
        Instant now,
        Instant suppressedUntil
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("entityRef", entityRef)
            .addValue("ruleId", ruleId)
            .addValue("now", Timestamp.from(now))
            .addValue("suppressedUntil", Timestamp.from(suppressedUntil))
            .addValue("pending", AlertDeliveryStatus.PENDING.dbValue());
        int updated = jdbc.update(
            """
                UPDATE alert_suppressions
                SET suppressed_until = :suppressedUntil,
                    alert_id = NULL,
                    updated_at = :now
                WHERE tenant_id = :tenantId
                  AND entity_ref = :entityRef
                  AND rule_id = :ruleId
                  AND suppressed_until <= :now
                  AND NOT EXISTS (
                      SELECT 1
                      FROM alerts a
                      WHERE a.id = alert_suppressions.alert_id
                        AND a.delivery_status = :pending
                  )
                """,
            params
        );
        return updated == 1;
    }

    public boolean suppressionExists(String tenantId, String entityRef, String ruleId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("entityRef", entityRef)
            .addValue("ruleId", ruleId);
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM alert_suppressions
                WHERE tenant_id = :tenantId
                  AND entity_ref = :entityRef
                  AND rule_id = :ruleId
                """,
            params,
            Long.class
        );
        return count != null && count > 0;
    }

    /**
     * Inserts the first suppression row for (tenant, entity, rule). A concurrent evaluator inserting the same
     * key fails on the primary key.
     */
    public void insertSuppression(String tenantId, String entityRef, String ruleId, Instant now, Instant suppressedUntil) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("entityRef", entityRef)
            .addValue("ruleId", ruleId)
            .addValue("now", Timestamp.from(now))
            .addValue("suppressedUntil", Timestamp.from(suppressedUntil));
        jdbc.update(
            """
                INSERT INTO alert_suppressions (tenant_id, entity_ref, rule_id, suppressed_until, updated_at)
                VALUES (:tenantId, :entityRef, :ruleId, :suppressedUntil, :now)
                """,
            params
        );
    }

    public void attachAlertToSuppression(String tenantId, String entityRef, String ruleId, long alertId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("entityRef", entityRef)
            .addValue("ruleId", ruleId)
            .addValue("alertId", alertId);
        jdbc.update(
            """
                UPDATE alert_suppressions
                SET alert_id = :alertId
                WHERE tenant_id = :tenantId
                  AND entity_ref = :entityRef
                  AND rule_id = :ruleId
                """,
            params
        );
    }

    public Alert insertAlert(String eventId, Snapshot snapshot, AlertMatch match, Instant detectedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("tenantId", snapshot.tenantId())
            .addValue("snapshotId", snapshot.id())
            .addValue("entityRef", snapshot.entityRef())
            .addValue("ruleId", match.ruleId())
            .addValue("ruleType", match.ruleType().name())
            .addValue("previousPrice", match.previousPrice(), Types.NUMERIC)
            .addValue("currentPrice", match.currentPrice(), Types.NUMERIC)
            .addValue("deltaPercent", match.deltaPercent(), Types.NUMERIC)
            .addValue("severity", match.severity().name())
            .addValue("detectedAt", Timestamp.from(detectedAt))
            .addValue("deliveryStatus", AlertDeliveryStatus.PENDING.dbValue());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO alerts (
                    event_id,
                    tenant_id,
                    snapshot_id,
                    entity_ref,
                    rule_id,
                    rule_type,
                    previous_price,
                    current_price,
                    delta_percent,
                    severity,
                    detected_at,
                    delivery_status
                )
                VALUES (
                    :eventId,
                    :tenantId,
                    :snapshotId,
                    :entityRef,
                    :ruleId,
                    :ruleType,
                    :previousPrice,
                    :currentPrice,
                    :deltaPercent,
                    :severity,
                    :detectedAt,
                    :deliveryStatus
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert alert for snapshot " + snapshot.id());
        }
        return new Alert(
            key.longValue(),
            eventId,
            snapshot.tenantId(),
            snapshot.id(),
            snapshot.entityRef(),
            match.ruleId(),
            match.ruleType(),
            match.previousPrice(),
            match.currentPrice(),
            match.deltaPercent(),
            match.severity(),
            detectedAt,
            AlertDeliveryStatus.PENDING
        );
    }

    public void updateDeliveryStatus(long alertId, AlertDeliveryStatus status) {
        jdbc.update(
            "UPDATE alerts SET delivery_status = :status WHERE id = :alertId",
            new MapSqlParameterSource()
                .addValue("alertId", alertId)
                .addValue("status", status.dbValue())
        );
    }

    public Alert findAlert(long alertId) {
        List<Alert> rows = jdbc.query(
            "SELECT " + ALERT_COLUMNS + " FROM alerts WHERE id = :alertId",
            new MapSqlParameterSource().addValue("alertId", alertId),
            ALERT_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<Alert> findAlertsForEntity(String tenantId, String entityRef) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("entityRef", entityRef);
        return jdbc.query(
            "SELECT " + ALERT_COLUMNS + """
                FROM alerts
                WHERE tenant_id = :tenantId
                  AND entity_ref = :entityRef
                ORDER BY detected_at ASC, id ASC
                """,
            params,
            ALERT_MAPPER
        );
    }

    /**
     * Alerts past the cutoff whose delivery has settled. Pending and dead-lettered alerts stay live until an
     * operator deals with them.
     */
    public List<Alert> findSettledOlderThan(String tenantId, Instant cutoff, int limit) {
        MapSqlParameterSource params = settledParams(tenantId, cutoff).addValue("limit", Math.max(1, limit));
        return jdbc.query(
            "SELECT " + ALERT_COLUMNS + """
                FROM alerts
                WHERE tenant_id = :tenantId
                  AND detected_at < :cutoff
                  AND delivery_status IN (:settled)
                ORDER BY detected_at ASC, id ASC
                LIMIT :limit
                """,
            params,
            ALERT_MAPPER
        );
    }

    public int deleteSettledOlderThan(String tenantId, Instant cutoff) {
        MapSqlParameterSource params = settledParams(tenantId, cutoff);
        jdbc.update(
            """
                DELETE FROM webhook_deliveries
                WHERE alert_id IN (
                    SELECT id
                    FROM alerts
                    WHERE tenant_id = :tenantId
                      AND detected_at < :cutoff
                      AND delivery_status IN (:settled)
                )
                """,
            params
        );
        return jdbc.update(
            """
                DELETE FROM alerts
                WHERE tenant_id = :tenantId
                  AND detected_at < :cutoff
                  AND delivery_status IN (:settled)
                """,
            params
        );
    }

    public int deleteByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("ids", ids);
        jdbc.update("DELETE FROM webhook_deliveries WHERE alert_id IN (:ids)", params);
        return jdbc.update("DELETE FROM alerts WHERE id IN (:ids)", params);
    }

    private MapSqlParameterSource settledParams(String tenantId, Instant cutoff) {
        return new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("cutoff", Timestamp.from(cutoff))
            .addValue("settled", List.of(
                AlertDeliveryStatus.DELIVERED.dbValue(),
                AlertDeliveryStatus.NO_SUBSCRIBERS.dbValue()
            ));
    }
}
