package com.pricewatch.pipeline.persistence;

import com.pricewatch.pipeline.model.ArchivalStrategy;
import com.pricewatch.pipeline.model.ArchiveCategory;
import com.pricewatch.pipeline.model.RetentionPolicy;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.pricewatch.pipeline.persistence.SqlValues.toInstant;

@Repository
public class RetentionPolicyRepository {
    private static final RowMapper<RetentionPolicy> POLICY_MAPPER = (rs, rowNum) -> new RetentionPolicy(
        rs.getString("tenant_id"),
        rs.getInt("retention_days_snapshots"),
        rs.getInt("retention_days_alerts"),
        rs.getInt("retention_days_jobs"),
        ArchivalStrategy.fromDbValue(rs.getString("archival_strategy")),
        toInstant(rs.getTimestamp("last_archive_run_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public RetentionPolicyRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<RetentionPolicy> find(String tenantId) {
        List<RetentionPolicy> rows = jdbc.query(
            """
                SELECT tenant_id,
                       retention_days_snapshots,
                       retention_days_alerts,
                       retention_days_jobs,
                       archival_strategy,
                       last_archive_run_at
                FROM retention_policies
                WHERE tenant_id = :tenantId
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId),
            POLICY_MAPPER
        );
        return rows.stream().findFirst();
    }

    public List<String> findTenantIds() {
        return jdbc.queryForList(
            "SELECT tenant_id FROM retention_policies ORDER BY tenant_id",
            new MapSqlParameterSource(),
            String.class
        );
    }

    /**
     * Inserts or replaces the tenant's windows and strategy. {@code last_archive_run_at} survives an update.
     */
    public RetentionPolicy upsert(
        String tenantId,
        int retentionDaysSnapshots,
        int retentionDaysAlerts,
        int retentionDaysJobs,
        ArchivalStrategy strategy
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("snapshots", retentionDaysSnapshots)
            .addValue("alerts", retentionDaysAlerts)
            .addValue("jobs", retentionDaysJobs)
            .addValue("strategy", strategy.dbValue())
            .addValue("now", Timestamp.from(Instant.now()));
        int updated = jdbc.update(
            """
                UPDATE retention_policies
                SET retention_days_snapshots = :snapshots,
                    retention_days_alerts = :alerts,
                    retention_days_jobs = :jobs,
                    archival_strategy = :strategy,
                    updated_at = :now
                WHERE tenant_id = :tenantId
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO retention_policies (
                        tenant_id,
                        retention_days_snapshots,
                        retention_days_alerts,
                        retention_days_jobs,
                        archival_strategy,
                        updated_at
                    )
                    VALUES (:tenantId, :snapshots, :alerts, :jobs, :strategy, :now)
                    """,
                params
            );
        }
        return find(tenantId).orElseThrow(
            () -> new IllegalStateException("Retention policy vanished for tenant " + tenantId)
        );
    }

    public void markArchiveRun(String tenantId, Instant ranAt) {
        jdbc.update(
            "UPDATE retention_policies SET last_archive_run_at = :ranAt WHERE tenant_id = :tenantId",
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("ranAt", Timestamp.from(ranAt))
        );
    }

    public void insertArchiveBatch(
        String tenantId,
        ArchiveCategory category,
        String location,
        int rowCount,
        Instant cutoff,
        Instant createdAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("category", category.dbValue())
            .addValue("location", location)
            .addValue("rowCount", rowCount)
            .addValue("cutoff", Timestamp.from(cutoff))
            .addValue("createdAt", Timestamp.from(createdAt));
        jdbc.update(
            """
                INSERT INTO archive_batches (tenant_id, category, location, row_count, cutoff, created_at)
                VALUES (:tenantId, :category, :location, :rowCount, :cutoff, :createdAt)
                """,
            params
        );
    }

    public int countArchiveBatches(String tenantId, ArchiveCategory category) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM archive_batches WHERE tenant_id = :tenantId AND category = :category",
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("category", category.dbValue()),
            Integer.class
        );
        return count == null ? 0 : count;
    }
}
