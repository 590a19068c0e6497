package com.pricewatch.pipeline.persistence;

import com.pricewatch.pipeline.model.Snapshot;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static com.pricewatch.pipeline.persistence.SqlValues.nullableBoolean;
import static com.pricewatch.pipeline.persistence.SqlValues.nullableLong;
import static com.pricewatch.pipeline.persistence.SqlValues.toInstant;
import static com.pricewatch.pipeline.persistence.SqlValues.truncate;

/**
 * Append-only store of observed values. Rows are never updated; the logical key is
 * {@code (tenant_id, entity_ref, observed_at)}.
 */
@Repository
public class SnapshotJdbcRepository {
    private static final int MAX_METADATA_LENGTH = 4000;

    private static final String COLUMNS = """
        id,
        tenant_id,
        job_id,
        job_run_id,
        entity_ref,
        price,
        currency,
        in_stock,
        observed_at,
        raw_metadata,
        created_at
        """;

    private static final RowMapper<Snapshot> SNAPSHOT_MAPPER = (rs, rowNum) -> new Snapshot(
        rs.getLong("id"),
        rs.getString("tenant_id"),
        nullableLong(rs, "job_id"),
        nullableLong(rs, "job_run_id"),
        rs.getString("entity_ref"),
        rs.getBigDecimal("price"),
        rs.getString("currency"),
        nullableBoolean(rs, "in_stock"),
        toInstant(rs.getTimestamp("observed_at")),
        rs.getString("raw_metadata"),
        toInstant(rs.getTimestamp("created_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public SnapshotJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Writes a snapshot unless the tenant already has one for the same entity and observation time.
     *
     * @return the new snapshot, or empty when the logical key was already present
     */
    public Optional<Snapshot> insertIfAbsent(
        String tenantId,
        Long jobId,
        Long jobRunId,
        String entityRef,
        BigDecimal price,
        String currency,
        Boolean inStock,
        Instant observedAt,
        String rawMetadata
    ) {
        Instant observedKey = observedAt.truncatedTo(ChronoUnit.MICROS);
        if (findByKey(tenantId, entityRef, observedKey).isPresent()) {
            return Optional.empty();
        }
        Instant createdAt = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("jobId", jobId, Types.BIGINT)
            .addValue("jobRunId", jobRunId, Types.BIGINT)
            .addValue("entityRef", entityRef)
            .addValue("price", price, Types.NUMERIC)
            .addValue("currency", currency, Types.VARCHAR)
            .addValue("inStock", inStock, Types.BOOLEAN)
            .addValue("observedAt", Timestamp.from(observedKey))
            .addValue("rawMetadata", truncate(rawMetadata, MAX_METADATA_LENGTH), Types.VARCHAR)
            .addValue("createdAt", Timestamp.from(createdAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbc.update(
                """
                    INSERT INTO snapshots (
                        tenant_id,
                        job_id,
                        job_run_id,
                        entity_ref,
                        price,
                        currency,
                        in_stock,
                        observed_at,
                        raw_metadata,
                        created_at
                    )
                    VALUES (
                        :tenantId,
                        :jobId,
                        :jobRunId,
                        :entityRef,
                        :price,
                        :currency,
                        :inStock,
                        :observedAt,
                        :rawMetadata,
                        :createdAt
                    )
                    """,
                params,
                keyHolder,
                new String[] {"id"}
            );
        } catch (DuplicateKeyException e) {
            // A concurrent writer stored the same observation first.
            return Optional.empty();
        }
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert snapshot for " + entityRef);
        }
        return Optional.of(new Snapshot(
            key.longValue(),
            tenantId,
            jobId,
            jobRunId,
            entityRef,
            price,
            currency,
            inStock,
            observedKey,
            rawMetadata,
            createdAt
        ));
    }

    public Optional<Snapshot> findByKey(String tenantId, String entityRef, Instant observedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("entityRef", entityRef)
            .addValue("observedAt", Timestamp.from(observedAt.truncatedTo(ChronoUnit.MICROS)));
        List<Snapshot> rows = jdbc.query(
            "SELECT " + COLUMNS + """
                FROM snapshots
                WHERE tenant_id = :tenantId
                  AND entity_ref = :entityRef
                  AND observed_at = :observedAt
                """,
            params,
            SNAPSHOT_MAPPER
        );
        return rows.stream().findFirst();
    }

    /**
     * Latest snapshot of the tenant's entity observed strictly before the given time.
     */
    public Optional<Snapshot> findPrevious(String tenantId, String entityRef, Instant observedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("entityRef", entityRef)
            .addValue("observedAt", Timestamp.from(observedAt));
        List<Snapshot> rows = jdbc.query(
            "SELECT " + COLUMNS + """
                FROM snapshots
                WHERE tenant_id = :tenantId
                  AND entity_ref = :entityRef
                  AND observed_at < :observedAt
                ORDER BY observed_at DESC
                LIMIT 1
                """,
            params,
            SNAPSHOT_MAPPER
        );
        return rows.stream().findFirst();
    }

    public List<Snapshot> findByRun(long jobRunId) {
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM snapshots WHERE job_run_id = :jobRunId ORDER BY observed_at ASC, id ASC",
            new MapSqlParameterSource().addValue("jobRunId", jobRunId),
            SNAPSHOT_MAPPER
        );
    }

    public List<Snapshot> findRecentForEntity(String tenantId, String entityRef, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("entityRef", entityRef)
            .addValue("limit", safeLimit);
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM snapshots
                WHERE tenant_id = :tenantId
                  AND entity_ref = :entityRef
                ORDER BY observed_at DESC
                LIMIT :limit
                """,
            params,
            SNAPSHOT_MAPPER
        );
    }

    public List<Snapshot> findOlderThan(String tenantId, Instant cutoff, int limit) {
        int safeLimit = Math.max(1, limit);
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("cutoff", Timestamp.from(cutoff))
            .addValue("limit", safeLimit);
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM snapshots
                WHERE tenant_id = :tenantId
                  AND observed_at < :cutoff
                ORDER BY observed_at ASC, id ASC
                LIMIT :limit
                """,
            params,
            SNAPSHOT_MAPPER
        );
    }

    public int deleteOlderThan(String tenantId, Instant cutoff) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("cutoff", Timestamp.from(cutoff));
        return jdbc.update(
            "DELETE FROM snapshots WHERE tenant_id = :tenantId AND observed_at < :cutoff",
            params
        );
    }

    public int deleteByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        return jdbc.update(
            "DELETE FROM snapshots WHERE id IN (:ids)",
            new MapSqlParameterSource().addValue("ids", ids)
        );
    }

    public long countForTenant(String tenantId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM snapshots WHERE tenant_id = :tenantId",
            new MapSqlParameterSource().addValue("tenantId", tenantId),
            Long.class
        );
        return count == null ? 0L : count;
    }
}
