package com.pricewatch.pipeline.catalog;

import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.TrackedEntity;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Catalog backed by the {@code tracked_entities} table, which the catalog owner keeps in sync.
 */
@Repository
public class JdbcEntityCatalog implements EntityCatalog {
    private final NamedParameterJdbcTemplate jdbc;

    public JdbcEntityCatalog(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<TrackedEntity> resolveEntities(Job job) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", job.tenantId())
            .addValue("targetRef", job.targetRef());
        try {
            return jdbc.query(
                """
                    SELECT entity_ref, tenant_id, target_ref, display_name, source_url, sku
                    FROM tracked_entities
                    WHERE tenant_id = :tenantId
                      AND target_ref = :targetRef
                      AND active = TRUE
                    ORDER BY entity_ref
                    """,
                params,
                (rs, rowNum) -> new TrackedEntity(
                    rs.getString("entity_ref"),
                    rs.getString("tenant_id"),
                    rs.getString("target_ref"),
                    rs.getString("display_name"),
                    rs.getString("source_url"),
                    rs.getString("sku")
                )
            );
        } catch (DataAccessException e) {
            throw new EntityCatalogException("Catalog lookup failed for target " + job.targetRef(), e);
        }
    }

    public void register(TrackedEntity entity) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", entity.tenantId())
            .addValue("targetRef", entity.targetRef())
            .addValue("entityRef", entity.entityRef())
            .addValue("displayName", entity.displayName())
            .addValue("sourceUrl", entity.sourceUrl())
            .addValue("sku", entity.sku())
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                INSERT INTO tracked_entities (tenant_id, target_ref, entity_ref, display_name, source_url, sku, active, created_at)
                VALUES (:tenantId, :targetRef, :entityRef, :displayName, :sourceUrl, :sku, TRUE, :now)
                """,
            params
        );
    }
}
