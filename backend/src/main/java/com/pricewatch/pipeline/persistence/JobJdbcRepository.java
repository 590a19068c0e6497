package com.pricewatch.pipeline.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.JobQueueStats;
import com.pricewatch.pipeline.model.JobRun;
import com.pricewatch.pipeline.model.JobRunStatus;
import com.pricewatch.pipeline.model.JobStatus;
import com.pricewatch.pipeline.model.SourceType;
import com.pricewatch.pipeline.model.StaleRun;
import com.pricewatch.pipeline.model.TriggerSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.pricewatch.pipeline.persistence.SqlValues.nullableLong;
import static com.pricewatch.pipeline.persistence.SqlValues.toInstant;
import static com.pricewatch.pipeline.persistence.SqlValues.toTimestamp;
import static com.pricewatch.pipeline.persistence.SqlValues.truncate;

/**
 * Job definitions, their claim state and their run history.
 *
 * <p>A job is claimed for execution by a conditional update of its {@code running_since} column; the
 * claim is what keeps two ticks (or a tick and a manual trigger) from running the same job at once.
 */
@Repository
public class JobJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(JobJdbcRepository.class);
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};
    private static final int MAX_ERROR_LENGTH = 1000;
    private static final int MAX_ERROR_DETAILS_LENGTH = 8000;

    private static final String JOB_COLUMNS = """
        id,
        tenant_id,
        name,
        target_ref,
        source_type,
        source_config,
        rate_limit_per_min,
        priority,
        status,
        success_interval_minutes,
        retry_interval_minutes,
        last_run_at,
        next_run_at,
        last_status,
        last_error,
        consecutive_failures,
        running_run_id,
        running_since,
        created_at,
        updated_at
        """;

    private static final String RUN_COLUMNS = """
        id,
        job_id,
        trigger_source,
        status,
        started_at,
        completed_at,
        entities_attempted,
        entities_failed,
        snapshots_written,
        error_details
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<Job> jobMapper;
    private final RowMapper<JobRun> runMapper;

    public JobJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.jobMapper = (rs, rowNum) -> new Job(
            rs.getLong("id"),
            rs.getString("tenant_id"),
            rs.getString("name"),
            rs.getString("target_ref"),
            SourceType.valueOf(rs.getString("source_type")),
            readConfig(rs.getString("source_config")),
            rs.getInt("rate_limit_per_min"),
            rs.getInt("priority"),
            JobStatus.fromDbValue(rs.getString("status")),
            rs.getInt("success_interval_minutes"),
            rs.getInt("retry_interval_minutes"),
            toInstant(rs.getTimestamp("last_run_at")),
            toInstant(rs.getTimestamp("next_run_at")),
            JobRunStatus.fromDbValue(rs.getString("last_status")),
            rs.getString("last_error"),
            rs.getInt("consecutive_failures"),
            nullableLong(rs, "running_run_id"),
            toInstant(rs.getTimestamp("running_since")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
        this.runMapper = (rs, rowNum) -> new JobRun(
            rs.getLong("id"),
            rs.getLong("job_id"),
            TriggerSource.fromDbValue(rs.getString("trigger_source")),
            JobRunStatus.fromDbValue(rs.getString("status")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at")),
            rs.getInt("entities_attempted"),
            rs.getInt("entities_failed"),
            rs.getInt("snapshots_written"),
            rs.getString("error_details")
        );
    }

    public long insertJob(
        String tenantId,
        String name,
        String targetRef,
        SourceType sourceType,
        Map<String, String> sourceConfig,
        int rateLimitPerMin,
        int priority,
        int successIntervalMinutes,
        int retryIntervalMinutes,
        Instant nextRunAt
    ) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("name", name)
            .addValue("targetRef", targetRef)
            .addValue("sourceType", sourceType.name())
            .addValue("sourceConfig", writeConfig(sourceConfig))
            .addValue("rateLimitPerMin", rateLimitPerMin)
            .addValue("priority", priority)
            .addValue("status", JobStatus.ACTIVE.dbValue())
            .addValue("successIntervalMinutes", successIntervalMinutes)
            .addValue("retryIntervalMinutes", retryIntervalMinutes)
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("now", Timestamp.from(now));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO jobs (
                    tenant_id,
                    name,
                    target_ref,
                    source_type,
                    source_config,
                    rate_limit_per_min,
                    priority,
                    status,
                    success_interval_minutes,
                    retry_interval_minutes,
                    next_run_at,
                    consecutive_failures,
                    created_at,
                    updated_at
                )
                VALUES (
                    :tenantId,
                    :name,
                    :targetRef,
                    :sourceType,
                    :sourceConfig,
                    :rateLimitPerMin,
                    :priority,
                    :status,
                    :successIntervalMinutes,
                    :retryIntervalMinutes,
                    :nextRunAt,
                    0,
                    :now,
                    :now
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert job for tenant " + tenantId);
        }
        return key.longValue();
    }

    public boolean updateJobDefinition(
        long jobId,
        String name,
        String targetRef,
        SourceType sourceType,
        Map<String, String> sourceConfig,
        int rateLimitPerMin,
        int priority,
        int successIntervalMinutes,
        int retryIntervalMinutes
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("name", name)
            .addValue("targetRef", targetRef)
            .addValue("sourceType", sourceType.name())
            .addValue("sourceConfig", writeConfig(sourceConfig))
            .addValue("rateLimitPerMin", rateLimitPerMin)
            .addValue("priority", priority)
            .addValue("successIntervalMinutes", successIntervalMinutes)
            .addValue("retryIntervalMinutes", retryIntervalMinutes)
            .addValue("archived", JobStatus.ARCHIVED.dbValue())
            .addValue("now", Timestamp.from(Instant.now()));
        int updated = jdbc.update(
            """
                UPDATE jobs
                SET name = :name,
                    target_ref = :targetRef,
                    source_type = :sourceType,
                    source_config = :sourceConfig,
                    rate_limit_per_min = :rateLimitPerMin,
                    priority = :priority,
                    success_interval_minutes = :successIntervalMinutes,
                    retry_interval_minutes = :retryIntervalMinutes,
                    updated_at = :now
                WHERE id = :jobId
                  AND status <> :archived
                """,
            params
        );
        return updated > 0;
    }

    /**
     * Moves a job between lifecycle states. Archived jobs never leave the archived state.
     */
    public boolean updateJobStatus(long jobId, JobStatus status, Instant nextRunAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("status", status.dbValue())
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("archived", JobStatus.ARCHIVED.dbValue())
            .addValue("now", Timestamp.from(Instant.now()));
        int updated = jdbc.update(
            """
                UPDATE jobs
                SET status = :status,
                    next_run_at = COALESCE(:nextRunAt, next_run_at),
                    updated_at = :now
                WHERE id = :jobId
                  AND status <> :archived
                """,
            params
        );
        return updated > 0;
    }

    public Job findJob(long jobId) {
        List<Job> rows = jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM jobs WHERE id = :jobId",
            new MapSqlParameterSource().addValue("jobId", jobId),
            jobMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<Job> findJobsForTenant(String tenantId) {
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM jobs WHERE tenant_id = :tenantId ORDER BY priority ASC, id ASC",
            new MapSqlParameterSource().addValue("tenantId", tenantId),
            jobMapper
        );
    }

    /**
     * Active jobs whose next run is unset or in the past and that hold no live claim, lowest priority value
     * first, then earliest next run with unset treated as earliest.
     */
    public List<Job> findDueJobs(Instant now, Instant staleCutoff, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", Timestamp.from(now))
            .addValue("staleCutoff", Timestamp.from(staleCutoff))
            .addValue("active", JobStatus.ACTIVE.dbValue())
            .addValue("limit", safeLimit);
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM jobs
                WHERE status = :active
                  AND (next_run_at IS NULL OR next_run_at <= :now)
                  AND (running_since IS NULL OR running_since < :staleCutoff)
                ORDER BY priority ASC, next_run_at ASC NULLS FIRST, id ASC
                LIMIT :limit
                """,
            params,
            jobMapper
        );
    }

    /**
     * Atomically takes the run claim on a job. Succeeds only when no other claim is live, i.e. the job is
     * not running or its claim is older than {@code staleCutoff}.
     *
     * @return true when this caller now owns the claim
     */
    public boolean claimJob(long jobId, String owner, Instant now, Instant staleCutoff, boolean requireActive) {
        String safeOwner = (owner == null || owner.isBlank()) ? "unknown" : owner.trim();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("owner", safeOwner)
            .addValue("now", Timestamp.from(now))
            .addValue("staleCutoff", Timestamp.from(staleCutoff))
            .addValue("active", JobStatus.ACTIVE.dbValue())
            .addValue("archived", JobStatus.ARCHIVED.dbValue())
            .addValue("requireActive", requireActive);
        int updated = jdbc.update(
            """
                UPDATE jobs
                SET running_since = :now,
                    running_run_id = NULL,
                    lock_owner = :owner,
                    updated_at = :now
                WHERE id = :jobId
                  AND status <> :archived
                  AND (:requireActive = FALSE OR status = :active)
                  AND (running_since IS NULL OR running_since < :staleCutoff)
                """,
            params
        );
        return updated == 1;
    }

    public void attachRunToClaim(long jobId, long jobRunId, String owner) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("jobRunId", jobRunId)
            .addValue("owner", owner);
        jdbc.update(
            """
                UPDATE jobs
                SET running_run_id = :jobRunId
                WHERE id = :jobId
                  AND lock_owner = :owner
                  AND running_run_id IS NULL
                """,
            params
        );
    }

    public void releaseClaim(long jobId, String owner) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("owner", owner)
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                UPDATE jobs
                SET running_since = NULL,
                    running_run_id = NULL,
                    lock_owner = NULL,
                    updated_at = :now
                WHERE id = :jobId
                  AND lock_owner = :owner
                """,
            params
        );
    }

    /**
     * Records the outcome of a run on its job and releases the claim, but only while the claim still belongs
     * to that run. A run that was already failed by the stale-run watchdog cannot overwrite a newer claim.
     */
    public boolean recordRunOutcome(
        long jobId,
        long jobRunId,
        JobRunStatus lastStatus,
        String lastError,
        Instant lastRunAt,
        Instant nextRunAt
    ) {
        boolean success = lastStatus == JobRunStatus.COMPLETED;
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("jobRunId", jobRunId)
            .addValue("lastStatus", lastStatus.dbValue())
            .addValue("lastError", truncate(lastError, MAX_ERROR_LENGTH))
            .addValue("lastRunAt", Timestamp.from(lastRunAt))
            .addValue("nextRunAt", Timestamp.from(nextRunAt))
            .addValue("success", success)
            .addValue("now", Timestamp.from(Instant.now()));
        int updated = jdbc.update(
            """
                UPDATE jobs
                SET last_run_at = :lastRunAt,
                    last_status = :lastStatus,
                    last_error = :lastError,
                    next_run_at = :nextRunAt,
                    consecutive_failures = CASE WHEN :success = TRUE THEN 0 ELSE consecutive_failures + 1 END,
                    running_since = NULL,
                    running_run_id = NULL,
                    lock_owner = NULL,
                    updated_at = :now
                WHERE id = :jobId
                  AND running_run_id = :jobRunId
                """,
            params
        );
        return updated > 0;
    }

    public long insertRun(long jobId, TriggerSource triggerSource, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("triggerSource", triggerSource.dbValue())
            .addValue("status", JobRunStatus.RUNNING.dbValue())
            .addValue("startedAt", Timestamp.from(startedAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO job_runs (
                    job_id,
                    trigger_source,
                    status,
                    started_at,
                    entities_attempted,
                    entities_failed,
                    snapshots_written
                )
                VALUES (
                    :jobId,
                    :triggerSource,
                    :status,
                    :startedAt,
                    0,
                    0,
                    0
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert job run for job " + jobId);
        }
        return key.longValue();
    }

    /**
     * Moves a running run into a terminal state. Terminal runs are immutable, so this is a no-op for a run
     * that already completed or failed.
     *
     * @return true when the run was still running and is now terminal
     */
    public boolean completeRun(
        long jobRunId,
        JobRunStatus status,
        Instant completedAt,
        int entitiesAttempted,
        int entitiesFailed,
        int snapshotsWritten,
        String errorDetails
    ) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Run can only complete into a terminal status, got " + status);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobRunId", jobRunId)
            .addValue("status", status.dbValue())
            .addValue("completedAt", Timestamp.from(completedAt))
            .addValue("entitiesAttempted", entitiesAttempted)
            .addValue("entitiesFailed", entitiesFailed)
            .addValue("snapshotsWritten", snapshotsWritten)
            .addValue("errorDetails", truncate(errorDetails, MAX_ERROR_DETAILS_LENGTH))
            .addValue("running", JobRunStatus.RUNNING.dbValue());
        int updated = jdbc.update(
            """
                UPDATE job_runs
                SET status = :status,
                    completed_at = :completedAt,
                    entities_attempted = :entitiesAttempted,
                    entities_failed = :entitiesFailed,
                    snapshots_written = :snapshotsWritten,
                    error_details = :errorDetails
                WHERE id = :jobRunId
                  AND status = :running
                """,
            params
        );
        return updated > 0;
    }

    public JobRun findRun(long jobRunId) {
        List<JobRun> rows = jdbc.query(
            "SELECT " + RUN_COLUMNS + " FROM job_runs WHERE id = :jobRunId",
            new MapSqlParameterSource().addValue("jobRunId", jobRunId),
            runMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<JobRun> findRunsForJob(long jobId, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("limit", safeLimit);
        return jdbc.query(
            "SELECT " + RUN_COLUMNS + """
                FROM job_runs
                WHERE job_id = :jobId
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            params,
            runMapper
        );
    }

    public List<JobRun> findRunningRunsForJob(long jobId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("running", JobRunStatus.RUNNING.dbValue());
        return jdbc.query(
            "SELECT " + RUN_COLUMNS + " FROM job_runs WHERE job_id = :jobId AND status = :running",
            params,
            runMapper
        );
    }

    public List<StaleRun> findStaleRunningRuns(Instant cutoff) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cutoff", Timestamp.from(cutoff))
            .addValue("running", JobRunStatus.RUNNING.dbValue());
        return jdbc.query(
            """
                SELECT id, job_id, started_at
                FROM job_runs
                WHERE status = :running
                  AND started_at < :cutoff
                ORDER BY started_at ASC
                """,
            params,
            (rs, rowNum) -> new StaleRun(
                rs.getLong("id"),
                rs.getLong("job_id"),
                toInstant(rs.getTimestamp("started_at"))
            )
        );
    }

    /**
     * Marks terminal runs of a tenant's jobs that started before the cutoff as archived. Running runs and
     * already archived runs are left alone.
     */
    public int archiveRunsOlderThan(String tenantId, Instant cutoff, Instant archivedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("cutoff", Timestamp.from(cutoff))
            .addValue("archivedAt", Timestamp.from(archivedAt))
            .addValue("archived", JobRunStatus.ARCHIVED.dbValue())
            .addValue("completed", JobRunStatus.COMPLETED.dbValue())
            .addValue("failed", JobRunStatus.FAILED.dbValue());
        return jdbc.update(
            """
                UPDATE job_runs
                SET status = :archived,
                    archived_at = :archivedAt
                WHERE status IN (:completed, :failed)
                  AND started_at < :cutoff
                  AND job_id IN (SELECT id FROM jobs WHERE tenant_id = :tenantId)
                """,
            params
        );
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public List<String> findTenantIds() {
        return jdbc.queryForList(
            "SELECT DISTINCT tenant_id FROM jobs ORDER BY tenant_id",
            new MapSqlParameterSource(),
            String.class
        );
    }

    public JobQueueStats fetchQueueStats(Instant now, Instant staleCutoff) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", Timestamp.from(now))
            .addValue("staleCutoff", Timestamp.from(staleCutoff))
            .addValue("active", JobStatus.ACTIVE.dbValue());
        Long dueCount = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM jobs
                WHERE status = :active
                  AND (next_run_at IS NULL OR next_run_at <= :now)
                  AND (running_since IS NULL OR running_since < :staleCutoff)
                """,
            params,
            Long.class
        );
        Long runningCount = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM jobs
                WHERE running_since IS NOT NULL
                  AND running_since >= :staleCutoff
                """,
            params,
            Long.class
        );
        Timestamp nextDue = jdbc.queryForObject(
            "SELECT MIN(next_run_at) FROM jobs WHERE status = :active",
            params,
            Timestamp.class
        );
        return new JobQueueStats(
            dueCount == null ? 0L : dueCount,
            runningCount == null ? 0L : runningCount,
            toInstant(nextDue)
        );
    }

    private String writeConfig(Map<String, String> config) {
        if (config == null || config.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Source config is not serializable", e);
        }
    }

    private Map<String, String> readConfig(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return new LinkedHashMap<>(objectMapper.readValue(json, STRING_MAP));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable source config: {}", e.getOriginalMessage());
            return Map.of();
        }
    }
}
