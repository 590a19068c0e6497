package com.pricewatch.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricewatch.config.PipelineProperties;
import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.JobExecutionResult;
import com.pricewatch.pipeline.model.JobRun;
import com.pricewatch.pipeline.model.JobRunError;
import com.pricewatch.pipeline.model.JobRunErrorType;
import com.pricewatch.pipeline.model.JobRunStatus;
import com.pricewatch.pipeline.model.StaleRun;
import com.pricewatch.pipeline.model.TriggerSource;
import com.pricewatch.pipeline.persistence.JobJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the state transitions of a job and its runs: taking the run claim, terminating runs and rescheduling
 * the job from the outcome.
 */
@Service
public class JobRunLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(JobRunLifecycleService.class);

    private final JobJdbcRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final PipelineProperties.Scheduler properties;
    private final String instanceId;

    public JobRunLifecycleService(JobJdbcRepository jobRepository, ObjectMapper objectMapper, PipelineProperties properties) {
        this.jobRepository = jobRepository;
        this.objectMapper = objectMapper;
        this.properties = properties.getScheduler();
        this.instanceId = "scheduler-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    public Instant staleCutoff(Instant now) {
        return now.minus(Duration.ofMinutes(properties.getStaleRunMinutes()));
    }

    /**
     * Claims the job and opens a {@code running} run for it. Fails when another non-stale run holds the claim.
     * Any run still marked running for the job at this point lost its claim and is failed as stale.
     *
     * @param requireActive false lets paused jobs be claimed, as manual triggers may
     * @return the new run id, or empty when the job is already running or not claimable
     */
    public Optional<Long> begin(long jobId, TriggerSource triggerSource, boolean requireActive) {
        Instant now = Instant.now();
        String owner = instanceId + "-" + UUID.randomUUID();
        if (!jobRepository.claimJob(jobId, owner, now, staleCutoff(now), requireActive)) {
            return Optional.empty();
        }
        try {
            for (JobRun orphan : jobRepository.findRunningRunsForJob(jobId)) {
                failStale(orphan.id(), now);
            }
            long runId = jobRepository.insertRun(jobId, triggerSource, now);
            jobRepository.attachRunToClaim(jobId, runId, owner);
            log.debug("Job {} claimed by {} as run {} ({})", jobId, owner, runId, triggerSource.dbValue());
            return Optional.of(runId);
        } catch (RuntimeException e) {
            jobRepository.releaseClaim(jobId, owner);
            throw e;
        }
    }

    /**
     * Moves the run to its terminal state. A run that is no longer running is left as it is.
     */
    public boolean completeRun(long jobRunId, JobExecutionResult result) {
        return jobRepository.completeRun(
            jobRunId,
            result.status(),
            Instant.now(),
            result.entitiesAttempted(),
            result.entitiesFailed(),
            result.snapshotsWritten(),
            writeError(result.error())
        );
    }

    /**
     * Records the outcome on the job, computes its next run and releases the claim held by this run.
     */
    public void finish(Job job, long jobRunId, JobExecutionResult result) {
        Instant now = Instant.now();
        Instant nextRunAt = nextRunAt(job, result, now);
        String lastError = result.error() == null ? null : result.error().type().name() + ": " + result.error().message();
        boolean recorded = jobRepository.recordRunOutcome(job.id(), jobRunId, result.status(), lastError, now, nextRunAt);
        if (!recorded) {
            log.warn("Job {} run {} finished after losing its claim; outcome not recorded on the job", job.id(), jobRunId);
            return;
        }
        log.info(
            "Job {} run {} {} attempted={} failed={} written={} next={}",
            job.id(),
            jobRunId,
            result.status().dbValue(),
            result.entitiesAttempted(),
            result.entitiesFailed(),
            result.snapshotsWritten(),
            nextRunAt
        );
    }

    /**
     * Success and terminal failures wait the healthy interval; only transient failures come back early.
     */
    Instant nextRunAt(Job job, JobExecutionResult result, Instant now) {
        int minutes = !result.succeeded() && result.transientFailure()
            ? positiveOr(job.retryIntervalMinutes(), properties.getDefaultRetryIntervalMinutes())
            : positiveOr(job.successIntervalMinutes(), properties.getDefaultSuccessIntervalMinutes());
        return now.plus(Duration.ofMinutes(minutes));
    }

    /**
     * Watchdog pass: fails runs that have been running longer than the stale threshold and releases the job
     * claims they still hold.
     *
     * @return number of runs failed
     */
    public int failStaleRuns(Instant now) {
        List<StaleRun> stale = jobRepository.findStaleRunningRuns(staleCutoff(now));
        int failed = 0;
        for (StaleRun run : stale) {
            try {
                if (failStale(run.jobRunId(), now)) {
                    failed++;
                    Job job = jobRepository.findJob(run.jobId());
                    int retryMinutes = job == null
                        ? properties.getDefaultRetryIntervalMinutes()
                        : positiveOr(job.retryIntervalMinutes(), properties.getDefaultRetryIntervalMinutes());
                    jobRepository.recordRunOutcome(
                        run.jobId(),
                        run.jobRunId(),
                        JobRunStatus.FAILED,
                        JobRunErrorType.STALE_RUN.name() + ": run exceeded stale threshold",
                        now,
                        now.plus(Duration.ofMinutes(retryMinutes))
                    );
                    log.warn("Failed stale run {} of job {} started at {}", run.jobRunId(), run.jobId(), run.startedAt());
                }
            } catch (Exception e) {
                log.warn("Failed to close stale run {} of job {}", run.jobRunId(), run.jobId(), e);
            }
        }
        return failed;
    }

    private boolean failStale(long jobRunId, Instant now) {
        JobRunError error = JobRunError.of(JobRunErrorType.STALE_RUN, true, "run exceeded stale threshold");
        return jobRepository.completeRun(jobRunId, JobRunStatus.FAILED, now, 0, 0, 0, writeError(error));
    }

    private String writeError(JobRunError error) {
        if (error == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(error);
        } catch (JsonProcessingException e) {
            return error.type().name() + ": " + error.message();
        }
    }

    private int positiveOr(int value, int fallback) {
        return value > 0 ? value : fallback;
    }
}
