package com.pricewatch.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricewatch.config.PipelineProperties;
import com.pricewatch.pipeline.alert.AlertEvaluatorService;
import com.pricewatch.pipeline.catalog.EntityCatalog;
import com.pricewatch.pipeline.catalog.EntityCatalogException;
import com.pricewatch.pipeline.fetch.FetchAdapter;
import com.pricewatch.pipeline.fetch.FetchAdapterException;
import com.pricewatch.pipeline.fetch.FetchAdapterRegistry;
import com.pricewatch.pipeline.fetch.RunPacer;
import com.pricewatch.pipeline.model.FetchResult;
import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.JobExecutionResult;
import com.pricewatch.pipeline.model.JobRunError;
import com.pricewatch.pipeline.model.JobRunErrorType;
import com.pricewatch.pipeline.model.JobRunStatus;
import com.pricewatch.pipeline.model.Observation;
import com.pricewatch.pipeline.model.Snapshot;
import com.pricewatch.pipeline.model.TrackedEntity;
import com.pricewatch.pipeline.persistence.SnapshotJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one claimed job: resolves its entities, calls the fetch adapter batch by batch at the job's rate limit,
 * writes a snapshot per observation and terminates the run. New snapshots are then handed to alert evaluation.
 */
@Service
public class JobExecutorService {
    private static final Logger log = LoggerFactory.getLogger(JobExecutorService.class);
    private static final int MAX_RECORDED_ENTITY_ERRORS = 50;

    private final EntityCatalog entityCatalog;
    private final FetchAdapterRegistry adapterRegistry;
    private final SnapshotJdbcRepository snapshotRepository;
    private final JobRunLifecycleService lifecycleService;
    private final AlertEvaluatorService alertEvaluator;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;

    public JobExecutorService(
        EntityCatalog entityCatalog,
        FetchAdapterRegistry adapterRegistry,
        SnapshotJdbcRepository snapshotRepository,
        JobRunLifecycleService lifecycleService,
        AlertEvaluatorService alertEvaluator,
        ObjectMapper objectMapper,
        PipelineProperties properties
    ) {
        this.entityCatalog = entityCatalog;
        this.adapterRegistry = adapterRegistry;
        this.snapshotRepository = snapshotRepository;
        this.lifecycleService = lifecycleService;
        this.alertEvaluator = alertEvaluator;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public JobExecutionResult execute(Job job, long jobRunId) {
        Instant deadline = Instant.now().plus(Duration.ofSeconds(properties.getScheduler().getRunTimeoutSeconds()));
        JobExecutionResult result;
        try {
            result = collect(job, jobRunId, deadline);
        } catch (Exception e) {
            log.warn("Job {} run {} failed unexpectedly", job.id(), jobRunId, e);
            result = failure(jobRunId, 0, 0, List.of(), JobRunError.of(
                JobRunErrorType.INTERNAL,
                true,
                e.getClass().getSimpleName() + ": " + e.getMessage()
            ));
        }
        lifecycleService.completeRun(jobRunId, result);
        if (!result.newSnapshots().isEmpty()) {
            try {
                alertEvaluator.evaluate(result.newSnapshots());
            } catch (Exception e) {
                log.warn("Alert evaluation failed for job {} run {}", job.id(), jobRunId, e);
            }
        }
        return result;
    }

    private JobExecutionResult collect(Job job, long jobRunId, Instant deadline) {
        List<TrackedEntity> entities;
        try {
            entities = entityCatalog.resolveEntities(job);
        } catch (EntityCatalogException e) {
            return failure(jobRunId, 0, 0, List.of(), JobRunError.of(JobRunErrorType.CATALOG, true, e.getMessage()));
        }
        if (entities == null || entities.isEmpty()) {
            return failure(jobRunId, 0, 0, List.of(), JobRunError.of(
                JobRunErrorType.CONFIGURATION,
                false,
                "No entities resolved for target " + job.targetRef()
            ));
        }
        Optional<FetchAdapter> adapter = adapterRegistry.find(job.sourceType());
        if (adapter.isEmpty()) {
            return failure(jobRunId, 0, 0, List.of(), JobRunError.of(
                JobRunErrorType.CONFIGURATION,
                false,
                "No fetch adapter for source type " + job.sourceType()
            ));
        }

        RunPacer pacer = new RunPacer(RunPacer.intervalFor(job.rateLimitPerMin(), properties.getFetch().getMinCallDelayMs()));
        int batchSize = Math.max(1, adapter.get().batchSize(job));
        int attempted = 0;
        int failed = 0;
        boolean anyTransient = false;
        boolean timedOut = false;
        String lastBatchError = null;
        Map<String, String> entityErrors = new LinkedHashMap<>();
        List<Snapshot> written = new ArrayList<>();

        for (int from = 0; from < entities.size(); from += batchSize) {
            List<TrackedEntity> batch = entities.subList(from, Math.min(entities.size(), from + batchSize));
            if (Instant.now().plusMillis(pacer.pendingDelayMs()).isAfter(deadline)) {
                timedOut = true;
                break;
            }
            try {
                pacer.awaitNextCall();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                timedOut = true;
                break;
            }
            attempted += batch.size();
            FetchResult fetched;
            try {
                fetched = adapter.get().fetch(job, batch);
            } catch (FetchAdapterException e) {
                failed += batch.size();
                anyTransient |= e.isTransientFailure();
                lastBatchError = e.getMessage();
                batch.forEach(entity -> recordError(entityErrors, entity.entityRef(), e.getMessage()));
                log.debug("Job {} batch at {} failed: {}", job.id(), from, e.getMessage());
                continue;
            } catch (RuntimeException e) {
                failed += batch.size();
                lastBatchError = e.getClass().getSimpleName() + ": " + e.getMessage();
                String message = lastBatchError;
                batch.forEach(entity -> recordError(entityErrors, entity.entityRef(), message));
                log.warn("Job {} adapter threw on batch at {}", job.id(), from, e);
                continue;
            }
            if (fetched.isPartial()) {
                failed += fetched.entityErrors().size();
                fetched.entityErrors().forEach((ref, message) -> recordError(entityErrors, ref, message));
            }
            for (Observation observation : fetched.observations()) {
                store(job, jobRunId, observation).ifPresent(written::add);
            }
        }

        if (timedOut) {
            return failure(jobRunId, attempted, failed, written, new JobRunError(
                JobRunErrorType.TIMEOUT,
                true,
                "Run exceeded " + properties.getScheduler().getRunTimeoutSeconds() + "s after " + attempted + " of "
                    + entities.size() + " entities",
                written.size(),
                entityErrors
            ));
        }
        if (written.isEmpty() && failed > 0) {
            return failure(jobRunId, attempted, failed, written, new JobRunError(
                JobRunErrorType.ADAPTER_ERROR,
                anyTransient,
                lastBatchError == null ? failed + " entities failed, no snapshots written" : lastBatchError,
                0,
                entityErrors
            ));
        }
        JobRunError partial = failed == 0 ? null : new JobRunError(
            JobRunErrorType.PARTIAL_FAILURE,
            anyTransient,
            failed + " of " + attempted + " entities failed",
            written.size(),
            entityErrors
        );
        return new JobExecutionResult(jobRunId, JobRunStatus.COMPLETED, attempted, failed, written.size(), written, partial);
    }

    /**
     * Idempotent on {@code (entity_ref, observed_at)}: storing the same observation again yields empty.
     */
    Optional<Snapshot> store(Job job, long jobRunId, Observation observation) {
        if (observation.entityRef() == null || observation.observedAt() == null) {
            return Optional.empty();
        }
        return snapshotRepository.insertIfAbsent(
            job.tenantId(),
            job.id(),
            jobRunId,
            observation.entityRef(),
            observation.price(),
            observation.currency(),
            observation.inStock(),
            observation.observedAt(),
            writeMetadata(observation.rawMetadata())
        );
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unserializable observation metadata: {}", e.getOriginalMessage());
            return null;
        }
    }

    private void recordError(Map<String, String> errors, String entityRef, String message) {
        if (errors.size() < MAX_RECORDED_ENTITY_ERRORS || errors.containsKey(entityRef)) {
            errors.put(entityRef, message);
        }
    }

    private JobExecutionResult failure(
        long jobRunId,
        int attempted,
        int failed,
        List<Snapshot> written,
        JobRunError error
    ) {
        return new JobExecutionResult(jobRunId, JobRunStatus.FAILED, attempted, failed, written.size(), written, error);
    }
}
