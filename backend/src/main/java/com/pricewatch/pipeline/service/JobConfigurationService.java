package com.pricewatch.pipeline.service;

import com.pricewatch.config.PipelineProperties;
import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.JobDefinitionRequest;
import com.pricewatch.pipeline.model.JobRun;
import com.pricewatch.pipeline.model.JobStatus;
import com.pricewatch.pipeline.model.RetentionPolicy;
import com.pricewatch.pipeline.model.RetentionPolicyRequest;
import com.pricewatch.pipeline.persistence.JobJdbcRepository;
import com.pricewatch.pipeline.persistence.RetentionPolicyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
public class JobConfigurationService {
    private static final Logger log = LoggerFactory.getLogger(JobConfigurationService.class);
    private static final int DEFAULT_PRIORITY = 100;
    private static final int MAX_RUNS_LIMIT = 200;

    private final JobJdbcRepository jobRepository;
    private final RetentionPolicyRepository retentionPolicyRepository;
    private final PipelineProperties.Scheduler properties;

    public JobConfigurationService(
        JobJdbcRepository jobRepository,
        RetentionPolicyRepository retentionPolicyRepository,
        PipelineProperties properties
    ) {
        this.jobRepository = jobRepository;
        this.retentionPolicyRepository = retentionPolicyRepository;
        this.properties = properties.getScheduler();
    }

    /**
     * New jobs start active and are due immediately.
     */
    public Job createJob(JobDefinitionRequest request) {
        validate(request, true);
        long jobId = jobRepository.insertJob(
            request.tenantId().trim(),
            request.name().trim(),
            request.targetRef().trim(),
            request.sourceType(),
            request.sourceConfig(),
            request.rateLimitPerMin(),
            priorityOf(request),
            successIntervalOf(request),
            retryIntervalOf(request),
            Instant.now()
        );
        log.info("Created job {} for tenant {} ({})", jobId, request.tenantId(), request.sourceType());
        return jobRepository.findJob(jobId);
    }

    public Job updateJob(long jobId, JobDefinitionRequest request) {
        Job existing = getJob(jobId);
        validate(request, false);
        boolean updated = jobRepository.updateJobDefinition(
            jobId,
            request.name().trim(),
            request.targetRef().trim(),
            request.sourceType(),
            request.sourceConfig(),
            request.rateLimitPerMin(),
            priorityOf(request),
            successIntervalOf(request),
            retryIntervalOf(request)
        );
        if (!updated) {
            throw new InvalidJobConfigurationException("Job " + existing.id() + " is archived and cannot be changed");
        }
        return jobRepository.findJob(jobId);
    }

    public Job pauseJob(long jobId) {
        return transition(jobId, JobStatus.PAUSED, null);
    }

    /**
     * A resumed job becomes due right away.
     */
    public Job resumeJob(long jobId) {
        return transition(jobId, JobStatus.ACTIVE, Instant.now());
    }

    /**
     * Archiving is terminal. A run already in progress finishes normally.
     */
    public Job archiveJob(long jobId) {
        return transition(jobId, JobStatus.ARCHIVED, null);
    }

    public Job getJob(long jobId) {
        Job job = jobRepository.findJob(jobId);
        if (job == null) {
            throw new JobNotFoundException("Job " + jobId + " not found");
        }
        return job;
    }

    public List<Job> listJobs(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new InvalidJobConfigurationException("tenantId is required");
        }
        return jobRepository.findJobsForTenant(tenantId.trim());
    }

    public List<JobRun> listRuns(long jobId, int limit) {
        getJob(jobId);
        return jobRepository.findRunsForJob(jobId, Math.max(1, Math.min(limit, MAX_RUNS_LIMIT)));
    }

    public RetentionPolicy upsertRetentionPolicy(String tenantId, RetentionPolicyRequest request) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new InvalidJobConfigurationException("tenantId is required");
        }
        if (request == null) {
            throw new InvalidJobConfigurationException("retention policy body is required");
        }
        requireDays("retentionDaysSnapshots", request.retentionDaysSnapshots());
        requireDays("retentionDaysAlerts", request.retentionDaysAlerts());
        requireDays("retentionDaysJobs", request.retentionDaysJobs());
        if (request.archivalStrategy() == null) {
            throw new InvalidJobConfigurationException("archivalStrategy is required");
        }
        RetentionPolicy policy = retentionPolicyRepository.upsert(
            tenantId.trim(),
            request.retentionDaysSnapshots(),
            request.retentionDaysAlerts(),
            request.retentionDaysJobs(),
            request.archivalStrategy()
        );
        log.info(
            "Retention policy for tenant {}: snapshots={}d alerts={}d jobs={}d strategy={}",
            policy.tenantId(),
            policy.retentionDaysSnapshots(),
            policy.retentionDaysAlerts(),
            policy.retentionDaysJobs(),
            policy.archivalStrategy().dbValue()
        );
        return policy;
    }

    private Job transition(long jobId, JobStatus status, Instant nextRunAt) {
        Job existing = getJob(jobId);
        if (existing.status() == JobStatus.ARCHIVED) {
            throw new InvalidJobConfigurationException("Job " + jobId + " is archived");
        }
        if (!jobRepository.updateJobStatus(jobId, status, nextRunAt)) {
            throw new InvalidJobConfigurationException("Job " + jobId + " is archived");
        }
        log.info("Job {} {} -> {}", jobId, existing.status().dbValue(), status.dbValue());
        return jobRepository.findJob(jobId);
    }

    private void validate(JobDefinitionRequest request, boolean requireTenant) {
        if (request == null) {
            throw new InvalidJobConfigurationException("job definition body is required");
        }
        if (requireTenant && isBlank(request.tenantId())) {
            throw new InvalidJobConfigurationException("tenantId is required");
        }
        if (isBlank(request.name())) {
            throw new InvalidJobConfigurationException("name is required");
        }
        if (isBlank(request.targetRef())) {
            throw new InvalidJobConfigurationException("targetRef is required");
        }
        if (request.sourceType() == null) {
            throw new InvalidJobConfigurationException("sourceType is required");
        }
        if (request.rateLimitPerMin() == null || request.rateLimitPerMin() <= 0) {
            throw new InvalidJobConfigurationException("rateLimitPerMin must be a positive number of calls per minute");
        }
        if (request.successIntervalMinutes() != null && request.successIntervalMinutes() <= 0) {
            throw new InvalidJobConfigurationException("successIntervalMinutes must be positive");
        }
        if (request.retryIntervalMinutes() != null && request.retryIntervalMinutes() <= 0) {
            throw new InvalidJobConfigurationException("retryIntervalMinutes must be positive");
        }
    }

    private void requireDays(String field, Integer days) {
        if (days == null || days < 1) {
            throw new InvalidJobConfigurationException(field + " must be at least 1 day");
        }
    }

    private int priorityOf(JobDefinitionRequest request) {
        return request.priority() == null ? DEFAULT_PRIORITY : request.priority();
    }

    private int successIntervalOf(JobDefinitionRequest request) {
        return request.successIntervalMinutes() == null
            ? properties.getDefaultSuccessIntervalMinutes()
            : request.successIntervalMinutes();
    }

    private int retryIntervalOf(JobDefinitionRequest request) {
        return request.retryIntervalMinutes() == null
            ? properties.getDefaultRetryIntervalMinutes()
            : request.retryIntervalMinutes();
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
