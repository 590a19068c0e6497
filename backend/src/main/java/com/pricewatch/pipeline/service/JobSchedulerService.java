package com.pricewatch.pipeline.service;

import com.pricewatch.config.PipelineProperties;
import com.pricewatch.pipeline.model.DeliveryQueueStats;
import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.JobExecutionResult;
import com.pricewatch.pipeline.model.JobQueueStats;
import com.pricewatch.pipeline.model.JobRun;
import com.pricewatch.pipeline.model.JobRunError;
import com.pricewatch.pipeline.model.JobRunErrorType;
import com.pricewatch.pipeline.model.JobRunStatus;
import com.pricewatch.pipeline.model.JobStatus;
import com.pricewatch.pipeline.model.PipelineStatusResponse;
import com.pricewatch.pipeline.model.SchedulerTickSummary;
import com.pricewatch.pipeline.model.TriggerSource;
import com.pricewatch.pipeline.persistence.JobJdbcRepository;
import com.pricewatch.pipeline.retention.RetentionManagerService;
import com.pricewatch.pipeline.webhook.WebhookDispatcherService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodically picks due jobs, claims them and hands them to the worker pool. Never dispatches more jobs than
 * there are free workers, so a claimed job always starts promptly.
 */
@Service
public class JobSchedulerService {
    private static final Logger log = LoggerFactory.getLogger(JobSchedulerService.class);

    private final JobJdbcRepository jobRepository;
    private final JobRunLifecycleService lifecycleService;
    private final JobExecutorService executorService;
    private final WebhookDispatcherService dispatcher;
    private final RetentionManagerService retentionManager;
    private final ThreadPoolExecutor workers;
    private final PipelineProperties.Scheduler properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Object lifecycleLock = new Object();
    private final Object tickLock = new Object();

    private ScheduledExecutorService ticker;

    public JobSchedulerService(
        JobJdbcRepository jobRepository,
        JobRunLifecycleService lifecycleService,
        JobExecutorService executorService,
        WebhookDispatcherService dispatcher,
        RetentionManagerService retentionManager,
        @Qualifier("jobWorkerExecutor") ThreadPoolExecutor workers,
        PipelineProperties properties
    ) {
        this.jobRepository = jobRepository;
        this.lifecycleService = lifecycleService;
        this.executorService = executorService;
        this.dispatcher = dispatcher;
        this.retentionManager = retentionManager;
        this.workers = workers;
        this.properties = properties.getScheduler();
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

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            ticker = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("job-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            ticker.scheduleWithFixedDelay(this::scheduledTick, 0, properties.getTickIntervalSeconds(), TimeUnit.SECONDS);
            log.info(
                "Job scheduler started: tick every {}s, {} workers",
                properties.getTickIntervalSeconds(),
                properties.getWorkerCount()
            );
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (ticker != null) {
                ticker.shutdownNow();
                try {
                    ticker.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                ticker = null;
            }
            log.info("Job scheduler stopped, {} runs still in flight", inFlight.get());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public int inFlight() {
        return inFlight.get();
    }

    /**
     * One scheduling pass: fails stale runs, then dispatches due jobs by priority and earliest
     * {@code next_run_at} up to the free worker capacity.
     */
    public SchedulerTickSummary tick() {
        synchronized (tickLock) {
            Instant now = Instant.now();
            int staleFailed = lifecycleService.failStaleRuns(now);
            int capacity = Math.min(properties.getMaxDueJobsPerTick(), properties.getWorkerCount() - inFlight.get());
            if (capacity <= 0) {
                log.debug("Tick at {}: no free workers ({} in flight)", now, inFlight.get());
                return new SchedulerTickSummary(now, staleFailed, 0, List.of(), List.of());
            }

            List<Job> due = jobRepository.findDueJobs(now, lifecycleService.staleCutoff(now), capacity);
            List<Long> dispatched = new ArrayList<>();
            List<Long> skipped = new ArrayList<>();
            for (Job candidate : due) {
                Optional<Long> runId;
                try {
                    runId = lifecycleService.begin(candidate.id(), TriggerSource.SYSTEM, true);
                } catch (Exception e) {
                    log.warn("Failed to claim job {}", candidate.id(), e);
                    skipped.add(candidate.id());
                    continue;
                }
                if (runId.isEmpty()) {
                    skipped.add(candidate.id());
                    continue;
                }
                submit(candidate.id(), runId.get());
                dispatched.add(candidate.id());
            }
            if (!due.isEmpty()) {
                log.info("Tick at {}: due={} dispatched={} skipped={}", now, due.size(), dispatched, skipped);
            }
            return new SchedulerTickSummary(now, staleFailed, due.size(), dispatched, skipped);
        }
    }

    /**
     * Starts a run now regardless of {@code next_run_at}. Paused jobs may be triggered; archived ones may not.
     *
     * @throws JobNotFoundException when the job does not exist
     * @throws InvalidJobConfigurationException when the job is archived
     * @throws ActiveJobRunException when a run is already in progress
     */
    public JobRun triggerManually(long jobId) {
        Job job = jobRepository.findJob(jobId);
        if (job == null) {
            throw new JobNotFoundException("Job " + jobId + " not found");
        }
        if (job.status() == JobStatus.ARCHIVED) {
            throw new InvalidJobConfigurationException("Job " + jobId + " is archived");
        }
        Optional<Long> runId = lifecycleService.begin(jobId, TriggerSource.MANUAL, false);
        if (runId.isEmpty()) {
            throw new ActiveJobRunException("Job " + jobId + " already has a run in progress");
        }
        submit(jobId, runId.get());
        log.info("Manually triggered job {} as run {}", jobId, runId.get());
        return jobRepository.findRun(runId.get());
    }

    /**
     * Blocks until no run is in flight or the timeout passes.
     *
     * @return true when idle
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (inFlight.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            TimeUnit.MILLISECONDS.sleep(20);
        }
        return true;
    }

    public PipelineStatusResponse getStatus() {
        Instant now = Instant.now();
        JobQueueStats jobs;
        try {
            jobs = jobRepository.fetchQueueStats(now, lifecycleService.staleCutoff(now));
        } catch (Exception e) {
            log.warn("Failed to load job queue stats", e);
            jobs = new JobQueueStats(0, 0, null);
        }
        DeliveryQueueStats deliveries;
        try {
            deliveries = dispatcher.getQueueStats();
        } catch (Exception e) {
            log.warn("Failed to load webhook delivery stats", e);
            deliveries = new DeliveryQueueStats(Map.of(), 0);
        }
        return new PipelineStatusResponse(
            running.get(),
            properties.getWorkerCount(),
            inFlight.get(),
            jobs.dueCount(),
            jobs.runningCount(),
            jobs.nextDueAt(),
            dispatcher.isRunning(),
            deliveries,
            retentionManager.isScheduled()
        );
    }

    private void submit(long jobId, long runId) {
        inFlight.incrementAndGet();
        try {
            workers.execute(() -> {
                try {
                    runJob(jobId, runId);
                } finally {
                    inFlight.decrementAndGet();
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.decrementAndGet();
            log.warn("Worker pool rejected job {} run {}", jobId, runId);
            Job job = jobRepository.findJob(jobId);
            JobExecutionResult rejected = failed(runId, JobRunErrorType.INTERNAL, "worker pool rejected the run");
            lifecycleService.completeRun(runId, rejected);
            if (job != null) {
                lifecycleService.finish(job, runId, rejected);
            }
        }
    }

    private void runJob(long jobId, long runId) {
        Job job = jobRepository.findJob(jobId);
        if (job == null) {
            lifecycleService.completeRun(runId, failed(runId, JobRunErrorType.CONFIGURATION, "job disappeared"));
            return;
        }
        JobExecutionResult result;
        try {
            result = executorService.execute(job, runId);
        } catch (Exception e) {
            log.warn("Executor failed for job {} run {}", jobId, runId, e);
            result = failed(runId, JobRunErrorType.INTERNAL, e.getClass().getSimpleName() + ": " + e.getMessage());
            lifecycleService.completeRun(runId, result);
        }
        try {
            lifecycleService.finish(job, runId, result);
        } catch (Exception e) {
            log.warn("Failed to record outcome of job {} run {}", jobId, runId, e);
        }
    }

    private JobExecutionResult failed(long runId, JobRunErrorType type, String message) {
        return new JobExecutionResult(runId, JobRunStatus.FAILED, 0, 0, 0, List.of(), JobRunError.of(type, true, message));
    }

    private void scheduledTick() {
        try {
            tick();
        } catch (Exception e) {
            log.warn("Scheduler tick failed", e);
        }
    }
}
