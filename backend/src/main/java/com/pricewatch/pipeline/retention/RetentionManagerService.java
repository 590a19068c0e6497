package com.pricewatch.pipeline.retention;

import com.pricewatch.config.PipelineProperties;
import com.pricewatch.pipeline.model.Alert;
import com.pricewatch.pipeline.model.ArchivalStrategy;
import com.pricewatch.pipeline.model.ArchiveCategory;
import com.pricewatch.pipeline.model.RetentionPolicy;
import com.pricewatch.pipeline.model.RetentionRunSummary;
import com.pricewatch.pipeline.model.RetentionSweepResult;
import com.pricewatch.pipeline.model.Snapshot;
import com.pricewatch.pipeline.persistence.AlertJdbcRepository;
import com.pricewatch.pipeline.persistence.JobJdbcRepository;
import com.pricewatch.pipeline.persistence.RetentionPolicyRepository;
import com.pricewatch.pipeline.persistence.SnapshotJdbcRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Applies each tenant's retention policy. Only rows strictly older than the policy cutoffs are touched, so a
 * sweep never contends with snapshots, alerts or runs the live pipeline is writing.
 */
@Service
public class RetentionManagerService {
    private static final Logger log = LoggerFactory.getLogger(RetentionManagerService.class);

    private final RetentionPolicyRepository policyRepository;
    private final SnapshotJdbcRepository snapshotRepository;
    private final AlertJdbcRepository alertRepository;
    private final JobJdbcRepository jobRepository;
    private final ColdStorageWriter coldStorageWriter;
    private final PipelineProperties.Retention properties;
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;

    public RetentionManagerService(
        RetentionPolicyRepository policyRepository,
        SnapshotJdbcRepository snapshotRepository,
        AlertJdbcRepository alertRepository,
        JobJdbcRepository jobRepository,
        ColdStorageWriter coldStorageWriter,
        PipelineProperties properties
    ) {
        this.policyRepository = policyRepository;
        this.snapshotRepository = snapshotRepository;
        this.alertRepository = alertRepository;
        this.jobRepository = jobRepository;
        this.coldStorageWriter = coldStorageWriter;
        this.properties = properties.getRetention();
    }

    @PostConstruct
    public void startIfEnabled() {
        if (!properties.isEnabled()) {
            return;
        }
        synchronized (lifecycleLock) {
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("retention-sweeper");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleWithFixedDelay(
                this::scheduledSweep,
                properties.getInitialDelayMinutes(),
                properties.getIntervalHours() * 60L,
                TimeUnit.MINUTES
            );
        }
        log.info("Retention sweep scheduled every {} h", properties.getIntervalHours());
    }

    @PreDestroy
    public void stop() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
        }
    }

    public boolean isScheduled() {
        synchronized (lifecycleLock) {
            return scheduler != null;
        }
    }

    /**
     * Sweeps every tenant that has a policy or owns jobs. A tenant without a policy, or whose sweep throws, is
     * reported in {@link RetentionRunSummary#failedTenants()} and the remaining tenants still run.
     */
    public RetentionRunSummary sweepAll() {
        Instant startedAt = Instant.now();
        TreeSet<String> tenants = new TreeSet<>(policyRepository.findTenantIds());
        tenants.addAll(jobRepository.findTenantIds());

        List<RetentionSweepResult> results = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String tenantId : tenants) {
            try {
                results.add(sweepTenant(tenantId));
            } catch (MissingRetentionPolicyException e) {
                log.warn("Skipping retention for tenant {}: no policy configured", tenantId);
                failed.put(tenantId, "missing_retention_policy");
            } catch (Exception e) {
                log.error("Retention sweep failed for tenant {}", tenantId, e);
                failed.put(tenantId, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
        return new RetentionRunSummary(startedAt, Instant.now(), results, failed);
    }

    public RetentionSweepResult sweepTenant(String tenantId) {
        RetentionPolicy policy = policyRepository.find(tenantId)
            .orElseThrow(() -> new MissingRetentionPolicyException(tenantId));
        Instant now = Instant.now();
        Instant snapshotCutoff = now.minus(Duration.ofDays(policy.retentionDaysSnapshots()));
        Instant alertCutoff = now.minus(Duration.ofDays(policy.retentionDaysAlerts()));
        Instant jobCutoff = now.minus(Duration.ofDays(policy.retentionDaysJobs()));

        int snapshots;
        int alerts;
        if (policy.archivalStrategy() == ArchivalStrategy.ARCHIVE) {
            snapshots = archiveSnapshots(tenantId, snapshotCutoff, now);
            alerts = archiveAlerts(tenantId, alertCutoff, now);
        } else {
            snapshots = snapshotRepository.deleteOlderThan(tenantId, snapshotCutoff);
            alerts = alertRepository.deleteSettledOlderThan(tenantId, alertCutoff);
        }
        int runs = jobRepository.archiveRunsOlderThan(tenantId, jobCutoff, now);
        policyRepository.markArchiveRun(tenantId, now);

        log.info(
            "Retention tenant={} strategy={} snapshots={} alerts={} jobRunsArchived={}",
            tenantId,
            policy.archivalStrategy().dbValue(),
            snapshots,
            alerts,
            runs
        );
        return new RetentionSweepResult(tenantId, policy.archivalStrategy(), snapshots, alerts, runs, now);
    }

    private int archiveSnapshots(String tenantId, Instant cutoff, Instant now) {
        int total = 0;
        while (true) {
            List<Snapshot> batch = snapshotRepository.findOlderThan(tenantId, cutoff, properties.getBatchSize());
            if (batch.isEmpty()) {
                return total;
            }
            String location = write(() -> coldStorageWriter.writeSnapshots(tenantId, batch));
            policyRepository.insertArchiveBatch(tenantId, ArchiveCategory.SNAPSHOTS, location, batch.size(), cutoff, now);
            int deleted = snapshotRepository.deleteByIds(batch.stream().map(Snapshot::id).toList());
            if (deleted == 0) {
                return total;
            }
            total += deleted;
        }
    }

    private int archiveAlerts(String tenantId, Instant cutoff, Instant now) {
        int total = 0;
        while (true) {
            List<Alert> batch = alertRepository.findSettledOlderThan(tenantId, cutoff, properties.getBatchSize());
            if (batch.isEmpty()) {
                return total;
            }
            String location = write(() -> coldStorageWriter.writeAlerts(tenantId, batch));
            policyRepository.insertArchiveBatch(tenantId, ArchiveCategory.ALERTS, location, batch.size(), cutoff, now);
            int deleted = alertRepository.deleteByIds(batch.stream().map(Alert::id).toList());
            if (deleted == 0) {
                return total;
            }
            total += deleted;
        }
    }

    private String write(ArchiveWrite write) {
        try {
            return write.run();
        } catch (IOException e) {
            throw new UncheckedIOException("Cold storage write failed", e);
        }
    }

    private void scheduledSweep() {
        try {
            RetentionRunSummary summary = sweepAll();
            if (!summary.failedTenants().isEmpty()) {
                log.warn("Retention sweep finished with failed tenants: {}", summary.failedTenants());
            }
        } catch (Exception e) {
            log.error("Retention sweep aborted", e);
        }
    }

    @FunctionalInterface
    private interface ArchiveWrite {
        String run() throws IOException;
    }
}
