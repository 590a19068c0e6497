package com.pricewatch.pipeline.service;

import com.pricewatch.pipeline.persistence.JobJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Closes runs left {@code running} by a previous process once the application is up.
 */
@Component
public class StaleRunRecoveryRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StaleRunRecoveryRunner.class);

    private final JobJdbcRepository jobRepository;
    private final JobRunLifecycleService lifecycleService;

    public StaleRunRecoveryRunner(JobJdbcRepository jobRepository, JobRunLifecycleService lifecycleService) {
        this.jobRepository = jobRepository;
        this.lifecycleService = lifecycleService;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = jobRepository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping stale run recovery because database is unreachable");
            return;
        }
        int failed = lifecycleService.failStaleRuns(Instant.now());
        if (failed > 0) {
            log.info("Failed {} stale job runs on startup", failed);
        }
    }
}
