package com.pricewatch.pipeline.service;

import com.pricewatch.pipeline.model.JobExecutionResult;
import com.pricewatch.pipeline.model.JobRunStatus;
import com.pricewatch.pipeline.model.SourceType;
import com.pricewatch.pipeline.model.TriggerSource;
import com.pricewatch.pipeline.persistence.JobJdbcRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

// Not transactional: each racing thread commits on its own connection.
@SpringBootTest
@ActiveProfiles("test")
class JobRunClaimConcurrencyTest {
    private static final int CALLERS = 8;

    @Autowired
    private JobRunLifecycleService lifecycleService;

    @Autowired
    private JobJdbcRepository jobRepository;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(CALLERS);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void racingCallersOpenExactlyOneRun() throws Exception {
        long jobId = jobRepository.insertJob(
            "race-" + UUID.randomUUID().toString().substring(0, 8),
            "contended",
            "empty-target",
            SourceType.HTML_PRICE_PAGE,
            Map.of(),
            60,
            100,
            60,
            15,
            Instant.now().plusSeconds(3600)
        );
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<Long>>> attempts = new ArrayList<>();
        for (int i = 0; i < CALLERS; i++) {
            attempts.add(executor.submit(() -> {
                start.await();
                return lifecycleService.begin(jobId, TriggerSource.MANUAL, false);
            }));
        }

        start.countDown();
        List<Long> runIds = new ArrayList<>();
        for (Future<Optional<Long>> attempt : attempts) {
            attempt.get(30, TimeUnit.SECONDS).ifPresent(runIds::add);
        }

        assertThat(runIds).hasSize(1);
        assertThat(jobRepository.findRunsForJob(jobId, 50)).hasSize(1);
        assertThat(jobRepository.findJob(jobId).runningRunId()).isEqualTo(runIds.get(0));

        JobExecutionResult done = new JobExecutionResult(runIds.get(0), JobRunStatus.COMPLETED, 0, 0, 0, List.of(), null);
        lifecycleService.completeRun(runIds.get(0), done);
        lifecycleService.finish(jobRepository.findJob(jobId), runIds.get(0), done);
        assertThat(jobRepository.findJob(jobId).runningSince()).isNull();
    }
}
