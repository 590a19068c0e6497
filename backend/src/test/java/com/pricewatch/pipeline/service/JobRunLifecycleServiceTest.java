package com.pricewatch.pipeline.service;

import com.pricewatch.pipeline.TestJobs;
import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.JobExecutionResult;
import com.pricewatch.pipeline.model.JobRun;
import com.pricewatch.pipeline.model.JobRunError;
import com.pricewatch.pipeline.model.JobRunErrorType;
import com.pricewatch.pipeline.model.JobRunStatus;
import com.pricewatch.pipeline.model.SourceType;
import com.pricewatch.pipeline.model.TriggerSource;
import com.pricewatch.pipeline.persistence.JobJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JobRunLifecycleServiceTest {

    @Autowired
    private JobRunLifecycleService lifecycleService;

    @Autowired
    private JobJdbcRepository jobRepository;

    @Test
    void transientFailureComesBackAtTheRetryInterval() {
        Job job = TestJobs.job(1L, "t1", SourceType.HTML_PRICE_PAGE, Map.of(), 60);
        Instant now = Instant.parse("2026-05-01T10:00:00Z");

        Instant retry = lifecycleService.nextRunAt(job, result(JobRunStatus.FAILED, JobRunError.of(
            JobRunErrorType.ADAPTER_ERROR, true, "http_503"
        )), now);
        Instant terminal = lifecycleService.nextRunAt(job, result(JobRunStatus.FAILED, JobRunError.of(
            JobRunErrorType.CONFIGURATION, false, "no adapter"
        )), now);
        Instant success = lifecycleService.nextRunAt(job, result(JobRunStatus.COMPLETED, null), now);

        assertThat(retry).isEqualTo(now.plus(Duration.ofMinutes(15)));
        assertThat(terminal).isEqualTo(now.plus(Duration.ofMinutes(60)));
        assertThat(success).isEqualTo(now.plus(Duration.ofMinutes(60)));
    }

    @Test
    void partialFailureStillCountsAsSuccessForScheduling() {
        Job job = TestJobs.job(1L, "t1", SourceType.HTML_PRICE_PAGE, Map.of(), 60);
        Instant now = Instant.parse("2026-05-01T10:00:00Z");
        JobRunError partial = JobRunError.of(JobRunErrorType.PARTIAL_FAILURE, true, "1 of 3 entities failed");

        assertThat(lifecycleService.nextRunAt(job, result(JobRunStatus.COMPLETED, partial), now))
            .isEqualTo(now.plus(Duration.ofMinutes(60)));
    }

    @Test
    void secondBeginFailsWhileARunIsInProgress() {
        long jobId = newJob();

        Optional<Long> first = lifecycleService.begin(jobId, TriggerSource.SYSTEM, true);
        Optional<Long> second = lifecycleService.begin(jobId, TriggerSource.MANUAL, false);

        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        Job claimed = jobRepository.findJob(jobId);
        assertThat(claimed.runningRunId()).isEqualTo(first.get());
        assertThat(jobRepository.findRun(first.get()).status()).isEqualTo(JobRunStatus.RUNNING);
    }

    @Test
    void finishingReleasesTheClaimAndReschedules() {
        long jobId = newJob();
        long runId = lifecycleService.begin(jobId, TriggerSource.SYSTEM, true).orElseThrow();
        JobExecutionResult failed = new JobExecutionResult(
            runId,
            JobRunStatus.FAILED,
            2,
            2,
            0,
            List.of(),
            JobRunError.of(JobRunErrorType.ADAPTER_ERROR, true, "http_503")
        );

        lifecycleService.completeRun(runId, failed);
        lifecycleService.finish(jobRepository.findJob(jobId), runId, failed);

        Job job = jobRepository.findJob(jobId);
        assertThat(job.runningSince()).isNull();
        assertThat(job.runningRunId()).isNull();
        assertThat(job.lastStatus()).isEqualTo(JobRunStatus.FAILED);
        assertThat(job.lastError()).startsWith("ADAPTER_ERROR");
        assertThat(job.consecutiveFailures()).isEqualTo(1);
        assertThat(job.nextRunAt()).isAfter(Instant.now().plus(Duration.ofMinutes(14)));
        assertThat(job.nextRunAt()).isBefore(Instant.now().plus(Duration.ofMinutes(16)));

        JobRun run = jobRepository.findRun(runId);
        assertThat(run.status()).isEqualTo(JobRunStatus.FAILED);
        assertThat(run.completedAt()).isNotNull();
        assertThat(run.errorDetails()).contains("ADAPTER_ERROR").contains("http_503");
        assertThat(lifecycleService.begin(jobId, TriggerSource.SYSTEM, true)).isPresent();
    }

    @Test
    void staleRunsAreFailedAndTheirClaimsReleased() {
        long jobId = newJob();
        Instant longAgo = Instant.now().minus(Duration.ofHours(2));
        jobRepository.claimJob(jobId, "crashed-worker", longAgo, longAgo.minus(Duration.ofMinutes(30)), true);
        long runId = jobRepository.insertRun(jobId, TriggerSource.SYSTEM, longAgo);
        jobRepository.attachRunToClaim(jobId, runId, "crashed-worker");

        int failed = lifecycleService.failStaleRuns(Instant.now());

        assertThat(failed).isGreaterThanOrEqualTo(1);
        JobRun run = jobRepository.findRun(runId);
        assertThat(run.status()).isEqualTo(JobRunStatus.FAILED);
        assertThat(run.errorDetails()).contains("STALE_RUN");
        Job job = jobRepository.findJob(jobId);
        assertThat(job.runningSince()).isNull();
        assertThat(job.lastStatus()).isEqualTo(JobRunStatus.FAILED);
        assertThat(job.nextRunAt()).isAfter(Instant.now());
    }

    @Test
    void orphanedRunIsFailedWhenTheClaimIsTakenOver() {
        long jobId = newJob();
        Instant longAgo = Instant.now().minus(Duration.ofHours(2));
        jobRepository.claimJob(jobId, "crashed-worker", longAgo, longAgo.minus(Duration.ofMinutes(30)), true);
        long orphan = jobRepository.insertRun(jobId, TriggerSource.SYSTEM, longAgo);
        jobRepository.attachRunToClaim(jobId, orphan, "crashed-worker");

        long fresh = lifecycleService.begin(jobId, TriggerSource.SYSTEM, true).orElseThrow();

        assertThat(jobRepository.findRun(orphan).status()).isEqualTo(JobRunStatus.FAILED);
        assertThat(jobRepository.findRun(fresh).status()).isEqualTo(JobRunStatus.RUNNING);
        assertThat(jobRepository.findRunningRunsForJob(jobId)).extracting(JobRun::id).containsExactly(fresh);
    }

    private long newJob() {
        return jobRepository.insertJob(
            "life-" + UUID.randomUUID().toString().substring(0, 8),
            "lifecycle",
            "target",
            SourceType.HTML_PRICE_PAGE,
            Map.of(),
            60,
            100,
            60,
            15,
            Instant.now().minusSeconds(5)
        );
    }

    private static JobExecutionResult result(JobRunStatus status, JobRunError error) {
        return new JobExecutionResult(1L, status, 1, error == null ? 0 : 1, 0, List.of(), error);
    }
}
