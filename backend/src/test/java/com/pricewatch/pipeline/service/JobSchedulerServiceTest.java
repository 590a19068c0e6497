package com.pricewatch.pipeline.service;

import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.JobExecutionResult;
import com.pricewatch.pipeline.model.JobRun;
import com.pricewatch.pipeline.model.JobRunStatus;
import com.pricewatch.pipeline.model.JobStatus;
import com.pricewatch.pipeline.model.SchedulerTickSummary;
import com.pricewatch.pipeline.model.SourceType;
import com.pricewatch.pipeline.model.TriggerSource;
import com.pricewatch.pipeline.persistence.JobJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

// Not transactional: worker threads must see the committed jobs.
@SpringBootTest
@ActiveProfiles("test")
class JobSchedulerServiceTest {

    @Autowired
    private JobSchedulerService scheduler;

    @Autowired
    private JobRunLifecycleService lifecycleService;

    @Autowired
    private JobJdbcRepository jobRepository;

    @Test
    void tickDispatchesDueJobsByPriorityAndReschedulesThem() throws Exception {
        String tenant = uniqueTenant();
        long second = newJob(tenant, -999, Instant.now().minusSeconds(60));
        long first = newJob(tenant, -1000, Instant.now().minusSeconds(1));
        long notYetDue = newJob(tenant, -1000, Instant.now().plusSeconds(3600));

        SchedulerTickSummary summary = scheduler.tick();

        assertThat(summary.dispatchedJobIds()).contains(first, second).doesNotContain(notYetDue);
        assertThat(summary.dispatchedJobIds().indexOf(first)).isLessThan(summary.dispatchedJobIds().indexOf(second));
        assertThat(scheduler.awaitIdle(Duration.ofSeconds(10))).isTrue();

        for (long jobId : List.of(first, second)) {
            List<JobRun> runs = jobRepository.findRunsForJob(jobId, 10);
            assertThat(runs).hasSize(1);
            assertThat(runs.get(0).triggerSource()).isEqualTo(TriggerSource.SYSTEM);
            // No tracked entities for the target, so the run fails terminally.
            assertThat(runs.get(0).status()).isEqualTo(JobRunStatus.FAILED);
            assertThat(runs.get(0).errorDetails()).contains("CONFIGURATION");
            Job job = jobRepository.findJob(jobId);
            assertThat(job.runningSince()).isNull();
            assertThat(job.nextRunAt()).isAfter(Instant.now().plus(Duration.ofMinutes(30)));
        }

        SchedulerTickSummary again = scheduler.tick();
        assertThat(again.dispatchedJobIds()).doesNotContain(first, second);
    }

    @Test
    void runningJobIsNeitherDispatchedNorTriggeredTwice() {
        long jobId = newJob(uniqueTenant(), -1000, Instant.now().minusSeconds(30));
        long runId = lifecycleService.begin(jobId, TriggerSource.SYSTEM, true).orElseThrow();
        try {
            SchedulerTickSummary summary = scheduler.tick();

            assertThat(summary.dispatchedJobIds()).doesNotContain(jobId);
            assertThatThrownBy(() -> scheduler.triggerManually(jobId)).isInstanceOf(ActiveJobRunException.class);
            assertThat(jobRepository.findRunsForJob(jobId, 10)).hasSize(1);
        } finally {
            JobExecutionResult done = new JobExecutionResult(runId, JobRunStatus.COMPLETED, 0, 0, 0, List.of(), null);
            lifecycleService.completeRun(runId, done);
            lifecycleService.finish(jobRepository.findJob(jobId), runId, done);
        }
    }

    @Test
    void pausedJobCanBeTriggeredManually() throws Exception {
        long jobId = newJob(uniqueTenant(), 100, Instant.now().plusSeconds(3600));
        jobRepository.updateJobStatus(jobId, JobStatus.PAUSED, null);

        JobRun run = scheduler.triggerManually(jobId);

        assertThat(run.jobId()).isEqualTo(jobId);
        assertThat(run.triggerSource()).isEqualTo(TriggerSource.MANUAL);
        assertThat(scheduler.awaitIdle(Duration.ofSeconds(10))).isTrue();
        assertThat(jobRepository.findRun(run.id()).status()).isEqualTo(JobRunStatus.FAILED);
        assertThat(jobRepository.findJob(jobId).status()).isEqualTo(JobStatus.PAUSED);
    }

    @Test
    void archivedOrMissingJobsCannotBeTriggered() {
        long jobId = newJob(uniqueTenant(), 100, Instant.now().plusSeconds(3600));
        jobRepository.updateJobStatus(jobId, JobStatus.ARCHIVED, null);

        assertThatThrownBy(() -> scheduler.triggerManually(jobId))
            .isInstanceOf(InvalidJobConfigurationException.class);
        assertThatThrownBy(() -> scheduler.triggerManually(Long.MAX_VALUE))
            .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void statusReportsSchedulerAndQueueState() {
        assertThat(scheduler.getStatus().schedulerRunning()).isFalse();
        assertThat(scheduler.getStatus().workerCount()).isEqualTo(4);
    }

    private long newJob(String tenant, int priority, Instant nextRunAt) {
        return jobRepository.insertJob(
            tenant,
            "scheduled",
            "empty-target",
            SourceType.HTML_PRICE_PAGE,
            Map.of(),
            60,
            priority,
            60,
            15,
            nextRunAt
        );
    }

    private static String uniqueTenant() {
        return "sched-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
