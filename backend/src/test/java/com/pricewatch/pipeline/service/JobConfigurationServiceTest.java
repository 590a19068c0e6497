package com.pricewatch.pipeline.service;

import com.pricewatch.pipeline.model.ArchivalStrategy;
import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.JobDefinitionRequest;
import com.pricewatch.pipeline.model.JobStatus;
import com.pricewatch.pipeline.model.RetentionPolicy;
import com.pricewatch.pipeline.model.RetentionPolicyRequest;
import com.pricewatch.pipeline.model.SourceType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JobConfigurationServiceTest {

    @Autowired
    private JobConfigurationService service;

    @Test
    void createdJobIsActiveDueAndUsesDefaults() {
        String tenant = uniqueTenant();
        Instant before = Instant.now().minusSeconds(1);

        Job job = service.createJob(request(tenant, 30, null));

        assertThat(job.tenantId()).isEqualTo(tenant);
        assertThat(job.status()).isEqualTo(JobStatus.ACTIVE);
        assertThat(job.priority()).isEqualTo(100);
        assertThat(job.successIntervalMinutes()).isEqualTo(60);
        assertThat(job.retryIntervalMinutes()).isEqualTo(15);
        assertThat(job.nextRunAt()).isAfter(before);
        assertThat(job.sourceConfig()).containsEntry("price_selector", ".price");
        assertThat(service.listJobs(tenant)).extracting(Job::id).containsExactly(job.id());
    }

    @Test
    void invalidDefinitionsAreRejected() {
        String tenant = uniqueTenant();
        assertThatThrownBy(() -> service.createJob(request(tenant, 0, null)))
            .isInstanceOf(InvalidJobConfigurationException.class)
            .hasMessageContaining("rateLimitPerMin");
        assertThatThrownBy(() -> service.createJob(request(" ", 30, null)))
            .isInstanceOf(InvalidJobConfigurationException.class)
            .hasMessageContaining("tenantId");
        assertThatThrownBy(() -> service.createJob(new JobDefinitionRequest(
            tenant, "no source", "target", null, Map.of(), 30, null, null, null
        ))).isInstanceOf(InvalidJobConfigurationException.class);
        assertThatThrownBy(() -> service.createJob(new JobDefinitionRequest(
            tenant, "bad interval", "target", SourceType.JSON_PRICE_FEED, Map.of(), 30, null, 0, null
        ))).isInstanceOf(InvalidJobConfigurationException.class);
    }

    @Test
    void pauseResumeAndArchiveFollowTheLifecycle() {
        Job job = service.createJob(request(uniqueTenant(), 30, 5));

        assertThat(service.pauseJob(job.id()).status()).isEqualTo(JobStatus.PAUSED);
        assertThat(service.resumeJob(job.id()).status()).isEqualTo(JobStatus.ACTIVE);
        assertThat(service.archiveJob(job.id()).status()).isEqualTo(JobStatus.ARCHIVED);

        assertThatThrownBy(() -> service.resumeJob(job.id())).isInstanceOf(InvalidJobConfigurationException.class);
        assertThatThrownBy(() -> service.updateJob(job.id(), request(job.tenantId(), 60, 5)))
            .isInstanceOf(InvalidJobConfigurationException.class);
    }

    @Test
    void updateChangesDefinitionButNotTenant() {
        Job job = service.createJob(request(uniqueTenant(), 30, 5));

        Job updated = service.updateJob(job.id(), new JobDefinitionRequest(
            "someone-else", "renamed", "other-target", SourceType.JSON_PRICE_FEED, Map.of("feed_url", "http://feed"),
            120, 1, 30, 5
        ));

        assertThat(updated.tenantId()).isEqualTo(job.tenantId());
        assertThat(updated.name()).isEqualTo("renamed");
        assertThat(updated.sourceType()).isEqualTo(SourceType.JSON_PRICE_FEED);
        assertThat(updated.rateLimitPerMin()).isEqualTo(120);
        assertThat(updated.priority()).isEqualTo(1);
        assertThat(updated.successIntervalMinutes()).isEqualTo(30);
    }

    @Test
    void unknownJobIsNotFound() {
        assertThatThrownBy(() -> service.getJob(Long.MAX_VALUE)).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> service.listRuns(Long.MAX_VALUE, 10)).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void retentionPolicyIsValidatedAndUpserted() {
        String tenant = uniqueTenant();
        assertThatThrownBy(() -> service.upsertRetentionPolicy(tenant, new RetentionPolicyRequest(0, 30, 30, ArchivalStrategy.DELETE)))
            .isInstanceOf(InvalidJobConfigurationException.class);
        assertThatThrownBy(() -> service.upsertRetentionPolicy(tenant, new RetentionPolicyRequest(30, 30, 30, null)))
            .isInstanceOf(InvalidJobConfigurationException.class);

        service.upsertRetentionPolicy(tenant, new RetentionPolicyRequest(90, 30, 14, ArchivalStrategy.DELETE));
        RetentionPolicy policy = service.upsertRetentionPolicy(
            tenant,
            new RetentionPolicyRequest(180, 60, 14, ArchivalStrategy.ARCHIVE)
        );

        assertThat(policy.retentionDaysSnapshots()).isEqualTo(180);
        assertThat(policy.archivalStrategy()).isEqualTo(ArchivalStrategy.ARCHIVE);
    }

    private static JobDefinitionRequest request(String tenant, int rate, Integer priority) {
        return new JobDefinitionRequest(
            tenant,
            "competitor pages",
            "competitor-a",
            SourceType.HTML_PRICE_PAGE,
            Map.of("price_selector", ".price"),
            rate,
            priority,
            null,
            null
        );
    }

    private static String uniqueTenant() {
        return "cfg-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
