package com.pricewatch.pipeline;

import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.JobStatus;
import com.pricewatch.pipeline.model.SourceType;

import java.time.Instant;
import java.util.Map;

public final class TestJobs {
    private TestJobs() {
    }

    public static Job job(long id, String tenantId, SourceType sourceType, Map<String, String> config, int ratePerMin) {
        Instant now = Instant.now();
        return new Job(
            id,
            tenantId,
            "job-" + id,
            "target-" + id,
            sourceType,
            config,
            ratePerMin,
            100,
            JobStatus.ACTIVE,
            60,
            15,
            null,
            now,
            null,
            null,
            0,
            null,
            null,
            now,
            now
        );
    }
}
