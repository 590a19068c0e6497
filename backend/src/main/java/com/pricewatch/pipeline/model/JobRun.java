package com.pricewatch.pipeline.model;

import java.time.Instant;

public record JobRun(
    long id,
    long jobId,
    TriggerSource triggerSource,
    JobRunStatus status,
    Instant startedAt,
    Instant completedAt,
    int entitiesAttempted,
    int entitiesFailed,
    int snapshotsWritten,
    String errorDetails
) {
}
