package com.pricewatch.pipeline.model;

import java.util.List;

public record JobExecutionResult(
    long jobRunId,
    JobRunStatus status,
    int entitiesAttempted,
    int entitiesFailed,
    int snapshotsWritten,
    List<Snapshot> newSnapshots,
    JobRunError error
) {
    public boolean succeeded() {
        return status == JobRunStatus.COMPLETED;
    }

    public boolean transientFailure() {
        return error != null && error.transientFailure();
    }
}
