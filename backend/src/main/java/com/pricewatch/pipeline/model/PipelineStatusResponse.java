package com.pricewatch.pipeline.model;

import java.time.Instant;

public record PipelineStatusResponse(
    boolean schedulerRunning,
    int workerCount,
    int inFlightRuns,
    long dueJobs,
    long runningJobs,
    Instant nextDueAt,
    boolean dispatcherRunning,
    DeliveryQueueStats deliveries,
    boolean retentionScheduled
) {
}
