package com.pricewatch.pipeline.model;

import java.time.Instant;
import java.util.List;

public record SchedulerTickSummary(
    Instant tickAt,
    int staleRunsFailed,
    int dueJobsConsidered,
    List<Long> dispatchedJobIds,
    List<Long> skippedJobIds
) {
}
