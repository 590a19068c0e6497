package com.pricewatch.pipeline.model;

import java.time.Instant;

public record JobQueueStats(long dueCount, long runningCount, Instant nextDueAt) {
}
