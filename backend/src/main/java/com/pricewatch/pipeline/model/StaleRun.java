package com.pricewatch.pipeline.model;

import java.time.Instant;

public record StaleRun(long jobRunId, long jobId, Instant startedAt) {
}
