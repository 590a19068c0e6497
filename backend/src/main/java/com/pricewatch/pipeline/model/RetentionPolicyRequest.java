package com.pricewatch.pipeline.model;

public record RetentionPolicyRequest(
    Integer retentionDaysSnapshots,
    Integer retentionDaysAlerts,
    Integer retentionDaysJobs,
    ArchivalStrategy archivalStrategy
) {
}
