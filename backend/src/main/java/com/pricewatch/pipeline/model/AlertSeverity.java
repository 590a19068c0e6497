package com.pricewatch.pipeline.model;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
