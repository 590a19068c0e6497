package com.pricewatch.pipeline.model;

public enum JobRunErrorType {
    ADAPTER_ERROR,
    PARTIAL_FAILURE,
    TIMEOUT,
    CONFIGURATION,
    CATALOG,
    STALE_RUN,
    INTERNAL
}
