package com.pricewatch.pipeline.http;

/**
 * How a source call ended, as far as retrying it is concerned.
 */
public enum FailureClass {
    NONE,
    TRANSIENT,
    TERMINAL
}
