package com.pricewatch.pipeline.fetch;

public class FetchAdapterException extends Exception {
    private final boolean transientFailure;

    public FetchAdapterException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public FetchAdapterException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
