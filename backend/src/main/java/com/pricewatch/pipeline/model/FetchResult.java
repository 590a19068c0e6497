package com.pricewatch.pipeline.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one adapter call. A non-empty {@code entityErrors} map is a partial failure.
 */
public record FetchResult(List<Observation> observations, Map<String, String> entityErrors) {

    public static FetchResult of(List<Observation> observations) {
        return new FetchResult(observations, Map.of());
    }

    public boolean isPartial() {
        return entityErrors != null && !entityErrors.isEmpty();
    }
}
