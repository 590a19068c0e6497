package com.pricewatch.pipeline.http;

import com.pricewatch.pipeline.model.Job;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One call to a price source. Every {@code header.<Name>} entry of the job's source config is sent as header
 * {@code <Name>}, so per-source credentials and API keys stay in job configuration.
 */
public record SourceRequest(String url, String accept, Map<String, String> headers) {
    static final String HEADER_PREFIX = "header.";

    public SourceRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static SourceRequest forJob(Job job, String url, String accept) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (job.sourceConfig() != null) {
            job.sourceConfig().forEach((key, value) -> {
                if (key == null || !key.startsWith(HEADER_PREFIX) || value == null || value.isBlank()) {
                    return;
                }
                String name = key.substring(HEADER_PREFIX.length()).trim();
                if (!name.isEmpty()) {
                    headers.put(name, value.trim());
                }
            });
        }
        return new SourceRequest(url, accept, headers);
    }
}
