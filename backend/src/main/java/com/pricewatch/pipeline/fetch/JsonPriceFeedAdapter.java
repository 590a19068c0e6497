package com.pricewatch.pipeline.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricewatch.pipeline.http.HttpFetchResult;
import com.pricewatch.pipeline.http.PoliteFetchClient;
import com.pricewatch.pipeline.http.SourceRequest;
import com.pricewatch.pipeline.model.FetchResult;
import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.Observation;
import com.pricewatch.pipeline.model.SourceType;
import com.pricewatch.pipeline.model.TrackedEntity;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Queries a JSON price feed for several SKUs per call. The feed is addressed by the job's {@code feed_url}
 * setting and answers
 * <pre>
 * {"observed_at": "...", "items": [{"sku": "...", "price": 12.5, "currency": "EUR", "in_stock": true}]}
 * </pre>
 * Items may carry their own {@code observed_at} or an {@code error} string.
 */
@Component
public class JsonPriceFeedAdapter implements FetchAdapter {
    static final int DEFAULT_BATCH_SIZE = 50;
    private static final String ACCEPT_JSON = "application/json";
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final PoliteFetchClient httpClient;
    private final ObjectMapper objectMapper;

    public JsonPriceFeedAdapter(PoliteFetchClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceType sourceType() {
        return SourceType.JSON_PRICE_FEED;
    }

    @Override
    public int batchSize(Job job) {
        String configured = job.sourceSetting("batch_size");
        if (configured == null) {
            return DEFAULT_BATCH_SIZE;
        }
        try {
            return Math.max(1, Integer.parseInt(configured));
        } catch (NumberFormatException e) {
            return DEFAULT_BATCH_SIZE;
        }
    }

    @Override
    public FetchResult fetch(Job job, List<TrackedEntity> entities) throws FetchAdapterException {
        String feedUrl = job.sourceSetting("feed_url");
        if (feedUrl == null) {
            throw new FetchAdapterException("Job " + job.id() + " has no feed_url configured", false);
        }
        Map<String, TrackedEntity> bySku = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        for (TrackedEntity entity : entities) {
            if (entity.sku() == null || entity.sku().isBlank()) {
                errors.put(entity.entityRef(), "no_sku");
            } else {
                bySku.put(entity.sku().trim(), entity);
            }
        }
        if (bySku.isEmpty()) {
            return new FetchResult(List.of(), errors);
        }

        String url = feedUrl + (feedUrl.contains("?") ? "&" : "?") + "skus="
            + bySku.keySet().stream()
                .map(sku -> URLEncoder.encode(sku, StandardCharsets.UTF_8))
                .collect(Collectors.joining(","));
        HttpFetchResult response = httpClient.get(SourceRequest.forJob(job, url, ACCEPT_JSON));
        if (!response.isSuccessful()) {
            throw new FetchAdapterException(
                "Price feed call failed: " + response.describeFailure(),
                response.isTransientFailure()
            );
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body() == null ? "" : response.body());
        } catch (JsonProcessingException e) {
            throw new FetchAdapterException("Price feed returned malformed JSON", false, e);
        }
        if (root == null || !root.path("items").isArray()) {
            throw new FetchAdapterException("Price feed response has no items array", false);
        }

        Instant feedObservedAt = parseInstant(root.path("observed_at").asText(null), response.fetchedAt());
        List<Observation> observations = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            String sku = item.path("sku").asText(null);
            TrackedEntity entity = sku == null ? null : bySku.remove(sku.trim());
            if (entity == null) {
                continue;
            }
            if (item.hasNonNull("error")) {
                errors.put(entity.entityRef(), item.get("error").asText());
                continue;
            }
            BigDecimal price = item.hasNonNull("price") ? item.get("price").decimalValue() : null;
            Boolean inStock = item.hasNonNull("in_stock") ? item.get("in_stock").asBoolean() : null;
            if (price == null && inStock == null) {
                errors.put(entity.entityRef(), "empty_item");
                continue;
            }
            observations.add(new Observation(
                entity.entityRef(),
                price,
                item.hasNonNull("currency") ? item.get("currency").asText() : job.sourceSetting("currency"),
                inStock,
                parseInstant(item.path("observed_at").asText(null), feedObservedAt),
                objectMapper.convertValue(item, OBJECT_MAP)
            ));
        }
        for (TrackedEntity missing : bySku.values()) {
            errors.put(missing.entityRef(), "missing_from_feed");
        }
        return new FetchResult(observations, errors);
    }

    private Instant parseInstant(String raw, Instant fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback == null ? Instant.now() : fallback;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            return fallback == null ? Instant.now() : fallback;
        }
    }
}
