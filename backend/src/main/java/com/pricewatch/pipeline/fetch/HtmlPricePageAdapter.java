package com.pricewatch.pipeline.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
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
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a competitor product page per entity. Prices come from schema.org {@code Offer} JSON-LD when the page
 * has it, otherwise from the CSS selectors in the job's source config ({@code price_selector},
 * {@code stock_selector}, {@code currency}).
 */
@Component
public class HtmlPricePageAdapter implements FetchAdapter {
    private static final Logger log = LoggerFactory.getLogger(HtmlPricePageAdapter.class);
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml";

    private final PoliteFetchClient httpClient;
    private final ObjectMapper objectMapper;

    public HtmlPricePageAdapter(PoliteFetchClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceType sourceType() {
        return SourceType.HTML_PRICE_PAGE;
    }

    @Override
    public FetchResult fetch(Job job, List<TrackedEntity> entities) throws FetchAdapterException {
        List<Observation> observations = new ArrayList<>();
        Map<String, String> errors = new LinkedHashMap<>();
        for (TrackedEntity entity : entities) {
            String url = resolveUrl(job, entity);
            if (url == null) {
                errors.put(entity.entityRef(), "no_source_url");
                continue;
            }
            HttpFetchResult response = httpClient.get(SourceRequest.forJob(job, url, ACCEPT_HTML));
            if (!response.isSuccessful()) {
                if (entities.size() == 1) {
                    throw new FetchAdapterException(
                        "Fetching " + url + " failed: " + response.describeFailure(),
                        response.isTransientFailure()
                    );
                }
                errors.put(entity.entityRef(), response.describeFailure());
                continue;
            }
            Observation observation = parse(job, entity, response);
            if (observation == null) {
                errors.put(entity.entityRef(), "no_price_found");
            } else {
                observations.add(observation);
            }
        }
        return new FetchResult(observations, errors);
    }

    Observation parse(Job job, TrackedEntity entity, HttpFetchResult response) {
        if (response.body() == null || response.body().isBlank()) {
            return null;
        }
        Document document = Jsoup.parse(response.body(), response.requestedUrl());
        Instant observedAt = (response.fetchedAt() == null ? Instant.now() : response.fetchedAt())
            .truncatedTo(ChronoUnit.MILLIS);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("url", response.finalUri() == null ? response.requestedUrl() : response.finalUri().toString());
        metadata.put("http_status", response.statusCode());

        JsonNode offer = findOffer(document);
        if (offer != null) {
            BigDecimal price = parsePrice(text(offer, "price"));
            if (price != null) {
                metadata.put("extraction", "json_ld");
                return new Observation(
                    entity.entityRef(),
                    price,
                    upper(firstNonBlank(text(offer, "priceCurrency"), job.sourceSetting("currency"))),
                    availability(text(offer, "availability")),
                    observedAt,
                    metadata
                );
            }
        }

        String priceSelector = job.sourceSetting("price_selector");
        if (priceSelector == null) {
            return null;
        }
        Element priceElement = document.selectFirst(priceSelector);
        BigDecimal price = priceElement == null ? null : parsePrice(firstNonBlank(priceElement.attr("content"), priceElement.text()));
        if (price == null) {
            return null;
        }
        Boolean inStock = null;
        String stockSelector = job.sourceSetting("stock_selector");
        if (stockSelector != null) {
            Element stockElement = document.selectFirst(stockSelector);
            inStock = stockElement == null ? Boolean.FALSE : availability(stockElement.text());
        }
        metadata.put("extraction", "selector");
        return new Observation(entity.entityRef(), price, upper(job.sourceSetting("currency")), inStock, observedAt, metadata);
    }

    private String resolveUrl(Job job, TrackedEntity entity) {
        if (entity.sourceUrl() != null && !entity.sourceUrl().isBlank()) {
            return entity.sourceUrl().trim();
        }
        String template = job.sourceSetting("url_template");
        if (template == null || entity.sku() == null) {
            return null;
        }
        return template.replace("{sku}", entity.sku().trim());
    }

    private JsonNode findOffer(Document document) {
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                JsonNode offer = collectOffer(objectMapper.readTree(payload));
                if (offer != null) {
                    return offer;
                }
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block: {}", e.getOriginalMessage());
            }
        }
        return null;
    }

    private JsonNode collectOffer(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                JsonNode found = collectOffer(child);
                if (found != null) {
                    return found;
                }
            }
            return null;
        }
        if (!node.isObject()) {
            return null;
        }
        if (hasType(node, "Offer") && node.hasNonNull("price")) {
            return node;
        }
        JsonNode offers = node.get("offers");
        if (offers != null) {
            JsonNode found = collectOffer(offers);
            if (found != null) {
                return found;
            }
        }
        return collectOffer(node.get("@graph"));
    }

    private boolean hasType(JsonNode node, String type) {
        JsonNode typeNode = node.get("@type");
        if (typeNode == null) {
            return false;
        }
        if (typeNode.isTextual()) {
            return type.equalsIgnoreCase(typeNode.asText());
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && type.equalsIgnoreCase(child.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    static BigDecimal parsePrice(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String cleaned = raw.replaceAll("[^0-9.,]", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        int lastComma = cleaned.lastIndexOf(',');
        int lastDot = cleaned.lastIndexOf('.');
        if (lastComma > lastDot) {
            // Decimal comma: "1.299,00"
            cleaned = cleaned.replace(".", "").replace(',', '.');
        } else {
            cleaned = cleaned.replace(",", "");
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Boolean availability(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.toLowerCase(Locale.ROOT).replace(" ", "");
        if (value.contains("outofstock") || value.contains("soldout") || value.contains("discontinued")
            || value.contains("unavailable")) {
            return Boolean.FALSE;
        }
        if (value.contains("instock") || value.contains("limitedavailability") || value.contains("available")) {
            return Boolean.TRUE;
        }
        return null;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }

    private String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        return second == null || second.isBlank() ? null : second.trim();
    }

    private String upper(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }
}
