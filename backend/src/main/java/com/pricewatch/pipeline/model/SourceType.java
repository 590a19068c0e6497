package com.pricewatch.pipeline.model;

/**
 * Discriminator stored on a job that selects the fetch adapter used to collect observations.
 */
public enum SourceType {
    /** One competitor product page per entity, parsed from JSON-LD offers or CSS selectors. */
    HTML_PRICE_PAGE,
    /** A JSON feed that answers many SKUs per call. */
    JSON_PRICE_FEED
}
