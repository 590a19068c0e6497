package com.pricewatch.pipeline.model;

import java.util.Locale;

public enum AlertDeliveryStatus {
    PENDING,
    DELIVERED,
    DEAD_LETTERED,
    NO_SUBSCRIBERS;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AlertDeliveryStatus fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
