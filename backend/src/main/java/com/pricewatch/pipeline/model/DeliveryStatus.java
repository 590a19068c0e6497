package com.pricewatch.pipeline.model;

import java.util.Locale;

public enum DeliveryStatus {
    PENDING,
    DELIVERING,
    RETRYING,
    DELIVERED,
    DEAD_LETTERED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isClaimable() {
        return this == PENDING || this == RETRYING;
    }

    public static DeliveryStatus fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
