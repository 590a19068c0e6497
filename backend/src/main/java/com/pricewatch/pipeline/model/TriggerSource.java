package com.pricewatch.pipeline.model;

import java.util.Locale;

public enum TriggerSource {
    SYSTEM,
    MANUAL;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TriggerSource fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
