package com.pricewatch.pipeline.model;

import java.util.Locale;

public enum ArchivalStrategy {
    DELETE,
    ARCHIVE;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ArchivalStrategy fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
