package com.pricewatch.pipeline.model;

import java.util.Locale;

public enum JobRunStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    ARCHIVED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static JobRunStatus fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
