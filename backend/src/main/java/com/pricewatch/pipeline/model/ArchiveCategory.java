package com.pricewatch.pipeline.model;

import java.util.Locale;

public enum ArchiveCategory {
    SNAPSHOTS,
    ALERTS;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
