package com.pricewatch.pipeline.catalog;

public class EntityCatalogException extends RuntimeException {
    public EntityCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
