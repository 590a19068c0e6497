package com.pricewatch.pipeline.model;

public enum AlertRuleType {
    PRICE_DROP_PERCENT("price.drop"),
    PRICE_INCREASE_PERCENT("price.increase"),
    OUT_OF_STOCK("stock.out"),
    BACK_IN_STOCK("stock.back");

    private final String eventType;

    AlertRuleType(String eventType) {
        this.eventType = eventType;
    }

    public String eventType() {
        return eventType;
    }
}
