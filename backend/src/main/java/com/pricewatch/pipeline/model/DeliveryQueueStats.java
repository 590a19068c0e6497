package com.pricewatch.pipeline.model;

import java.util.Map;

public record DeliveryQueueStats(Map<String, Long> countsByStatus, long dueCount) {
}
