package com.pricewatch.pipeline.webhook;

import com.pricewatch.pipeline.model.DeliveryAttemptResult;

import java.util.Map;

public interface WebhookTransport {

    DeliveryAttemptResult post(String url, byte[] body, Map<String, String> headers);
}
