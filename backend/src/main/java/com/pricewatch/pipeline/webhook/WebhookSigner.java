package com.pricewatch.pipeline.webhook;

/**
 * Signs the exact bytes posted to a subscriber with the subscription's secret.
 */
public interface WebhookSigner {

    String headerName();

    String sign(String secret, byte[] body);
}
