package com.pricewatch.pipeline.webhook;

import com.pricewatch.pipeline.util.HashUtils;
import org.springframework.stereotype.Component;

/**
 * {@code X-PriceWatch-Signature: sha256=<hex hmac of the raw body>}.
 */
@Component
public class HmacSha256WebhookSigner implements WebhookSigner {
    public static final String HEADER = "X-PriceWatch-Signature";

    @Override
    public String headerName() {
        return HEADER;
    }

    @Override
    public String sign(String secret, byte[] body) {
        return "sha256=" + HashUtils.hmacSha256Hex(secret, body);
    }
}
