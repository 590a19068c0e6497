package com.pricewatch.pipeline.webhook;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HmacSha256WebhookSignerTest {
    private final HmacSha256WebhookSigner signer = new HmacSha256WebhookSigner();

    @Test
    void matchesRfc4231Vector() {
        String signature = signer.sign("Jefe", "what do ya want for nothing?".getBytes(StandardCharsets.UTF_8));

        assertThat(signature)
            .isEqualTo("sha256=5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
        assertThat(signer.headerName()).isEqualTo("X-PriceWatch-Signature");
    }

    @Test
    void emptySecretIsRejected() {
        assertThatThrownBy(() -> signer.sign("", new byte[] {1}))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
