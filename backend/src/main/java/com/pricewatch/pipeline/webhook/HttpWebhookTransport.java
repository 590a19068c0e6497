package com.pricewatch.pipeline.webhook;

import com.pricewatch.config.PipelineProperties;
import com.pricewatch.pipeline.model.DeliveryAttemptResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Single-shot POST. Retrying is the dispatcher's job, so this never retries and never follows redirects.
 */
@Component
public class HttpWebhookTransport implements WebhookTransport {
    private final HttpClient client;
    private final Duration timeout;
    private final String userAgent;

    public HttpWebhookTransport(PipelineProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.timeout = Duration.ofSeconds(properties.getWebhooks().getRequestTimeoutSeconds());
        this.userAgent = properties.getFetch().getUserAgent();
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(timeout)
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public DeliveryAttemptResult post(String url, byte[] body, Map<String, String> headers) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return new DeliveryAttemptResult(0, "invalid_url", e.getMessage());
        }
        if (uri.getHost() == null) {
            return new DeliveryAttemptResult(0, "invalid_url", "URL missing host");
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .header("User-Agent", userAgent)
            .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        headers.forEach(builder::header);
        try {
            HttpResponse<Void> response = client.send(builder.build(), HttpResponse.BodyHandlers.discarding());
            return new DeliveryAttemptResult(response.statusCode(), null, null);
        } catch (HttpTimeoutException e) {
            return new DeliveryAttemptResult(0, "timeout", e.getMessage());
        } catch (IOException e) {
            return new DeliveryAttemptResult(0, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new DeliveryAttemptResult(0, "interrupted", e.getMessage());
        }
    }
}
