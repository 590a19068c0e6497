package com.pricewatch.pipeline.http;

import com.pricewatch.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Outbound GET client shared by the fetch adapters. Bounds concurrent source calls process wide and keeps a
 * minimum gap between calls to one host across all running jobs. Transient failures are retried with jittered
 * exponential delay, stretched to the source's {@code Retry-After} hint up to the configured maximum.
 */
@Service
public class PoliteFetchClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteFetchClient.class);
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
        "connection", "content-length", "date", "expect", "from", "host", "upgrade", "via", "warning"
    );

    private final PipelineProperties.Fetch properties;
    private final HttpClient client;
    private final Semaphore permits;
    private final Map<String, Long> nextSlotByHost = new ConcurrentHashMap<>();

    public PoliteFetchClient(PipelineProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties.getFetch();
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(this.properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.permits = new Semaphore(this.properties.getGlobalConcurrency());
    }

    public HttpFetchResult get(SourceRequest request) {
        int maxAttempts = 1 + properties.getRequestMaxRetries();
        HttpFetchResult result = send(request);
        for (int attempt = 1; attempt < maxAttempts && result.isTransientFailure(); attempt++) {
            if (!pause(retryDelayMs(attempt, result.retryAfter()))) {
                break;
            }
            log.debug("Retrying {} after {} (attempt {})", request.url(), result.describeFailure(), attempt + 1);
            result = send(request);
        }
        return result;
    }

    /**
     * Timeouts, throttling and server errors are worth another try; any other non-2xx answer is not.
     */
    static FailureClass classify(int statusCode) {
        if (statusCode >= 200 && statusCode < 300) {
            return FailureClass.NONE;
        }
        if (statusCode == 408 || statusCode == 425 || statusCode == 429 || statusCode >= 500) {
            return FailureClass.TRANSIENT;
        }
        return FailureClass.TERMINAL;
    }

    long retryDelayMs(int attempt, Duration retryAfter) {
        long baseMs = properties.getRequestRetryBaseDelayMs();
        long delay = baseMs <= 0 ? 0 : baseMs << Math.min(Math.max(0, attempt - 1), 16);
        if (retryAfter != null) {
            delay = Math.max(delay, retryAfter.toMillis());
        }
        int maxMs = properties.getRequestRetryMaxDelayMs();
        if (maxMs > 0) {
            delay = Math.min(delay, maxMs);
        }
        if (delay <= 1) {
            return delay;
        }
        return delay / 2 + ThreadLocalRandom.current().nextLong(delay / 2 + 1);
    }

    private HttpFetchResult send(SourceRequest source) {
        Instant startedAt = Instant.now();
        URI uri = parseUri(source.url());
        if (uri == null) {
            return failure(source, startedAt, "invalid_url", "not an absolute http(s) URL", FailureClass.TERMINAL);
        }
        HttpRequest request;
        try {
            request = buildRequest(uri, source);
        } catch (IllegalArgumentException e) {
            return failure(source, startedAt, "invalid_header", e.getMessage(), FailureClass.TERMINAL);
        }

        boolean acquired = false;
        try {
            permits.acquire();
            acquired = true;
            awaitHostSlot(uri.getHost().toLowerCase(Locale.ROOT));
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            Instant fetchedAt = Instant.now();
            return new HttpFetchResult(
                source.url(),
                response.uri(),
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                fetchedAt,
                Duration.between(startedAt, fetchedAt),
                null,
                null,
                classify(response.statusCode()),
                parseRetryAfter(response.headers().firstValue("Retry-After").orElse(null))
            );
        } catch (HttpTimeoutException e) {
            return failure(source, startedAt, "timeout", e.getMessage(), FailureClass.TRANSIENT);
        } catch (IOException e) {
            return failure(source, startedAt, "io_error", e.getMessage(), FailureClass.TRANSIENT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(source, startedAt, "interrupted", e.getMessage(), FailureClass.TRANSIENT);
        } finally {
            if (acquired) {
                permits.release();
            }
        }
    }

    private HttpRequest buildRequest(URI uri, SourceRequest source) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", source.accept() == null || source.accept().isBlank() ? "*/*" : source.accept())
            .GET();
        for (Map.Entry<String, String> header : source.headers().entrySet()) {
            if (RESTRICTED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("header " + header.getKey() + " cannot be set per source");
            }
            builder.setHeader(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private void awaitHostSlot(String host) throws InterruptedException {
        long spacingNanos = TimeUnit.MILLISECONDS.toNanos(properties.getPerHostDelayMs());
        long reservedUntil = nextSlotByHost.compute(host, (key, next) -> {
            long now = System.nanoTime();
            long slot = (next == null || next - now < 0) ? now : next;
            return slot + spacingNanos;
        });
        long waitNanos = reservedUntil - spacingNanos - System.nanoTime();
        if (waitNanos > 0) {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    private boolean pause(long delayMs) {
        if (Thread.currentThread().isInterrupted()) {
            return false;
        }
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            // HTTP-date form; the regular backoff applies.
            return null;
        }
    }

    private static URI parseUri(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
                return null;
            }
            return uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static HttpFetchResult failure(
        SourceRequest source,
        Instant startedAt,
        String code,
        String message,
        FailureClass failureClass
    ) {
        Instant now = Instant.now();
        return new HttpFetchResult(
            source.url(),
            null,
            0,
            null,
            null,
            now,
            Duration.between(startedAt, now),
            code,
            message,
            failureClass,
            null
        );
    }
}
