package com.pricewatch.pipeline.http;

import com.pricewatch.config.PipelineProperties;
import com.pricewatch.pipeline.TestJobs;
import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.SourceType;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteFetchClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PipelineProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = new PipelineProperties();
        properties.getFetch().setGlobalConcurrency(1);
        properties.getFetch().setPerHostDelayMs(1);
        properties.getFetch().setRequestTimeoutSeconds(5);
        properties.getFetch().setRequestMaxRetries(2);
        properties.getFetch().setRequestRetryBaseDelayMs(1);
        properties.getFetch().setRequestRetryMaxDelayMs(5);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void retriesServerErrorsThenSucceeds() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "3"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));
        PoliteFetchClient client = new PoliteFetchClient(properties, executor);

        HttpFetchResult result = client.get(request("/page"));

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.failureClass()).isEqualTo(FailureClass.NONE);
        assertThat(result.body()).isEqualTo("ok");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void clientErrorsAreTerminalAndNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(404));
        PoliteFetchClient client = new PoliteFetchClient(properties, executor);

        HttpFetchResult result = client.get(request("/missing"));

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.failureClass()).isEqualTo(FailureClass.TERMINAL);
        assertThat(result.describeFailure()).isEqualTo("http_404");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void exhaustedRetriesReportTransientFailure() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(500));
        }
        PoliteFetchClient client = new PoliteFetchClient(properties, executor);

        HttpFetchResult result = client.get(request("/broken"));

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.isTransientFailure()).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void malformedOrSchemelessUrlsAreTerminal() {
        PoliteFetchClient client = new PoliteFetchClient(properties, executor);

        HttpFetchResult malformed = client.get(new SourceRequest("http://exa mple.com/x", "text/html", Map.of()));
        HttpFetchResult schemeless = client.get(new SourceRequest("shop.example.com/p/1", "text/html", Map.of()));

        assertThat(malformed.errorCode()).isEqualTo("invalid_url");
        assertThat(malformed.failureClass()).isEqualTo(FailureClass.TERMINAL);
        assertThat(schemeless.errorCode()).isEqualTo("invalid_url");
    }

    @Test
    void jobHeadersAndAdapterAcceptAreSent() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));
        Job job = TestJobs.job(7L, "t1", SourceType.JSON_PRICE_FEED, Map.of(
            "feed_url", server.url("/feed").toString(),
            "header.X-Api-Key", " k-123 ",
            "header.", "ignored",
            "currency", "EUR"
        ), 60);
        PoliteFetchClient client = new PoliteFetchClient(properties, executor);

        HttpFetchResult result = client.get(SourceRequest.forJob(job, server.url("/feed").toString(), "application/json"));

        assertThat(result.isSuccessful()).isTrue();
        RecordedRequest recorded = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(recorded).isNotNull();
        assertThat(recorded.getHeader("X-Api-Key")).isEqualTo("k-123");
        assertThat(recorded.getHeader("Accept")).isEqualTo("application/json");
        assertThat(recorded.getHeader("currency")).isNull();
    }

    @Test
    void restrictedSourceHeaderIsATerminalConfigurationFailure() {
        PoliteFetchClient client = new PoliteFetchClient(properties, executor);

        HttpFetchResult result = client.get(new SourceRequest(
            server.url("/page").toString(),
            "text/html",
            Map.of("Host", "other.example")
        ));

        assertThat(result.errorCode()).isEqualTo("invalid_header");
        assertThat(result.failureClass()).isEqualTo(FailureClass.TERMINAL);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void classifiesStatusCodesAndRetryAfterHints() {
        assertThat(PoliteFetchClient.classify(204)).isEqualTo(FailureClass.NONE);
        assertThat(PoliteFetchClient.classify(408)).isEqualTo(FailureClass.TRANSIENT);
        assertThat(PoliteFetchClient.classify(429)).isEqualTo(FailureClass.TRANSIENT);
        assertThat(PoliteFetchClient.classify(502)).isEqualTo(FailureClass.TRANSIENT);
        assertThat(PoliteFetchClient.classify(401)).isEqualTo(FailureClass.TERMINAL);
        assertThat(PoliteFetchClient.classify(410)).isEqualTo(FailureClass.TERMINAL);
        assertThat(PoliteFetchClient.parseRetryAfter("7")).isEqualTo(Duration.ofSeconds(7));
        assertThat(PoliteFetchClient.parseRetryAfter("Wed, 21 Oct 2026 07:28:00 GMT")).isNull();
    }

    @Test
    void retryAfterStretchesTheDelayUpToTheCap() {
        properties.getFetch().setRequestRetryBaseDelayMs(10);
        properties.getFetch().setRequestRetryMaxDelayMs(4000);
        PoliteFetchClient client = new PoliteFetchClient(properties, executor);

        assertThat(client.retryDelayMs(1, Duration.ofSeconds(2))).isBetween(1000L, 2000L);
        assertThat(client.retryDelayMs(1, Duration.ofSeconds(60))).isBetween(2000L, 4000L);
        assertThat(client.retryDelayMs(1, null)).isBetween(5L, 10L);
    }

    private SourceRequest request(String path) {
        return new SourceRequest(server.url(path).toString(), "text/html", Map.of());
    }
}
