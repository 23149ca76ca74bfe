package com.delta.digest.aggregate.http;

import com.delta.digest.aggregate.model.HttpFetchResult;
import com.delta.digest.config.DigestProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        DigestProperties properties = new DigestProperties();
        properties.setGlobalConcurrency(1);
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setUserAgent("digest-test/1.0");
        executor = Executors.newFixedThreadPool(1);
        client = new PoliteHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void returnsBodyStatusAndContentType() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json; charset=utf-8")
            .setBody("{\"ok\":true}"));

        HttpFetchResult result = client.get(server.url("/api").toString(), "application/json");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("{\"ok\":true}");
        assertThat(result.mediaType()).isEqualTo("application/json");
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getHeader("User-Agent")).isEqualTo("digest-test/1.0");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
    }

    @Test
    void doesNotRetryServerErrors() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("late"));

        HttpFetchResult result = client.get(server.url("/flaky").toString(), "text/plain");

        assertThat(result.statusCode()).isEqualTo(503);
        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.errorKey()).isEqualTo("http_503");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void reportsBodyTooLargeAboveTheCallLimit() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("a".repeat(5_000)));

        HttpFetchResult result = client.get(server.url("/big").toString(), "*/*", 1_024);

        assertThat(result.errorCode()).isEqualTo("body_too_large");
        assertThat(result.body()).isNull();
        assertThat(result.isSuccessful()).isFalse();
    }

    @Test
    void rejectsNonHttpUrlsWithoutSending() {
        assertThat(client.get("ftp://example.com/file", null).errorCode()).isEqualTo("invalid_url");
        assertThat(client.get("not a url", null).errorCode()).isEqualTo("invalid_url");
        assertThat(client.get(null, null).errorCode()).isEqualTo("invalid_url");
        assertThat(server.getRequestCount()).isZero();
    }
}
