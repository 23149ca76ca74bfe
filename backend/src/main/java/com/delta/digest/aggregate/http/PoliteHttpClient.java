package com.delta.digest.aggregate.http;

import com.delta.digest.aggregate.model.HttpFetchResult;
import com.delta.digest.config.DigestProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Shared GET client for every source, page and image fetch. Bounds global and per-host concurrency,
 * spaces requests to the same host and backs off a host after 403/429. Requests are never retried.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final Duration BACKOFF_DURATION = Duration.ofSeconds(30);

    private final DigestProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Semaphore> hostLimiters = new ConcurrentHashMap<>();
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        DigestProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getGlobalConcurrency());
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, properties.getMaxPageBytes());
    }

    /**
     * @param maxBytes bodies longer than this are discarded and reported as {@code body_too_large}
     */
    public HttpFetchResult get(String url, String acceptHeader, int maxBytes) {
        Instant startedAt = Instant.now();
        URI uri = toHttpUri(url);
        if (uri == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        boolean acquired = false;
        boolean hostAcquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            Semaphore hostLimiter = hostLimiters.computeIfAbsent(
                host,
                ignored -> new Semaphore(properties.getPerHostConcurrency())
            );
            hostLimiter.acquire();
            hostAcquired = true;
            enforcePerHostDelay(host);

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();

            HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() == 403 || response.statusCode() == 429) {
                log.info("Backing off host {} after HTTP {}", host, response.statusCode());
                extendBackoff(host, BACKOFF_DURATION);
            }
            String contentType = response.headers().firstValue("Content-Type").orElse(null);
            byte[] responseBytes;
            try (InputStream in = response.body()) {
                responseBytes = readLimited(in, maxBytes);
            }
            if (responseBytes == null) {
                return new HttpFetchResult(
                    url,
                    response.uri(),
                    response.statusCode(),
                    null,
                    null,
                    contentType,
                    Instant.now(),
                    Duration.between(startedAt, Instant.now()),
                    "body_too_large",
                    "response exceeded " + maxBytes + " bytes"
                );
            }
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                new String(responseBytes, StandardCharsets.UTF_8),
                responseBytes,
                contentType,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (RuntimeException e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        } finally {
            if (hostAcquired) {
                Semaphore hostLimiter = hostLimiters.get(host);
                if (hostLimiter != null) {
                    hostLimiter.release();
                }
            }
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private byte[] readLimited(InputStream in, int maxBytes) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            total += read;
            if (total > maxBytes) {
                return null;
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(properties.getPerHostDelayMs()));
        }
    }

    private void extendBackoff(String host, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(host, candidate);
            }
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI toHttpUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            URI uri = URI.create(input.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                return null;
            }
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                return null;
            }
            return uri;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
