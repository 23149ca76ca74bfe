package com.delta.digest.aggregate.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Result of a single HTTP exchange. Transport failures are reported through {@code errorCode}
 * rather than thrown, so callers can degrade one unit at a time.
 */
public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    byte[] bodyBytes,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    /**
     * Content type without parameters, lower-cased; empty when the server sent none.
     */
    public String mediaType() {
        if (contentType == null || contentType.isBlank()) {
            return "";
        }
        int separator = contentType.indexOf(';');
        String raw = separator >= 0 ? contentType.substring(0, separator) : contentType;
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    public String errorKey() {
        if (errorCode != null) {
            return errorCode;
        }
        if (statusCode > 0) {
            return "http_" + statusCode;
        }
        return "unknown_error";
    }
}
