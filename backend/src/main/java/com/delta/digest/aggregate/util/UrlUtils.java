package com.delta.digest.aggregate.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class UrlUtils {
    private UrlUtils() {
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    public static boolean isDataUri(String candidate) {
        return candidate != null && candidate.trim().toLowerCase(Locale.ROOT).startsWith("data:");
    }

    /**
     * Absolute http(s) URL with a host.
     */
    public static boolean isHttpUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        URI uri = safeUri(candidate);
        if (uri == null || uri.getHost() == null || uri.getHost().isBlank()) {
            return false;
        }
        String scheme = uri.getScheme();
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    /**
     * Resolves {@code href} against {@code base}; protocol-relative references get https.
     */
    public static String resolve(String base, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String trimmed = href.trim();
        if (trimmed.startsWith("//")) {
            return "https:" + trimmed;
        }
        if (isHttpUrl(trimmed)) {
            return trimmed;
        }
        URI baseUri = safeUri(base);
        if (baseUri == null) {
            return null;
        }
        try {
            return baseUri.resolve(trimmed.replace(" ", "%20")).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Lower-cases scheme and host, drops the fragment, tracking parameters and a trailing slash.
     * Returns the trimmed input when it does not parse.
     */
    public static String canonicalize(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        URI uri = safeUri(trimmed);
        if (uri == null || uri.getHost() == null) {
            return trimmed;
        }
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        int port = uri.getPort();
        boolean defaultPort = port < 0
            || ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        StringBuilder out = new StringBuilder();
        out.append(scheme).append("://").append(host);
        if (!defaultPort) {
            out.append(':').append(port);
        }
        out.append(path);
        String query = canonicalQuery(uri.getRawQuery());
        if (!query.isEmpty()) {
            out.append('?').append(query);
        }
        return out.toString();
    }

    private static String canonicalQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            String name = pair.contains("=") ? pair.substring(0, pair.indexOf('=')) : pair;
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.startsWith("utm_") || lower.equals("ref") || lower.equals("fbclid") || lower.equals("gclid")) {
                continue;
            }
            kept.add(pair);
        }
        return String.join("&", kept);
    }

    /**
     * Lower-cased extension of the last path segment without the dot, or null.
     */
    public static String pathExtension(String url) {
        URI uri = safeUri(url);
        String path = uri == null ? url : uri.getPath();
        if (path == null || path.isBlank()) {
            return null;
        }
        int slash = path.lastIndexOf('/');
        String segment = slash >= 0 ? path.substring(slash + 1) : path;
        int dot = segment.lastIndexOf('.');
        if (dot <= 0 || dot == segment.length() - 1) {
            return null;
        }
        return segment.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static String lastPathSegment(String url) {
        URI uri = safeUri(url);
        String path = uri == null ? url : uri.getPath();
        if (path == null) {
            return "";
        }
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
