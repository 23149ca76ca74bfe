package com.delta.digest.aggregate.util;

import org.jsoup.Jsoup;

public final class TextUtils {
    private TextUtils() {
    }

    public static String collapseWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("\\s+", " ").trim();
    }

    /**
     * Decodes entities and strips markup, returning single-line text.
     */
    public static String plainText(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        if (value.indexOf('<') < 0 && value.indexOf('&') < 0) {
            return collapseWhitespace(value);
        }
        return collapseWhitespace(Jsoup.parse(value).text());
    }

    public static String truncate(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        if (value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, maxChars).trim() + "...";
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
