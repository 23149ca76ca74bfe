package com.delta.digest.aggregate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceType {
    STRUCTURED_API("structured-api", true, false, ImageStrategy.OG_IMAGE),
    SYNDICATION_FEED("syndication-feed", true, true, ImageStrategy.EMBEDDED),
    SCHOLARLY_LISTING("scholarly-listing", true, false, ImageStrategy.PAPER_FIGURES),
    CUSTOM_FEED("custom-feed", true, true, ImageStrategy.EMBEDDED),
    HTML_LISTING("html-listing", false, true, ImageStrategy.NONE);

    private final String code;
    private final boolean supportsDateRange;
    private final boolean requiresUrl;
    private final ImageStrategy defaultImageStrategy;

    SourceType(String code, boolean supportsDateRange, boolean requiresUrl, ImageStrategy defaultImageStrategy) {
        this.code = code;
        this.supportsDateRange = supportsDateRange;
        this.requiresUrl = requiresUrl;
        this.defaultImageStrategy = defaultImageStrategy;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean supportsDateRange() {
        return supportsDateRange;
    }

    public boolean requiresUrl() {
        return requiresUrl;
    }

    public ImageStrategy defaultImageStrategy() {
        return defaultImageStrategy;
    }

    /**
     * Papers come from the scholarly listing; everything else is reported as news.
     */
    public String contentKind() {
        return this == SCHOLARLY_LISTING ? "paper" : "news";
    }

    @JsonCreator
    public static SourceType fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (SourceType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
