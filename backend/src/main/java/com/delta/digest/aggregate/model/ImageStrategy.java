package com.delta.digest.aggregate.model;

import java.util.Locale;

public enum ImageStrategy {
    NONE("none"),
    EMBEDDED("embedded"),
    OG_IMAGE("og-image"),
    PAPER_FIGURES("paper-figures");

    private final String code;

    ImageStrategy(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static ImageStrategy fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ImageStrategy strategy : values()) {
            if (strategy.code.equals(normalized)) {
                return strategy;
            }
        }
        return null;
    }
}
