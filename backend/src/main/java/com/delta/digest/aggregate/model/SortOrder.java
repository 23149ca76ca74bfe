package com.delta.digest.aggregate.model;

import java.util.Locale;

public enum SortOrder {
    NATIVE,
    SCORE,
    RECENCY;

    public static SortOrder fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return NATIVE;
        }
        try {
            return SortOrder.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
