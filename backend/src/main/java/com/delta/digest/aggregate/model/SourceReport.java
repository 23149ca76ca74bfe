package com.delta.digest.aggregate.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SourceReport(
    String key,
    SourceType type,
    SourceStatus status,
    int fetchedCount,
    int keptCount,
    Map<String, Integer> errors
) {
    public SourceReport {
        errors = errors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static SourceReport configInvalid(String key, SourceType type, String message) {
        return new SourceReport(key, type, SourceStatus.CONFIG_INVALID, 0, 0, Map.of("config_invalid: " + message, 1));
    }
}
