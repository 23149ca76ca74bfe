package com.delta.digest.aggregate.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one adapter call. {@code successfulFetch} is false when the source as a whole was unusable
 * (unreachable, non-2xx, unparsable payload); item-level problems only show up in {@code errors}.
 */
public record SourceFetchResult(
    List<Entry> entries,
    Map<String, Integer> errors,
    boolean successfulFetch
) {
    public SourceFetchResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
        errors = errors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static SourceFetchResult failed(String errorKey) {
        Map<String, Integer> errors = new LinkedHashMap<>();
        errors.put(errorKey, 1);
        return new SourceFetchResult(List.of(), errors, false);
    }

    public static SourceFetchResult of(List<Entry> entries, Map<String, Integer> errors) {
        return new SourceFetchResult(entries, errors, true);
    }
}
