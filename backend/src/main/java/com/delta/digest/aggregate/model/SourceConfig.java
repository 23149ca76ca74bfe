package com.delta.digest.aggregate.model;

import java.util.List;

/**
 * Validated, immutable configuration for one source in one run.
 *
 * @param key           stable source name, used as the {@code source} tag in file names
 * @param url           endpoint or feed URL; adapters with a fixed endpoint fall back to their default when null
 * @param limit         number of entries this source may contribute after filtering
 * @param fetchSize     candidate pool requested from the upstream before filtering
 * @param priority      lower values merge first
 * @param dateRange     publication window, or null for no date filtering
 */
public record SourceConfig(
    String key,
    SourceType type,
    String url,
    List<String> keywords,
    int limit,
    int fetchSize,
    int priority,
    DateRange dateRange,
    SortOrder sort,
    ImageStrategy imageStrategy
) {
    public SourceConfig {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        sort = sort == null ? SortOrder.NATIVE : sort;
        imageStrategy = imageStrategy == null && type != null ? type.defaultImageStrategy() : imageStrategy;
    }

    public String keywordQuery(String separator, String fallback) {
        if (keywords.isEmpty()) {
            return fallback;
        }
        return String.join(separator, keywords);
    }
}
