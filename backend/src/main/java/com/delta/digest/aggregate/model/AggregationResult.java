package com.delta.digest.aggregate.model;

import java.time.Instant;
import java.util.List;

public record AggregationResult(
    Instant startedAt,
    Instant finishedAt,
    List<Entry> entries,
    List<SourceReport> sources
) {
    public AggregationResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public long countByKind(String kind) {
        return entries.stream().filter(entry -> kind.equals(entry.contentKind())).count();
    }
}
