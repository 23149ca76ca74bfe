package com.delta.digest.aggregate.model;

import java.util.List;

public record DownloadReport(
    List<Entry> entries,
    List<ImageDownloadStatus> statuses
) {
    public DownloadReport {
        entries = entries == null ? List.of() : List.copyOf(entries);
        statuses = statuses == null ? List.of() : List.copyOf(statuses);
    }

    public long count(DownloadOutcome outcome) {
        return statuses.stream().filter(status -> status.outcome() == outcome).count();
    }
}
