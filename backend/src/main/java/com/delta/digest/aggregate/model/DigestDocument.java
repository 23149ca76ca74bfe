package com.delta.digest.aggregate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Serialized form of one run, written by the CLI and returned by the run endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DigestDocument(
    @JsonProperty("date") LocalDate date,
    @JsonProperty("generated_at") Instant generatedAt,
    @JsonProperty("entries") List<Entry> entries,
    @JsonProperty("stats") Stats stats,
    @JsonProperty("sources") List<SourceReport> sources,
    @JsonProperty("downloads") List<ImageDownloadStatus> downloads
) {
    public record Stats(long total, long news, long papers) {
    }

    public static DigestDocument of(LocalDate date, AggregationResult result, DownloadReport downloads) {
        List<Entry> entries = downloads == null ? result.entries() : downloads.entries();
        Stats stats = new Stats(entries.size(), result.countByKind("news"), result.countByKind("paper"));
        return new DigestDocument(
            date,
            result.finishedAt(),
            entries,
            stats,
            result.sources(),
            downloads == null ? null : downloads.statuses()
        );
    }
}
