package com.delta.digest.aggregate.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One normalized content record. Entries are immutable; later stages derive copies that only differ in
 * {@code imageCandidates}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Entry(
    @JsonProperty("id") String id,
    @JsonProperty("source") SourceType source,
    @JsonProperty("source_key") String sourceKey,
    @JsonProperty("title") String title,
    @JsonProperty("summary") String summary,
    @JsonProperty("url") String url,
    @JsonProperty("published_at") Instant publishedAt,
    @JsonProperty("image_candidates") List<ImageReference> imageCandidates,
    @JsonProperty("extra") Map<String, Object> extra
) {
    public static final String EXTRA_SCORE = "score";
    public static final String EXTRA_AUTHOR = "author";
    public static final String EXTRA_AUTHORS = "authors";
    public static final String EXTRA_NATIVE_ID = "native_id";
    public static final String EXTRA_ARXIV_ID = "arxiv_id";
    public static final String EXTRA_FEED_IMAGES = "feed_images";

    public Entry {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("entry id is required");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("entry url is required");
        }
        title = title == null ? "" : title;
        summary = summary == null ? "" : summary;
        imageCandidates = imageCandidates == null ? List.of() : List.copyOf(imageCandidates);
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public Entry withImageCandidates(List<ImageReference> candidates) {
        return new Entry(id, source, sourceKey, title, summary, url, publishedAt, candidates, extra);
    }

    @JsonProperty("type")
    public String contentKind() {
        return source == null ? "news" : source.contentKind();
    }

    public Double score() {
        Object value = extra.get(EXTRA_SCORE);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    public List<String> feedImages() {
        Object value = extra.get(EXTRA_FEED_IMAGES);
        if (value instanceof List<?> list) {
            return list.stream()
                .filter(item -> item instanceof String)
                .map(item -> (String) item)
                .toList();
        }
        return List.of();
    }
}
