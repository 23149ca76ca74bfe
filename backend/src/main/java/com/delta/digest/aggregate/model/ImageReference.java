package com.delta.digest.aggregate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * A candidate illustrative image. {@code sequence} is the discovery index within the owning entry and
 * feeds the deterministic file name; {@code localPath} is set only after a successful download.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImageReference(
    @JsonProperty("url") String url,
    @JsonProperty("kind") String kind,
    @JsonProperty("sequence") int sequence,
    @JsonProperty("local_path") String localPath
) {
    public static final String KIND_OG_IMAGE = "og-image";
    public static final String KIND_FIGURE = "figure";
    public static final String KIND_DIAGRAM = "diagram";
    public static final String KIND_IMAGE = "image";
    public static final String KIND_ENCLOSURE = "enclosure";

    public ImageReference {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("image url is required");
        }
        url = url.trim();
        if (url.toLowerCase(Locale.ROOT).startsWith("data:")) {
            throw new IllegalArgumentException("data URIs are not image candidates");
        }
        kind = kind == null || kind.isBlank() ? KIND_IMAGE : kind;
        localPath = localPath == null || localPath.isBlank() ? null : localPath;
    }

    public ImageReference(String url, String kind, int sequence) {
        this(url, kind, sequence, null);
    }

    public ImageReference withLocalPath(String path) {
        return new ImageReference(url, kind, sequence, path);
    }
}
