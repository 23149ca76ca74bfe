package com.delta.digest.aggregate.source;

import java.time.Instant;
import java.util.List;

/**
 * One RSS item or Atom entry with its text already decoded to plain text.
 */
public record FeedItem(
    String id,
    String title,
    String link,
    String summary,
    Instant published,
    List<String> authors,
    List<String> imageUrls
) {
    public FeedItem {
        authors = authors == null ? List.of() : List.copyOf(authors);
        imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
    }
}
