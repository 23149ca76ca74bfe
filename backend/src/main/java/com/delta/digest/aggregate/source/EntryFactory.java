package com.delta.digest.aggregate.source;

import com.delta.digest.aggregate.model.Entry;
import com.delta.digest.aggregate.model.SourceConfig;
import com.delta.digest.aggregate.util.HashUtils;
import com.delta.digest.aggregate.util.UrlUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;

final class EntryFactory {
    private EntryFactory() {
    }

    /**
     * Builds an entry keyed on the canonical form of {@code url}. Returns null when the link is not an
     * absolute http(s) URL; such items are not addressable downstream.
     */
    static Entry create(
        SourceConfig config,
        String url,
        String title,
        String summary,
        Instant publishedAt,
        Map<String, Object> extra
    ) {
        if (!UrlUtils.isHttpUrl(url)) {
            return null;
        }
        String link = url.trim();
        String id = HashUtils.entryId(UrlUtils.canonicalize(link));
        return new Entry(id, config.type(), config.key(), title, summary, link, publishedAt, List.of(), extra);
    }
}
