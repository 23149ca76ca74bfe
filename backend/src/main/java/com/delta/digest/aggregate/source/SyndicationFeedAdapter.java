package com.delta.digest.aggregate.source;

import com.delta.digest.aggregate.http.PoliteHttpClient;
import com.delta.digest.aggregate.model.Entry;
import com.delta.digest.aggregate.model.HttpFetchResult;
import com.delta.digest.aggregate.model.SourceConfig;
import com.delta.digest.aggregate.model.SourceFetchResult;
import com.delta.digest.aggregate.model.SourceType;
import com.delta.digest.aggregate.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class SyndicationFeedAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(SyndicationFeedAdapter.class);
    static final String FEED_ACCEPT = "application/rss+xml, application/atom+xml, application/xml;q=0.9, text/xml;q=0.8, */*;q=0.5";
    private static final int SUMMARY_CHARS = 500;

    private final PoliteHttpClient httpClient;
    private final FeedParser feedParser;

    public SyndicationFeedAdapter(PoliteHttpClient httpClient, FeedParser feedParser) {
        this.httpClient = httpClient;
        this.feedParser = feedParser;
    }

    @Override
    public SourceType type() {
        return SourceType.SYNDICATION_FEED;
    }

    @Override
    public SourceFetchResult fetch(SourceConfig config) {
        HttpFetchResult result = httpClient.get(config.url(), FEED_ACCEPT);
        if (!result.isSuccessful() || result.body() == null) {
            log.warn("Feed {} fetch failed: {}", config.key(), result.errorKey());
            return SourceFetchResult.failed(result.errorKey());
        }
        List<FeedItem> items = feedParser.parse(result.body(), result.finalUrlOrRequested());
        if (items == null) {
            log.warn("Feed {} payload is not RSS or Atom", config.key());
            return SourceFetchResult.failed("parse_error");
        }
        return toResult(config, items, SUMMARY_CHARS);
    }

    /**
     * Maps parsed feed items to entries, shared with the custom-feed fallback path.
     */
    static SourceFetchResult toResult(SourceConfig config, List<FeedItem> items, int summaryChars) {
        List<Entry> entries = new ArrayList<>();
        Map<String, Integer> errors = new LinkedHashMap<>();
        for (FeedItem item : items) {
            Entry entry = toEntry(config, item, summaryChars);
            if (entry == null) {
                log.debug("Feed {} skipped item without a usable link: {}", config.key(), item.title());
                errors.merge("item_malformed", 1, Integer::sum);
                continue;
            }
            entries.add(entry);
            if (entries.size() >= config.fetchSize()) {
                break;
            }
        }
        return SourceFetchResult.of(entries, errors);
    }

    private static Entry toEntry(SourceConfig config, FeedItem item, int summaryChars) {
        Map<String, Object> extra = new LinkedHashMap<>();
        if (item.id() != null) {
            extra.put(Entry.EXTRA_NATIVE_ID, item.id());
        }
        if (!item.authors().isEmpty()) {
            extra.put(Entry.EXTRA_AUTHOR, String.join(", ", item.authors()));
        }
        if (!item.imageUrls().isEmpty()) {
            extra.put(Entry.EXTRA_FEED_IMAGES, item.imageUrls());
        }
        String summary = TextUtils.truncate(item.summary(), summaryChars);
        return EntryFactory.create(config, item.link(), item.title(), summary, item.published(), extra);
    }
}
