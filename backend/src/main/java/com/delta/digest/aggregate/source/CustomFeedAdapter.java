package com.delta.digest.aggregate.source;

import com.delta.digest.aggregate.http.PoliteHttpClient;
import com.delta.digest.aggregate.model.Entry;
import com.delta.digest.aggregate.model.HttpFetchResult;
import com.delta.digest.aggregate.model.SourceConfig;
import com.delta.digest.aggregate.model.SourceFetchResult;
import com.delta.digest.aggregate.model.SourceType;
import com.delta.digest.aggregate.util.TextUtils;
import com.delta.digest.aggregate.util.TimestampParser;
import com.delta.digest.aggregate.util.UrlUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Source of unknown format: either a JSON list of article objects or an RSS/Atom feed.
 * <p>
 * The payload kind is decided by the {@code Content-Type} header when it names JSON or XML, otherwise by
 * the first non-blank character. A JSON document whose shape holds no recognizable list falls back to the
 * feed parser; if that fails too the source is reported as {@code unrecognized_payload}.
 */
@Component
public class CustomFeedAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(CustomFeedAdapter.class);
    private static final List<String> LIST_KEYS = List.of("data", "items", "results", "articles");
    private static final String[] TITLE_FIELDS = {"title", "name", "headline"};
    private static final String[] LINK_FIELDS = {"url", "link", "href", "sourceUrl"};
    private static final String[] SUMMARY_FIELDS = {"summary", "description", "content", "abstract"};
    private static final String[] DATE_FIELDS = {"published", "publish_time", "created_at", "pubDate", "date"};
    private static final String[] IMAGE_FIELDS = {"image", "imageUrl", "thumbnail", "imgUrl"};
    private static final int SUMMARY_CHARS = 500;

    enum PayloadKind { JSON, FEED, UNKNOWN }

    private final PoliteHttpClient httpClient;
    private final FeedParser feedParser;
    private final ObjectMapper objectMapper;

    public CustomFeedAdapter(PoliteHttpClient httpClient, FeedParser feedParser, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.feedParser = feedParser;
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceType type() {
        return SourceType.CUSTOM_FEED;
    }

    @Override
    public SourceFetchResult fetch(SourceConfig config) {
        HttpFetchResult result = httpClient.get(
            config.url(),
            "application/json, application/rss+xml, application/atom+xml, application/xml;q=0.9, */*;q=0.5"
        );
        if (!result.isSuccessful() || result.body() == null) {
            log.warn("Custom source {} fetch failed: {}", config.key(), result.errorKey());
            return SourceFetchResult.failed(result.errorKey());
        }

        String body = result.body();
        String baseUrl = result.finalUrlOrRequested();
        PayloadKind kind = sniff(result.mediaType(), body);
        if (kind != PayloadKind.FEED) {
            List<JsonNode> items = jsonItems(body);
            if (items != null) {
                return toResult(config, items, baseUrl);
            }
            log.debug("Custom source {} is not a recognizable JSON list, trying feed parser", config.key());
        }
        List<FeedItem> feedItems = feedParser.parse(body, baseUrl);
        if (feedItems == null) {
            log.warn("Custom source {} payload is neither a JSON article list nor a feed", config.key());
            return SourceFetchResult.failed("unrecognized_payload");
        }
        return SyndicationFeedAdapter.toResult(config, feedItems, SUMMARY_CHARS);
    }

    static PayloadKind sniff(String mediaType, String body) {
        if (mediaType != null && !mediaType.isBlank()) {
            if (mediaType.contains("json")) {
                return PayloadKind.JSON;
            }
            if (mediaType.contains("xml") || mediaType.contains("rss") || mediaType.contains("atom")) {
                return PayloadKind.FEED;
            }
        }
        String trimmed = body == null ? "" : body.stripLeading();
        if (trimmed.startsWith("\uFEFF")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            return PayloadKind.JSON;
        }
        if (trimmed.startsWith("<")) {
            return PayloadKind.FEED;
        }
        return PayloadKind.UNKNOWN;
    }

    /**
     * @return the article objects, or null when the payload is not JSON or holds no list under a known key
     */
    private List<JsonNode> jsonItems(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
        JsonNode list = null;
        if (root != null && root.isArray()) {
            list = root;
        } else if (root != null && root.isObject()) {
            for (String key : LIST_KEYS) {
                if (root.path(key).isArray()) {
                    list = root.get(key);
                    break;
                }
            }
        }
        if (list == null) {
            return null;
        }
        List<JsonNode> items = new ArrayList<>();
        list.forEach(items::add);
        return items;
    }

    private SourceFetchResult toResult(SourceConfig config, List<JsonNode> items, String baseUrl) {
        List<Entry> entries = new ArrayList<>();
        Map<String, Integer> errors = new LinkedHashMap<>();
        for (JsonNode item : items) {
            Entry entry = item.isObject() ? toEntry(config, item, baseUrl) : null;
            if (entry == null) {
                log.debug("Custom source {} skipped item without title and link", config.key());
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

    private Entry toEntry(SourceConfig config, JsonNode item, String baseUrl) {
        String link = firstText(item, LINK_FIELDS);
        String url = link == null ? null : UrlUtils.resolve(baseUrl, link);
        if (url == null) {
            return null;
        }
        String title = TextUtils.plainText(firstText(item, TITLE_FIELDS));
        String summary = TextUtils.truncate(TextUtils.plainText(firstText(item, SUMMARY_FIELDS)), SUMMARY_CHARS);
        Instant publishedAt = parseDate(item);

        Map<String, Object> extra = new LinkedHashMap<>();
        String nativeId = firstText(item, "id", "guid");
        if (nativeId != null) {
            extra.put(Entry.EXTRA_NATIVE_ID, nativeId);
        }
        String author = firstText(item, "author", "source");
        if (author != null) {
            extra.put(Entry.EXTRA_AUTHOR, author);
        }
        String image = firstText(item, IMAGE_FIELDS);
        if (image != null) {
            String resolved = UrlUtils.resolve(baseUrl, image);
            if (resolved != null) {
                extra.put(Entry.EXTRA_FEED_IMAGES, List.of(resolved));
            }
        }
        return EntryFactory.create(config, url, title, summary, publishedAt, extra);
    }

    private Instant parseDate(JsonNode item) {
        for (String field : DATE_FIELDS) {
            JsonNode value = item.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            Instant parsed = value.isNumber() ? TimestampParser.fromEpoch(value.asLong()) : TimestampParser.parse(value.asText());
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }
}
