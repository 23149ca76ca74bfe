package com.delta.digest.aggregate.source;

import com.delta.digest.aggregate.http.PoliteHttpClient;
import com.delta.digest.aggregate.model.Entry;
import com.delta.digest.aggregate.model.HttpFetchResult;
import com.delta.digest.aggregate.model.SourceConfig;
import com.delta.digest.aggregate.model.SourceFetchResult;
import com.delta.digest.aggregate.model.SourceType;
import com.delta.digest.aggregate.util.TextUtils;
import com.delta.digest.aggregate.util.TimestampParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured-API source backed by the Hacker News Algolia search endpoint.
 */
@Component
public class HackerNewsAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(HackerNewsAdapter.class);
    static final String DEFAULT_ENDPOINT = "https://hn.algolia.com/api/v1/search";
    static final String ITEM_URL_PREFIX = "https://news.ycombinator.com/item?id=";
    private static final int MAX_HITS_PER_PAGE = 1000;
    private static final int SUMMARY_CHARS = 300;

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HackerNewsAdapter(PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceType type() {
        return SourceType.STRUCTURED_API;
    }

    @Override
    public SourceFetchResult fetch(SourceConfig config) {
        String requestUrl = buildRequestUrl(config);
        HttpFetchResult result = httpClient.get(requestUrl, "application/json");
        if (!result.isSuccessful() || result.body() == null) {
            log.warn("Source {} fetch failed: {}", config.key(), result.errorKey());
            return SourceFetchResult.failed(result.errorKey());
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            log.warn("Source {} returned unparsable JSON: {}", config.key(), e.getOriginalMessage());
            return SourceFetchResult.failed("parse_error");
        }
        JsonNode hits = root == null ? null : root.path("hits");
        if (hits == null || !hits.isArray()) {
            return SourceFetchResult.failed("invalid_payload");
        }

        List<Entry> entries = new ArrayList<>();
        Map<String, Integer> errors = new LinkedHashMap<>();
        for (JsonNode hit : hits) {
            Entry entry = toEntry(config, hit);
            if (entry == null) {
                log.debug("Source {} skipped malformed hit {}", config.key(), hit.path("objectID").asText(""));
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

    String buildRequestUrl(SourceConfig config) {
        String endpoint = config.url() == null ? DEFAULT_ENDPOINT : config.url();
        int hitsPerPage = Math.min(MAX_HITS_PER_PAGE, Math.max(1, config.fetchSize()));
        String query = config.keywordQuery(" ", "AI");
        String separator = endpoint.contains("?") ? "&" : "?";
        return endpoint + separator
            + "query=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
            + "&tags=story"
            + "&hitsPerPage=" + hitsPerPage;
    }

    private Entry toEntry(SourceConfig config, JsonNode hit) {
        if (hit == null || !hit.isObject()) {
            return null;
        }
        String objectId = text(hit, "objectID");
        String title = TextUtils.firstNonBlank(text(hit, "title"), text(hit, "story_title"));
        if (title == null) {
            return null;
        }
        String url = TextUtils.firstNonBlank(text(hit, "url"), text(hit, "story_url"));
        if (url == null && objectId != null) {
            url = ITEM_URL_PREFIX + objectId;
        }
        Instant publishedAt = hit.hasNonNull("created_at_i")
            ? TimestampParser.fromEpoch(hit.get("created_at_i").asLong())
            : TimestampParser.parse(text(hit, "created_at"));

        Map<String, Object> extra = new LinkedHashMap<>();
        if (objectId != null) {
            extra.put(Entry.EXTRA_NATIVE_ID, objectId);
        }
        extra.put(Entry.EXTRA_SCORE, hit.path("points").asInt(0));
        String author = text(hit, "author");
        if (author != null) {
            extra.put(Entry.EXTRA_AUTHOR, author);
        }
        extra.put("num_comments", hit.path("num_comments").asInt(0));

        String summary = TextUtils.truncate(TextUtils.plainText(text(hit, "story_text")), SUMMARY_CHARS);
        return EntryFactory.create(config, url, TextUtils.plainText(title), summary, publishedAt, extra);
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }
}
