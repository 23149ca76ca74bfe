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

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scholarly-listing source over the arXiv Atom query API. Figures are discovered later, from the paper's
 * HTML rendering, by the image extractor.
 */
@Component
public class ArxivAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(ArxivAdapter.class);
    static final String DEFAULT_ENDPOINT = "http://export.arxiv.org/api/query";
    static final String ABS_URL_PREFIX = "https://arxiv.org/abs/";
    private static final Pattern ARXIV_ID = Pattern.compile("/abs/([^?#]+?)(v\\d+)?$");
    private static final int SUMMARY_CHARS = 300;

    private final PoliteHttpClient httpClient;
    private final FeedParser feedParser;

    public ArxivAdapter(PoliteHttpClient httpClient, FeedParser feedParser) {
        this.httpClient = httpClient;
        this.feedParser = feedParser;
    }

    @Override
    public SourceType type() {
        return SourceType.SCHOLARLY_LISTING;
    }

    @Override
    public SourceFetchResult fetch(SourceConfig config) {
        HttpFetchResult result = httpClient.get(buildRequestUrl(config), "application/atom+xml");
        if (!result.isSuccessful() || result.body() == null) {
            log.warn("Listing {} fetch failed: {}", config.key(), result.errorKey());
            return SourceFetchResult.failed(result.errorKey());
        }
        List<FeedItem> items = feedParser.parse(result.body(), result.finalUrlOrRequested());
        if (items == null) {
            return SourceFetchResult.failed("parse_error");
        }

        List<Entry> entries = new ArrayList<>();
        Map<String, Integer> errors = new LinkedHashMap<>();
        for (FeedItem item : items) {
            Entry entry = toEntry(config, item);
            if (entry == null) {
                log.debug("Listing {} skipped entry {}", config.key(), item.id());
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
        String query = "all:" + config.keywordQuery(" OR ", "artificial intelligence OR machine learning");
        String separator = endpoint.contains("?") ? "&" : "?";
        return endpoint + separator
            + "search_query=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
            + "&start=0"
            + "&max_results=" + Math.max(1, config.fetchSize())
            + "&sortBy=submittedDate&sortOrder=descending";
    }

    static String arxivId(String entryId) {
        if (entryId == null) {
            return null;
        }
        Matcher matcher = ARXIV_ID.matcher(entryId.trim());
        return matcher.find() ? matcher.group(1) : null;
    }

    private Entry toEntry(SourceConfig config, FeedItem item) {
        String arxivId = TextUtils.firstNonBlank(arxivId(item.id()), arxivId(item.link()));
        if (arxivId == null || item.title().isBlank()) {
            return null;
        }
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put(Entry.EXTRA_NATIVE_ID, arxivId);
        extra.put(Entry.EXTRA_ARXIV_ID, arxivId);
        extra.put(Entry.EXTRA_AUTHORS, item.authors());
        String summary = TextUtils.truncate(TextUtils.collapseWhitespace(item.summary()), SUMMARY_CHARS);
        return EntryFactory.create(config, ABS_URL_PREFIX + arxivId, item.title(), summary, item.published(), extra);
    }
}
