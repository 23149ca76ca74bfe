package com.delta.digest.aggregate.source;

import com.delta.digest.aggregate.http.PoliteHttpClient;
import com.delta.digest.aggregate.model.Entry;
import com.delta.digest.aggregate.model.HttpFetchResult;
import com.delta.digest.aggregate.model.SourceConfig;
import com.delta.digest.aggregate.model.SourceFetchResult;
import com.delta.digest.aggregate.model.SourceType;
import com.delta.digest.aggregate.util.TextUtils;
import com.delta.digest.aggregate.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scrapes headline links from a news site's listing page. Entries carry no timestamp or summary.
 */
@Component
public class HtmlListingAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(HtmlListingAdapter.class);
    static final int MIN_TITLE_CHARS = 10;
    static final int MAX_TITLE_CHARS = 100;
    static final List<String> DEFAULT_KEYWORDS = List.of(
        "AI", "artificial intelligence", "machine learning", "deep learning", "LLM", "GPT",
        "人工智能", "机器学习", "深度学习", "大模型"
    );
    private static final List<String> NAVIGATION_WORDS = List.of(
        "login", "log in", "sign in", "sign up", "register", "home", "about", "contact",
        "privacy", "terms", "advertise", "careers", "subscribe",
        "登录", "注册", "首页", "关于", "联系", "友情链接", "广告", "合作", "招聘"
    );

    private final PoliteHttpClient httpClient;

    public HtmlListingAdapter(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public SourceType type() {
        return SourceType.HTML_LISTING;
    }

    @Override
    public SourceFetchResult fetch(SourceConfig config) {
        HttpFetchResult result = httpClient.get(config.url(), "text/html,application/xhtml+xml");
        if (!result.isSuccessful() || result.body() == null) {
            log.warn("Listing page {} fetch failed: {}", config.key(), result.errorKey());
            return SourceFetchResult.failed(result.errorKey());
        }

        Document doc = Jsoup.parse(result.body(), result.finalUrlOrRequested());
        List<Pattern> keywordPatterns = keywordPatterns(config.keywords().isEmpty() ? DEFAULT_KEYWORDS : config.keywords());
        Set<String> seen = new HashSet<>();
        List<Entry> entries = new ArrayList<>();
        Map<String, Integer> errors = new LinkedHashMap<>();
        for (Element anchor : doc.select("a[href]")) {
            String title = TextUtils.collapseWhitespace(anchor.text());
            if (!isHeadline(title) || keywordPatterns.stream().noneMatch(p -> p.matcher(title).find())) {
                continue;
            }
            String href = anchor.attr("abs:href");
            if (!UrlUtils.isHttpUrl(href)) {
                errors.merge("item_malformed", 1, Integer::sum);
                continue;
            }
            if (!seen.add(UrlUtils.canonicalize(href))) {
                continue;
            }
            Entry entry = EntryFactory.create(config, href, title, "", null, Map.of());
            if (entry != null) {
                entries.add(entry);
            }
            if (entries.size() >= config.fetchSize()) {
                break;
            }
        }
        log.debug("Listing page {} yielded {} headline links", config.key(), entries.size());
        return SourceFetchResult.of(entries, errors);
    }

    static boolean isHeadline(String title) {
        if (title.length() < MIN_TITLE_CHARS || title.length() > MAX_TITLE_CHARS) {
            return false;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        for (String word : NAVIGATION_WORDS) {
            if (lower.equals(word) || lower.startsWith(word + " ") || lower.endsWith(" " + word)) {
                return false;
            }
            if (!isAscii(word) && lower.contains(word)) {
                return false;
            }
        }
        return true;
    }

    static List<Pattern> keywordPatterns(List<String> keywords) {
        List<Pattern> patterns = new ArrayList<>();
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            String quoted = Pattern.quote(keyword.trim());
            // ASCII keywords match whole words only so that "AI" does not hit "said"
            String regex = isAscii(keyword) ? "(?<![\\p{L}\\p{N}])" + quoted + "(?![\\p{L}\\p{N}])" : quoted;
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        return patterns;
    }

    private static boolean isAscii(String value) {
        return value.chars().allMatch(c -> c < 128);
    }
}
