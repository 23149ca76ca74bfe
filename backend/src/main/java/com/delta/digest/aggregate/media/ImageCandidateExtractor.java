package com.delta.digest.aggregate.media;

import com.delta.digest.aggregate.http.PoliteHttpClient;
import com.delta.digest.aggregate.model.Entry;
import com.delta.digest.aggregate.model.HttpFetchResult;
import com.delta.digest.aggregate.model.ImageReference;
import com.delta.digest.aggregate.model.ImageStrategy;
import com.delta.digest.config.DigestProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Discovers candidate images for an entry. Never throws: a failed page fetch yields no candidates.
 * Sequence numbers are reassigned 0..n-1 in discovery order after filtering.
 */
@Service
public class ImageCandidateExtractor {
    private static final Logger log = LoggerFactory.getLogger(ImageCandidateExtractor.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml";
    private static final List<String> OG_SELECTORS = List.of(
        "meta[property=og:image]",
        "meta[property=og:image:url]",
        "meta[property=og:image:secure_url]",
        "meta[name=og:image]"
    );

    private final PoliteHttpClient httpClient;
    private final DigestProperties properties;

    public ImageCandidateExtractor(PoliteHttpClient httpClient, DigestProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    public List<ImageReference> extract(Entry entry) {
        ImageStrategy strategy = entry.source() == null ? ImageStrategy.NONE : entry.source().defaultImageStrategy();
        return extract(entry, strategy);
    }

    public List<ImageReference> extract(Entry entry, ImageStrategy strategy) {
        if (entry == null || strategy == null || strategy == ImageStrategy.NONE) {
            return List.of();
        }
        List<ImageReference> discovered = switch (strategy) {
            case EMBEDDED -> embedded(entry);
            case OG_IMAGE -> openGraph(entry);
            case PAPER_FIGURES -> paperFigures(entry);
            case NONE -> List.of();
        };
        return renumber(discovered);
    }

    private List<ImageReference> embedded(Entry entry) {
        List<ImageReference> images = new ArrayList<>();
        for (String url : entry.feedImages()) {
            if (ImageUrlFilter.accept(url)) {
                images.add(new ImageReference(url, ImageReference.KIND_ENCLOSURE, images.size()));
            }
        }
        return images;
    }

    private List<ImageReference> openGraph(Entry entry) {
        List<ImageReference> hints = embedded(entry);
        if (!hints.isEmpty()) {
            return List.of(new ImageReference(hints.get(0).url(), ImageReference.KIND_OG_IMAGE, 0));
        }
        HttpFetchResult page = httpClient.get(entry.url(), HTML_ACCEPT);
        if (!page.isSuccessful() || page.body() == null || !looksLikeHtml(page)) {
            log.debug("No og:image for {}: {}", entry.url(), page.isSuccessful() ? "not_html" : page.errorKey());
            return List.of();
        }
        Document doc = Jsoup.parse(page.body(), page.finalUrlOrRequested());
        for (String selector : OG_SELECTORS) {
            Element meta = doc.selectFirst(selector);
            if (meta == null) {
                continue;
            }
            String url = meta.attr("abs:content");
            if (url.isBlank()) {
                url = meta.attr("content");
            }
            if (ImageUrlFilter.accept(url)) {
                return List.of(new ImageReference(url, ImageReference.KIND_OG_IMAGE, 0));
            }
            log.debug("Rejected og:image {} on {}", url, entry.url());
        }
        return List.of();
    }

    private List<ImageReference> paperFigures(Entry entry) {
        Object arxivId = entry.extra().get(Entry.EXTRA_ARXIV_ID);
        if (!(arxivId instanceof String id) || id.isBlank()) {
            return List.of();
        }
        DigestProperties.Images images = properties.getImages();
        String base = images.getPaperHtmlBaseUrl();
        String pageUrl = (base.endsWith("/") ? base : base + "/") + id + "/";
        HttpFetchResult page = httpClient.get(pageUrl, HTML_ACCEPT);
        if (!page.isSuccessful() || page.body() == null) {
            log.debug("Paper page {} unavailable: {}", pageUrl, page.errorKey());
            return List.of();
        }
        PaperFigureScanner scanner = new PaperFigureScanner(images.getMaxFiguresPerEntry(), images.getMinFigureDimension());
        return scanner.scan(page.body(), page.finalUrlOrRequested());
    }

    private boolean looksLikeHtml(HttpFetchResult page) {
        String mediaType = page.mediaType();
        return mediaType.isEmpty() || mediaType.contains("html") || mediaType.contains("xml");
    }

    private List<ImageReference> renumber(List<ImageReference> discovered) {
        Set<String> seen = new LinkedHashSet<>();
        List<ImageReference> out = new ArrayList<>();
        for (ImageReference reference : discovered) {
            if (!ImageUrlFilter.accept(reference.url()) || !seen.add(reference.url())) {
                continue;
            }
            out.add(new ImageReference(reference.url(), reference.kind(), out.size()));
        }
        return out;
    }
}
