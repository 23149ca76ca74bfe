package com.delta.digest.aggregate.source;

import com.delta.digest.aggregate.util.TextUtils;
import com.delta.digest.aggregate.util.TimestampParser;
import com.delta.digest.aggregate.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lenient RSS 2.0 / RSS 1.0 (RDF) / Atom parser on top of jsoup's XML mode.
 */
@Component
public class FeedParser {

    /**
     * @return the parsed items, or null when the payload has no feed root element
     */
    public List<FeedItem> parse(String xml, String baseUrl) {
        if (xml == null || xml.isBlank()) {
            return null;
        }
        Document doc = Jsoup.parse(xml, baseUrl == null ? "" : baseUrl, Parser.xmlParser());
        boolean atom = !doc.getElementsByTag("feed").isEmpty();
        boolean rss = !doc.getElementsByTag("rss").isEmpty() || !doc.getElementsByTag("rdf:RDF").isEmpty()
            || !doc.getElementsByTag("channel").isEmpty();
        if (!atom && !rss) {
            return null;
        }

        List<FeedItem> items = new ArrayList<>();
        if (atom) {
            for (Element entry : doc.getElementsByTag("entry")) {
                items.add(parseAtomEntry(entry, baseUrl));
            }
        }
        if (rss) {
            for (Element item : doc.getElementsByTag("item")) {
                items.add(parseRssItem(item, baseUrl));
            }
        }
        return items;
    }

    private FeedItem parseRssItem(Element item, String baseUrl) {
        String title = TextUtils.plainText(childText(item, "title"));
        String link = TextUtils.firstNonBlank(childText(item, "link"), childAttr(item, "atom:link", "href"));
        String guid = childText(item, "guid");
        if (link == null && guid != null && UrlUtils.isHttpUrl(guid)) {
            link = guid;
        }
        String summary = TextUtils.plainText(TextUtils.firstNonBlank(
            childText(item, "description"),
            childText(item, "content:encoded"),
            childText(item, "summary")
        ));
        Instant published = TimestampParser.parse(TextUtils.firstNonBlank(
            childText(item, "pubDate"),
            childText(item, "dc:date"),
            childText(item, "published"),
            childText(item, "updated")
        ));
        List<String> authors = new ArrayList<>();
        String author = TextUtils.firstNonBlank(childText(item, "author"), childText(item, "dc:creator"));
        if (author != null) {
            authors.add(TextUtils.plainText(author));
        }
        return new FeedItem(guid, title, resolve(baseUrl, link), summary, published, authors, mediaImages(item, baseUrl));
    }

    private FeedItem parseAtomEntry(Element entry, String baseUrl) {
        String title = TextUtils.plainText(childText(entry, "title"));
        String link = null;
        for (Element candidate : entry.children()) {
            if (!candidate.normalName().equals("link")) {
                continue;
            }
            String rel = candidate.attr("rel");
            String href = candidate.attr("href");
            if (href.isBlank()) {
                href = candidate.text();
            }
            if (rel.isBlank() || rel.equalsIgnoreCase("alternate")) {
                link = href;
                break;
            }
            if (link == null && !rel.equalsIgnoreCase("enclosure")) {
                link = href;
            }
        }
        String id = childText(entry, "id");
        if ((link == null || link.isBlank()) && id != null && UrlUtils.isHttpUrl(id)) {
            link = id;
        }
        String summary = TextUtils.plainText(TextUtils.firstNonBlank(childText(entry, "summary"), childText(entry, "content")));
        Instant published = TimestampParser.parse(TextUtils.firstNonBlank(
            childText(entry, "published"),
            childText(entry, "updated"),
            childText(entry, "dc:date")
        ));
        List<String> authors = new ArrayList<>();
        for (Element author : entry.children()) {
            if (author.normalName().equals("author")) {
                String name = TextUtils.firstNonBlank(childText(author, "name"), author.text());
                if (name != null) {
                    authors.add(TextUtils.collapseWhitespace(name));
                }
            }
        }
        return new FeedItem(id, title, resolve(baseUrl, link), summary, published, authors, mediaImages(entry, baseUrl));
    }

    private List<String> mediaImages(Element item, String baseUrl) {
        Set<String> urls = new LinkedHashSet<>();
        for (Element child : item.children()) {
            String name = child.normalName();
            String url = null;
            if (name.equals("enclosure") || (name.equals("link") && child.attr("rel").equalsIgnoreCase("enclosure"))) {
                if (isImageType(child.attr("type"))) {
                    url = TextUtils.firstNonBlank(child.attr("url"), child.attr("href"));
                }
            } else if (name.equals("media:content")) {
                if (child.attr("medium").equalsIgnoreCase("image") || isImageType(child.attr("type"))) {
                    url = child.attr("url");
                }
            } else if (name.equals("media:thumbnail")) {
                url = child.attr("url");
            } else if (name.equals("media:group")) {
                urls.addAll(mediaImages(child, baseUrl));
            }
            String resolved = resolve(baseUrl, url);
            if (resolved != null) {
                urls.add(resolved);
            }
        }
        return new ArrayList<>(urls);
    }

    private boolean isImageType(String type) {
        return type != null && type.toLowerCase(Locale.ROOT).startsWith("image/");
    }

    private String resolve(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String resolved = UrlUtils.resolve(baseUrl, href);
        return resolved == null ? href.trim() : resolved;
    }

    private String childText(Element parent, String name) {
        for (Element child : parent.children()) {
            if (child.normalName().equals(name.toLowerCase(Locale.ROOT))) {
                String text = child.text();
                return text == null || text.isBlank() ? null : text.trim();
            }
        }
        return null;
    }

    private String childAttr(Element parent, String name, String attr) {
        for (Element child : parent.children()) {
            if (child.normalName().equals(name.toLowerCase(Locale.ROOT)) && child.hasAttr(attr)) {
                return child.attr(attr);
            }
        }
        return null;
    }
}
