package com.delta.digest.aggregate.media;

import com.delta.digest.aggregate.model.ImageReference;
import com.delta.digest.aggregate.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks figure images out of a paper's HTML rendering, in document order.
 */
public class PaperFigureScanner {
    private static final Logger log = LoggerFactory.getLogger(PaperFigureScanner.class);
    private static final Pattern FORMULA = Pattern.compile(
        "formula|inline|math|equation|latex|ltx_math|(?<![a-z])tex(?![a-z])",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern ICON = Pattern.compile("icon|logo|badge|avatar", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIAGRAM = Pattern.compile("arch|overview|pipeline|framework|diagram|flow", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBERED_FIGURE = Pattern.compile("^(x|fig|figure)[-_]?\\d+", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(\\d+)");

    private final int maxFigures;
    private final int minDimension;

    public PaperFigureScanner(int maxFigures, int minDimension) {
        this.maxFigures = maxFigures;
        this.minDimension = minDimension;
    }

    public List<ImageReference> scan(String html, String pageUrl) {
        Document doc = Jsoup.parse(html, pageUrl);
        Set<String> seen = new LinkedHashSet<>();
        List<ImageReference> figures = new ArrayList<>();
        for (Element img : doc.select("img[src]")) {
            if (figures.size() >= maxFigures) {
                break;
            }
            String src = img.attr("src").trim();
            if (src.isEmpty() || UrlUtils.isDataUri(src)) {
                continue;
            }
            if (isFormula(img, src) || ICON.matcher(src).find()) {
                log.debug("Skipping non-figure image {}", src);
                continue;
            }
            if (tooSmall(img)) {
                log.debug("Skipping undersized image {}", src);
                continue;
            }
            String absolute = img.attr("abs:src");
            if (!ImageUrlFilter.accept(absolute) || !seen.add(absolute)) {
                continue;
            }
            figures.add(new ImageReference(absolute, classify(img, absolute), figures.size()));
        }
        return figures;
    }

    private boolean isFormula(Element img, String src) {
        return FORMULA.matcher(src).find()
            || FORMULA.matcher(img.attr("alt")).find()
            || FORMULA.matcher(img.className()).find();
    }

    /**
     * Only judged when both dimensions are declared; undeclared sizes keep the image.
     */
    private boolean tooSmall(Element img) {
        Integer width = dimension(img, "width");
        Integer height = dimension(img, "height");
        if (width == null || height == null) {
            return false;
        }
        return width < minDimension || height < minDimension;
    }

    private Integer dimension(Element img, String name) {
        Integer value = parseLeadingInt(img.attr(name));
        if (value == null || value == 0) {
            value = parseLeadingInt(img.attr("data-" + name));
        }
        return value == null || value == 0 ? null : value;
    }

    static Integer parseLeadingInt(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        Matcher matcher = LEADING_NUMBER.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String classify(Element img, String url) {
        String fileName = UrlUtils.lastPathSegment(url).toLowerCase(Locale.ROOT);
        if (DIAGRAM.matcher(fileName).find()) {
            return ImageReference.KIND_DIAGRAM;
        }
        if (img.closest("figure") != null || NUMBERED_FIGURE.matcher(fileName).find()) {
            return ImageReference.KIND_FIGURE;
        }
        return ImageReference.KIND_IMAGE;
    }
}
