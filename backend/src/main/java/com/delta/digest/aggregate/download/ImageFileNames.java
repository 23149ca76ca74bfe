package com.delta.digest.aggregate.download;

import com.delta.digest.aggregate.model.Entry;
import com.delta.digest.aggregate.model.ImageReference;
import com.delta.digest.aggregate.util.UrlUtils;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic image file names: {@code <source>_<kind>_<entry>-<sequence>.<ext>}. Every part is derived
 * from stable entry attributes, so reruns map the same image to the same file.
 */
public final class ImageFileNames {
    public static final String DEFAULT_EXTENSION = "jpg";
    private static final Set<String> KNOWN_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "webp", "svg", "bmp", "avif");
    private static final Map<String, String> MEDIA_TYPE_EXTENSIONS = Map.of(
        "image/jpeg", "jpg",
        "image/jpg", "jpg",
        "image/pjpeg", "jpg",
        "image/png", "png",
        "image/gif", "gif",
        "image/webp", "webp",
        "image/svg+xml", "svg",
        "image/bmp", "bmp",
        "image/avif", "avif"
    );

    private ImageFileNames() {
    }

    public static String baseName(Entry entry, ImageReference image) {
        String source = sanitize(entry.sourceKey() != null ? entry.sourceKey() : entry.contentKind());
        String entryPart = entry.id().length() > 8 ? entry.id().substring(0, 8) : entry.id();
        return source + "_" + sanitize(image.kind()) + "_" + sanitize(entryPart) + "-" + image.sequence();
    }

    /**
     * Extension taken from the URL path when it is a known image extension, or null.
     */
    public static String extensionFromUrl(String url) {
        String extension = UrlUtils.pathExtension(url);
        if (extension == null || !KNOWN_EXTENSIONS.contains(extension)) {
            return null;
        }
        return extension.equals("jpeg") ? "jpg" : extension;
    }

    public static String extensionFromMediaType(String mediaType) {
        if (mediaType == null) {
            return null;
        }
        return MEDIA_TYPE_EXTENSIONS.get(mediaType.toLowerCase(Locale.ROOT));
    }

    static String sanitize(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        String cleaned = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]+", "-").replaceAll("(^-+|-+$)", "");
        return cleaned.isEmpty() ? "unknown" : cleaned;
    }
}
