package com.delta.digest.aggregate.media;

import com.delta.digest.aggregate.util.UrlUtils;

/**
 * Checks applied to every candidate regardless of where it was found.
 */
public final class ImageUrlFilter {
    private ImageUrlFilter() {
    }

    public static boolean accept(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        if (UrlUtils.isDataUri(url)) {
            return false;
        }
        return UrlUtils.isHttpUrl(url);
    }
}
