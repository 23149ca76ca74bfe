package com.delta.digest.aggregate.api;

import com.delta.digest.config.DigestProperties.SourceProperties;

import java.util.List;

/**
 * @param date           optional target day (YYYY-MM-DD)
 * @param sources        replaces the configured sources when non-empty
 * @param downloadImages download candidates into the configured image directory
 */
public record DigestApiRunRequest(
    String date,
    List<SourceProperties> sources,
    Boolean downloadImages
) {
}
