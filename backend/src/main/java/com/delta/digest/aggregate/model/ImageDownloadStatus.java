package com.delta.digest.aggregate.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Per-image line of the download report; one per requested {@link ImageReference}, in input order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ImageDownloadStatus(
    String entryId,
    int sequence,
    String url,
    String fileName,
    String localPath,
    DownloadOutcome outcome,
    String errorKey,
    String reasonCode
) {
    @JsonIgnore
    public boolean isSatisfied() {
        return outcome == DownloadOutcome.DOWNLOADED || outcome == DownloadOutcome.ALREADY_PRESENT;
    }
}
