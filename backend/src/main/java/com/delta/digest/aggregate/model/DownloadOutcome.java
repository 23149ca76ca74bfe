package com.delta.digest.aggregate.model;

public enum DownloadOutcome {
    DOWNLOADED,
    ALREADY_PRESENT,
    FAILED
}
