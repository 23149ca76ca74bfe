package com.delta.digest.aggregate.model;

public enum SourceStatus {
    OK,
    EMPTY,
    FAILED,
    CONFIG_INVALID
}
