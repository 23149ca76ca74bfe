package com.delta.digest.aggregate.service;

/**
 * A caller-supplied source parameter is unusable (unknown type, bad date, missing or malformed URL, ...).
 */
public class InvalidSourceConfigException extends RuntimeException {
    private final String sourceKey;

    public InvalidSourceConfigException(String sourceKey, String message) {
        super(message);
        this.sourceKey = sourceKey;
    }

    public InvalidSourceConfigException(String sourceKey, String message, Throwable cause) {
        super(message, cause);
        this.sourceKey = sourceKey;
    }

    public String getSourceKey() {
        return sourceKey;
    }
}
