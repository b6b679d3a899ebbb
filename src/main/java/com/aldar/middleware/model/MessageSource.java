package com.aldar.middleware.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a transcript entry came from.
 */
public enum MessageSource {

    RUN_LOG("run_log"),
    LEDGER("ledger"),
    STREAM_PLACEHOLDER("stream_placeholder");

    private final String wireName;

    MessageSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
