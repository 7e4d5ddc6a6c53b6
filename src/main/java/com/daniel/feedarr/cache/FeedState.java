package com.daniel.feedarr.cache;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FeedState {
    PENDING,
    SUCCESS,
    ERROR;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FeedState fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
