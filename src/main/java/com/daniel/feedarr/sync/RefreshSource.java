package com.daniel.feedarr.sync;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

// Where the payload of one refresh came from.
public enum RefreshSource {
    CACHE,
    UPSTREAM,
    NONE;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
