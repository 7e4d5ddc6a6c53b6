package com.daniel.feedarr.cache;

import java.time.Instant;

import com.daniel.feedarr.feed.FeedKind;

// Outcome of the most recent refresh attempt for one feed kind (one row per kind).
public record FeedStatus(
        FeedKind feedKind,
        Instant lastFetch,
        int itemCount,
        FeedState state,
        String errorMessage
) {

    public FeedStatus {
        if (itemCount < 0) {
            throw new IllegalArgumentException("itemCount must not be negative: " + itemCount);
        }
    }

    public static FeedStatus success(FeedKind kind, Instant fetchedAt, int itemCount) {
        return new FeedStatus(kind, fetchedAt, itemCount, FeedState.SUCCESS, null);
    }

    public static FeedStatus error(FeedKind kind, Instant fetchedAt, String errorMessage) {
        return new FeedStatus(kind, fetchedAt, 0, FeedState.ERROR, errorMessage);
    }
}
