package com.daniel.feedarr.sync;

import com.daniel.feedarr.feed.FeedKind;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Result of one fetch-and-materialize pass for a single feed kind. Never persisted;
 * the durable trace is the feed status row written by the same pass.
 *
 * @param failure the exception that ended the pass, {@code null} on success
 */
public record RefreshOutcome(
        FeedKind feedKind,
        boolean success,
        RefreshSource source,
        int itemCount,
        String errorMessage,
        long durationMillis,
        @JsonIgnore RuntimeException failure
) {

    public static RefreshOutcome succeeded(FeedKind kind, RefreshSource source, int itemCount, long durationMillis) {
        return new RefreshOutcome(kind, true, source, itemCount, null, durationMillis, null);
    }

    public static RefreshOutcome failed(FeedKind kind, RefreshSource source, RuntimeException failure, long durationMillis) {
        return new RefreshOutcome(kind, false, source, 0, failure.getMessage(), durationMillis, failure);
    }
}
