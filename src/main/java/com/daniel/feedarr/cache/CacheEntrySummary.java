package com.daniel.feedarr.cache;

import java.time.Instant;

import com.daniel.feedarr.feed.FeedKind;

public record CacheEntrySummary(
        FeedKind feedKind,
        Instant createdAt,
        Instant updatedAt,
        boolean fresh
) {
}
