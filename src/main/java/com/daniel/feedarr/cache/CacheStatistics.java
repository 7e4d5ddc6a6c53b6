package com.daniel.feedarr.cache;

import java.util.List;

// Read-only view over both tables for /rss/status and /health.
public record CacheStatistics(
        List<FeedStatus> feedStatuses,
        List<CacheEntrySummary> cacheEntries,
        int totalCacheEntries
) {

    public static CacheStatistics empty() {
        return new CacheStatistics(List.of(), List.of(), 0);
    }
}
