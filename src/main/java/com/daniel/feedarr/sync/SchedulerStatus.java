package com.daniel.feedarr.sync;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.daniel.feedarr.cache.CacheStatistics;

/*
 * Snapshot for /rss/status and /health.
 * database is null when the cache store could not be read; databaseError then says why.
 */
public record SchedulerStatus(
        boolean running,
        long fetchFrequencyMillis,
        Map<String, Instant> lastFetchTimes,
        List<String> activeJobs,
        CacheStatistics database,
        String databaseError
) {
}
