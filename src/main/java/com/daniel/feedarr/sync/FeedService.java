package com.daniel.feedarr.sync;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.daniel.feedarr.cache.FeedCacheStore;
import com.daniel.feedarr.feed.FeedArtifactStore;
import com.daniel.feedarr.feed.FeedKind;

@Service
// Everything the HTTP layer may do with feeds goes through here.
public class FeedService {

    private static final Logger log = LoggerFactory.getLogger(FeedService.class);

    private final FeedSyncScheduler scheduler;
    private final FeedCacheStore cacheStore;
    private final FeedArtifactStore artifactStore;

    public FeedService(FeedSyncScheduler scheduler, FeedCacheStore cacheStore, FeedArtifactStore artifactStore) {
        this.scheduler = scheduler;
        this.cacheStore = cacheStore;
        this.artifactStore = artifactStore;
    }

    public Optional<byte[]> readArtifact(FeedKind kind) {
        return artifactStore.read(kind);
    }

    /*
     * Manual refresh: drop the cached payload first so the cycle has to go upstream.
     * - one kind: a failure is rethrown to the caller (UpstreamException, StorageException, ...)
     * - all kinds: per-kind outcomes are returned, partial failure included
     */
    public List<RefreshOutcome> refreshNow(FeedKind kind) {
        if (kind == null) {
            log.info("Manual update requested for all feeds");
            cacheStore.clearAll();
            return scheduler.runCycle();
        }

        log.info("Manual update requested for: {}", kind);
        cacheStore.clear(kind);
        RefreshOutcome outcome = scheduler.runCycle(kind);
        if (!outcome.success()) {
            throw outcome.failure();
        }
        return List.of(outcome);
    }

    // Cached payloads only; already written feed documents stay servable.
    public void clearCache(FeedKind kind) {
        if (kind == null) {
            cacheStore.clearAll();
        } else {
            cacheStore.clear(kind);
        }
    }

    public SchedulerStatus getStatus() {
        return scheduler.status();
    }
}
