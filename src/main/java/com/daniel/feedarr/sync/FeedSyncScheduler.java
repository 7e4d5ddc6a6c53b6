package com.daniel.feedarr.sync;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import com.daniel.feedarr.cache.CacheStatistics;
import com.daniel.feedarr.cache.FeedCacheStore;
import com.daniel.feedarr.cache.FeedStatus;
import com.daniel.feedarr.config.FeedarrProperties;
import com.daniel.feedarr.feed.FeedKind;
import com.daniel.feedarr.feed.RssFeedService;
import com.daniel.feedarr.upstream.CalendarQuery;
import com.daniel.feedarr.upstream.FeedRecords;
import com.daniel.feedarr.upstream.MediaServerClient;
import com.daniel.feedarr.upstream.QueueQuery;
import com.fasterxml.jackson.databind.JsonNode;

@Service
public class FeedSyncScheduler implements SmartLifecycle {

    /*
     * Drives refresh cycles: Stopped -> start() -> Running -> stop() -> Stopped.
     * - one recurring job ("rss-fetcher") while running, never two
     * - a cycle refreshes the three kinds in parallel; one failing kind never stops the others
     * - a fresh cache entry means no upstream call for that kind
     * - every refresh attempt writes exactly one feed status row
     */
    private static final Logger log = LoggerFactory.getLogger(FeedSyncScheduler.class);

    static final String JOB_NAME = "rss-fetcher";
    private static final Duration MIN_INTERVAL = Duration.ofMinutes(1);

    private final FeedCacheStore cacheStore;
    private final MediaServerClient mediaServerClient;
    private final RssFeedService rssFeedService;
    private final FeedarrProperties properties;
    private final TaskScheduler taskScheduler;
    private final Executor refreshExecutor;
    private final Clock clock;

    // Timer ticks and manual refreshes may overlap; same-kind refreshes run one at a time.
    private final Map<FeedKind, ReentrantLock> refreshLocks = new EnumMap<>(FeedKind.class);
    private final Map<FeedKind, Instant> lastFetchTimes = new ConcurrentHashMap<>();

    private final Object lifecycleMonitor = new Object();
    private ScheduledFuture<?> scheduledJob;

    public FeedSyncScheduler(
            FeedCacheStore cacheStore,
            MediaServerClient mediaServerClient,
            RssFeedService rssFeedService,
            FeedarrProperties properties,
            @Qualifier("feedSyncTaskScheduler") TaskScheduler taskScheduler,
            @Qualifier("feedRefreshExecutor") Executor refreshExecutor,
            Clock clock) {
        this.cacheStore = cacheStore;
        this.mediaServerClient = mediaServerClient;
        this.rssFeedService = rssFeedService;
        this.properties = properties;
        this.taskScheduler = taskScheduler;
        this.refreshExecutor = refreshExecutor;
        this.clock = clock;
        for (FeedKind kind : FeedKind.values()) {
            refreshLocks.put(kind, new ReentrantLock());
        }
    }

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (scheduledJob != null) {
                log.warn("RSS feed scheduler is already running, ignoring start()");
                return;
            }
            Duration interval = refreshInterval();
            log.info("Starting RSS feed scheduler: fetch frequency {} ms, running every {} minute(s)",
                    properties.effectiveFetchFrequency().toMillis(), interval.toMinutes());

            Instant firstTick = taskScheduler.getClock().instant().plus(interval);
            scheduledJob = taskScheduler.scheduleAtFixedRate(this::runScheduledCycle, firstTick, interval);

            // Initial fetch, without waiting for the first tick.
            taskScheduler.schedule(this::runScheduledCycle, taskScheduler.getClock().instant());
        }
        log.info("RSS feed scheduler started");
    }

    // No-op when already stopped. A cycle that is already running is allowed to finish.
    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (scheduledJob == null) {
                return;
            }
            scheduledJob.cancel(false);
            scheduledJob = null;
        }
        log.info("Stopped job: {}", JOB_NAME);
    }

    @Override
    public boolean isRunning() {
        synchronized (lifecycleMonitor) {
            return scheduledJob != null;
        }
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getScheduler().isEnabled();
    }

    /*
     * Whole minutes only: frequency / 1 minute, rounded down, at least one.
     * 300000 ms -> 5 minutes, 90000 ms -> 1 minute, 20000 ms -> 1 minute.
     */
    public Duration refreshInterval() {
        long minutes = properties.effectiveFetchFrequency().toMinutes();
        return minutes < 1 ? MIN_INTERVAL : Duration.ofMinutes(minutes);
    }

    // Refreshes every kind and waits for all of them.
    public List<RefreshOutcome> runCycle() {
        long startNanos = System.nanoTime();
        log.info("Starting RSS feed update cycle");

        List<CompletableFuture<RefreshOutcome>> futures = Arrays.stream(FeedKind.values())
                .map(this::submitRefresh)
                .toList();
        List<RefreshOutcome> outcomes = futures.stream()
                .map(CompletableFuture::join)
                .toList();

        long failed = outcomes.stream().filter(outcome -> !outcome.success()).count();
        log.info("RSS feed update cycle completed in {} ms ({} succeeded, {} failed)",
                elapsedMillis(startNanos), outcomes.size() - failed, failed);
        return outcomes;
    }

    public RefreshOutcome runCycle(FeedKind kind) {
        return refresh(kind);
    }

    // Unknown names are rejected here, before any cache or network access.
    public RefreshOutcome runCycle(String kindId) {
        return refresh(FeedKind.fromId(kindId));
    }

    public SchedulerStatus status() {
        Map<String, Instant> fetchTimes = new TreeMap<>();
        lastFetchTimes.forEach((kind, at) -> fetchTimes.put(kind.id(), at));
        boolean running = isRunning();

        CacheStatistics statistics = null;
        String databaseError = null;
        try {
            statistics = cacheStore.statistics();
        } catch (RuntimeException ex) {
            log.error("Error getting database statistics: {}", ex.getMessage());
            databaseError = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        }

        return new SchedulerStatus(
                running,
                properties.effectiveFetchFrequency().toMillis(),
                fetchTimes,
                running ? List.of(JOB_NAME) : List.of(),
                statistics,
                databaseError);
    }

    public Optional<Instant> lastFetchTime(FeedKind kind) {
        return Optional.ofNullable(lastFetchTimes.get(kind));
    }

    // Timer entry point: nothing may escape, or the recurring job would be cancelled.
    private void runScheduledCycle() {
        try {
            runCycle();
        } catch (RuntimeException ex) {
            log.error("Error during RSS feed update cycle: {}", ex.getMessage(), ex);
        }
    }

    private CompletableFuture<RefreshOutcome> submitRefresh(FeedKind kind) {
        try {
            return CompletableFuture.supplyAsync(() -> refresh(kind), refreshExecutor);
        } catch (RejectedExecutionException ex) {
            log.warn("Refresh of {} rejected: {}", kind, ex.getMessage());
            return CompletableFuture.completedFuture(RefreshOutcome.failed(kind, RefreshSource.NONE, ex, 0));
        }
    }

    private RefreshOutcome refresh(FeedKind kind) {
        ReentrantLock lock = refreshLocks.get(kind);
        lock.lock();
        try {
            return refreshLocked(kind);
        } finally {
            lock.unlock();
        }
    }

    private RefreshOutcome refreshLocked(FeedKind kind) {
        long startNanos = System.nanoTime();
        RefreshSource source = RefreshSource.NONE;
        FeedRecords records;
        try {
            Optional<JsonNode> cached = cacheStore.get(kind);
            JsonNode payload;
            if (cached.isPresent()) {
                payload = cached.get();
                source = RefreshSource.CACHE;
            } else {
                payload = fetch(kind);
                source = RefreshSource.UPSTREAM;
                cacheStore.put(kind, payload);
            }
            records = FeedRecords.from(payload);
            log.info("{} {} items for {} feed", source == RefreshSource.CACHE ? "Using cached" : "Retrieved",
                    records.size(), kind);
            rssFeedService.materialize(kind, records);
        } catch (RuntimeException ex) {
            log.warn("Error updating {} feed: {}", kind, ex.getMessage());
            return recordFailure(kind, source, ex, startNanos);
        }

        Instant finishedAt = clock.instant();
        try {
            cacheStore.recordStatus(FeedStatus.success(kind, finishedAt, records.size()));
        } catch (RuntimeException ex) {
            log.error("Updated {} feed but could not record its status: {}", kind, ex.getMessage());
            return RefreshOutcome.failed(kind, source, ex, elapsedMillis(startNanos));
        }
        lastFetchTimes.put(kind, finishedAt);
        log.info("{} RSS feed updated successfully", kind);
        return RefreshOutcome.succeeded(kind, source, records.size(), elapsedMillis(startNanos));
    }

    // The previous artifact is left as it was and stays servable.
    private RefreshOutcome recordFailure(FeedKind kind, RefreshSource source, RuntimeException failure, long startNanos) {
        String message = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
        try {
            cacheStore.recordStatus(FeedStatus.error(kind, clock.instant(), message));
        } catch (RuntimeException ex) {
            log.error("Could not record error status for {} feed: {}", kind, ex.getMessage());
            failure.addSuppressed(ex);
        }
        return RefreshOutcome.failed(kind, source, failure, elapsedMillis(startNanos));
    }

    private JsonNode fetch(FeedKind kind) {
        return switch (kind) {
            case CALENDAR -> mediaServerClient.fetchCalendar(calendarQuery());
            case NOTIFICATION -> mediaServerClient.fetchNotifications();
            case QUEUE -> mediaServerClient.fetchQueue(
                    new QueueQuery(properties.effectiveQueuePageSize(), false));
        };
    }

    // Upcoming releases from today up to N days ahead, monitored movies only.
    CalendarQuery calendarQuery() {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        return new CalendarQuery(today.plusDays(properties.effectiveCalendarDaysAhead()), false);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
