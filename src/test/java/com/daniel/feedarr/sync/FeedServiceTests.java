package com.daniel.feedarr.sync;

import static com.daniel.feedarr.support.TestJson.json;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import com.daniel.feedarr.cache.FeedCacheStore;
import com.daniel.feedarr.config.FeedarrProperties;
import com.daniel.feedarr.feed.FeedArtifactStore;
import com.daniel.feedarr.feed.FeedKind;
import com.daniel.feedarr.feed.RssFeedService;
import com.daniel.feedarr.upstream.FeedRecords;
import com.daniel.feedarr.upstream.UpstreamException;
import com.fasterxml.jackson.databind.ObjectMapper;

class FeedServiceTests {

    private FeedSyncScheduler scheduler;
    private FeedCacheStore cacheStore;
    private FeedArtifactStore artifactStore;
    private FeedService feedService;

    @BeforeEach
    void setUp() {
        scheduler = mock(FeedSyncScheduler.class);
        cacheStore = mock(FeedCacheStore.class);
        artifactStore = mock(FeedArtifactStore.class);
        feedService = new FeedService(scheduler, cacheStore, artifactStore);
    }

    @Test
    void refreshOfOneKindClearsItsCacheFirst() {
        RefreshOutcome outcome = RefreshOutcome.succeeded(FeedKind.CALENDAR, RefreshSource.UPSTREAM, 3, 12);
        when(scheduler.runCycle(FeedKind.CALENDAR)).thenReturn(outcome);

        List<RefreshOutcome> outcomes = feedService.refreshNow(FeedKind.CALENDAR);

        assertEquals(List.of(outcome), outcomes);
        InOrder order = inOrder(cacheStore, scheduler);
        order.verify(cacheStore).clear(FeedKind.CALENDAR);
        order.verify(scheduler).runCycle(FeedKind.CALENDAR);
    }

    @Test
    void failedRefreshOfOneKindIsRethrown() {
        UpstreamException failure = new UpstreamException(500, "GET /queue failed with HTTP 500", null);
        when(scheduler.runCycle(FeedKind.QUEUE))
                .thenReturn(RefreshOutcome.failed(FeedKind.QUEUE, RefreshSource.NONE, failure, 4));

        UpstreamException thrown = assertThrows(UpstreamException.class, () -> feedService.refreshNow(FeedKind.QUEUE));
        assertSame(failure, thrown);
    }

    // Refreshing everything reports partial failure instead of throwing.
    @Test
    void refreshOfAllKindsReturnsEveryOutcome() {
        List<RefreshOutcome> outcomes = List.of(
                RefreshOutcome.succeeded(FeedKind.CALENDAR, RefreshSource.UPSTREAM, 1, 5),
                RefreshOutcome.failed(FeedKind.NOTIFICATION, RefreshSource.NONE, new UpstreamException(502, "bad gateway", null), 5),
                RefreshOutcome.succeeded(FeedKind.QUEUE, RefreshSource.UPSTREAM, 0, 5));
        when(scheduler.runCycle()).thenReturn(outcomes);

        assertEquals(outcomes, feedService.refreshNow(null));
        verify(cacheStore).clearAll();
    }

    @Test
    void clearCacheTargetsOneKindOrAll() {
        feedService.clearCache(FeedKind.NOTIFICATION);
        verify(cacheStore).clear(FeedKind.NOTIFICATION);

        feedService.clearCache(null);
        verify(cacheStore).clearAll();
    }

    @Test
    void readArtifactComesFromTheArtifactStore() {
        when(artifactStore.read(FeedKind.QUEUE)).thenReturn(Optional.of("<rss/>".getBytes(StandardCharsets.UTF_8)));

        assertTrue(feedService.readArtifact(FeedKind.QUEUE).isPresent());
        assertTrue(feedService.readArtifact(FeedKind.CALENDAR).isEmpty());
    }

    // Clearing cached payloads, for one kind or all, never touches the generated documents.
    @Test
    void clearingCachesKeepsEveryGeneratedDocument(@TempDir Path feedsDir) {
        EmbeddedDatabase database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("schema.sql")
                .build();
        try {
            Clock clock = Clock.fixed(Instant.parse("2026-10-19T09:00:00Z"), ZoneOffset.UTC);
            FeedarrProperties properties = new FeedarrProperties();
            properties.setFeedsDir(feedsDir.toString());
            FeedCacheStore realCacheStore = new FeedCacheStore(new JdbcTemplate(database),
                    new DataSourceTransactionManager(database), new ObjectMapper(), clock, properties);
            FeedArtifactStore realArtifactStore = new FeedArtifactStore(properties);
            RssFeedService rssFeedService = new RssFeedService(properties, realArtifactStore, clock);
            FeedService service = new FeedService(scheduler, realCacheStore, realArtifactStore);

            Map<FeedKind, byte[]> documents = new EnumMap<>(FeedKind.class);
            for (FeedKind kind : FeedKind.values()) {
                realCacheStore.put(kind, json("[{'id':1,'title':'Item'}]"));
                documents.put(kind, rssFeedService.materialize(kind, FeedRecords.from(json("[{'id':1,'title':'Item'}]"))).content());
            }

            service.clearCache(FeedKind.CALENDAR);

            assertTrue(realCacheStore.get(FeedKind.CALENDAR).isEmpty());
            assertTrue(realCacheStore.get(FeedKind.NOTIFICATION).isPresent());
            assertTrue(realCacheStore.get(FeedKind.QUEUE).isPresent());
            for (FeedKind kind : FeedKind.values()) {
                assertArrayEquals(documents.get(kind), service.readArtifact(kind).orElseThrow());
            }

            service.clearCache(null);

            assertEquals(0, realCacheStore.statistics().totalCacheEntries());
            for (FeedKind kind : FeedKind.values()) {
                assertArrayEquals(documents.get(kind), service.readArtifact(kind).orElseThrow());
            }
        } finally {
            database.shutdown();
        }
    }
}
