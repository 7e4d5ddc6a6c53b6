package com.daniel.feedarr.cache;

import static com.daniel.feedarr.support.TestJson.json;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.TimeZone;

import javax.sql.DataSource;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import com.daniel.feedarr.config.FeedarrProperties;
import com.daniel.feedarr.feed.FeedKind;
import com.daniel.feedarr.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

class FeedCacheStoreTests {

    private static final Duration TTL = Duration.ofMinutes(10);

    private EmbeddedDatabase database;
    private MutableClock clock;
    private FeedCacheStore store;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("schema.sql")
                .build();
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        store = newStore(database, clock);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void freshEntryRoundTripsPayload() {
        JsonNode payload = json("[{'id':1,'title':'Dune','genres':['Sci-Fi','Drama'],'hasFile':false,'size':1.5}]");
        store.put(FeedKind.CALENDAR, payload);

        assertEquals(Optional.of(payload), store.get(FeedKind.CALENDAR));
    }

    @Test
    void entryExpiresExactlyAtTtl() {
        store.put(FeedKind.QUEUE, json("{'records':[]}"));

        clock.advance(TTL.minusMillis(1));
        assertTrue(store.get(FeedKind.QUEUE).isPresent());

        clock.advance(Duration.ofMillis(1));
        assertTrue(store.get(FeedKind.QUEUE).isEmpty());
    }

    // 06:30Z on 2026-11-01 falls in the hour New York repeats when DST ends.
    @Test
    void freshEntryStaysFreshDuringRepeatedDstHour() {
        TimeZone original = TimeZone.getDefault();
        TimeZone.setDefault(TimeZone.getTimeZone("America/New_York"));
        try {
            MutableClock dstClock = new MutableClock(Instant.parse("2026-11-01T06:30:00Z"));
            FeedCacheStore dstStore = newStore(database, dstClock);
            dstStore.put(FeedKind.CALENDAR, json("[{'id':1}]"));

            dstClock.advance(Duration.ofMinutes(1));

            assertTrue(dstStore.get(FeedKind.CALENDAR).isPresent());
            assertEquals(Instant.parse("2026-11-01T06:30:00Z"), dstStore.statistics().cacheEntries().get(0).updatedAt());
        } finally {
            TimeZone.setDefault(original);
        }
    }

    // A stale row is not served but stays in the table until it is overwritten.
    @Test
    void staleEntryIsKeptAndReportedAsNotFresh() {
        store.put(FeedKind.NOTIFICATION, json("[]"));
        clock.advance(TTL.plusMinutes(1));

        assertTrue(store.get(FeedKind.NOTIFICATION).isEmpty());

        CacheStatistics statistics = store.statistics();
        assertEquals(1, statistics.totalCacheEntries());
        assertFalse(statistics.cacheEntries().get(0).fresh());
    }

    @Test
    void overwriteKeepsCreatedAtAndMovesUpdatedAt() {
        Instant first = clock.instant();
        store.put(FeedKind.CALENDAR, json("[{'id':1}]"));

        clock.advance(Duration.ofMinutes(3));
        store.put(FeedKind.CALENDAR, json("[{'id':2}]"));

        CacheEntrySummary entry = store.statistics().cacheEntries().get(0);
        assertEquals(first, entry.createdAt());
        assertEquals(first.plus(Duration.ofMinutes(3)), entry.updatedAt());
        assertEquals(Optional.of(json("[{'id':2}]")), store.get(FeedKind.CALENDAR));
        assertEquals(1, store.statistics().totalCacheEntries());
    }

    @Test
    void clearingOneKindLeavesTheOthers() {
        store.put(FeedKind.CALENDAR, json("[]"));
        store.put(FeedKind.QUEUE, json("[]"));

        store.clear(FeedKind.CALENDAR);

        assertTrue(store.get(FeedKind.CALENDAR).isEmpty());
        assertTrue(store.get(FeedKind.QUEUE).isPresent());
    }

    @Test
    void clearingMissingEntriesIsNotAnError() {
        store.clear(FeedKind.NOTIFICATION);
        store.clear(FeedKind.NOTIFICATION);
        store.clearAll();

        assertEquals(0, store.statistics().totalCacheEntries());
    }

    @Test
    void clearAllEmptiesCacheButKeepsStatuses() {
        store.put(FeedKind.CALENDAR, json("[]"));
        store.put(FeedKind.QUEUE, json("[]"));
        store.recordStatus(FeedStatus.success(FeedKind.QUEUE, clock.instant(), 0));

        store.clearAll();

        assertEquals(0, store.statistics().totalCacheEntries());
        assertTrue(store.findStatus(FeedKind.QUEUE).isPresent());
    }

    @Test
    void statusIsUpsertedOnePerKind() {
        Instant fetchedAt = clock.instant();
        store.recordStatus(FeedStatus.success(FeedKind.CALENDAR, fetchedAt, 4));
        store.recordStatus(FeedStatus.error(FeedKind.CALENDAR, fetchedAt.plusSeconds(60), "HTTP 500"));

        List<FeedStatus> statuses = store.statistics().feedStatuses();
        assertEquals(1, statuses.size());

        FeedStatus status = statuses.get(0);
        assertEquals(FeedState.ERROR, status.state());
        assertEquals(0, status.itemCount());
        assertEquals("HTTP 500", status.errorMessage());
        assertEquals(fetchedAt.plusSeconds(60), status.lastFetch());
    }

    @Test
    void successClearsPreviousErrorMessage() {
        store.recordStatus(FeedStatus.error(FeedKind.QUEUE, clock.instant(), "timeout"));
        store.recordStatus(FeedStatus.success(FeedKind.QUEUE, clock.instant(), 7));

        FeedStatus status = store.findStatus(FeedKind.QUEUE).orElseThrow();
        assertEquals(FeedState.SUCCESS, status.state());
        assertEquals(7, status.itemCount());
        assertNull(status.errorMessage());
    }

    @Test
    void statisticsAreEmptyForNewDatabase() {
        CacheStatistics statistics = store.statistics();

        assertTrue(statistics.feedStatuses().isEmpty());
        assertTrue(statistics.cacheEntries().isEmpty());
        assertEquals(0, statistics.totalCacheEntries());
    }

    @Test
    void databaseFailureSurfacesAsStorageException() {
        new JdbcTemplate(database).execute("DROP TABLE feed_cache");

        assertThrows(StorageException.class, () -> store.get(FeedKind.CALENDAR));
        assertThrows(StorageException.class, () -> store.put(FeedKind.CALENDAR, json("[]")));
    }

    // Entries written before a restart are still there, and still fresh, afterwards.
    @Test
    void entriesSurviveReopeningTheDatabaseFile(@TempDir Path tempDir) {
        String url = "jdbc:h2:file:" + tempDir.resolve("feedarr").toAbsolutePath();
        JsonNode payload = json("[{'id':9,'name':'Discord'}]");

        FeedCacheStore before = newStore(fileDataSource(url), clock);
        before.put(FeedKind.NOTIFICATION, payload);
        before.recordStatus(FeedStatus.success(FeedKind.NOTIFICATION, clock.instant(), 1));

        clock.advance(Duration.ofMinutes(1));
        FeedCacheStore after = newStore(fileDataSource(url), clock);

        assertEquals(Optional.of(payload), after.get(FeedKind.NOTIFICATION));
        assertEquals(1, after.findStatus(FeedKind.NOTIFICATION).orElseThrow().itemCount());
    }

    private static DataSource fileDataSource(String url) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(url, "sa", "");
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
        return dataSource;
    }

    private static FeedCacheStore newStore(DataSource dataSource, MutableClock clock) {
        FeedarrProperties properties = new FeedarrProperties();
        properties.setCacheTtl(TTL);
        return new FeedCacheStore(
                new JdbcTemplate(dataSource),
                new DataSourceTransactionManager(dataSource),
                new ObjectMapper(),
                clock,
                properties);
    }
}
