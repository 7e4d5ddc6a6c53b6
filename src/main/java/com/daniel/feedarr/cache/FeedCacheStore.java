package com.daniel.feedarr.cache;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import com.daniel.feedarr.config.FeedarrProperties;
import com.daniel.feedarr.feed.FeedKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

@Repository
public class FeedCacheStore {

    /*
     * Durable store for the last raw upstream payload and the last refresh status of each feed kind.
     * - feed_cache: at most one row per kind, treated as absent once older than the TTL
     * - feed_metadata: at most one row per kind, written after every refresh attempt
     * Stale rows are never deleted here; they stay until the next put() overwrites them.
     */
    private static final Logger log = LoggerFactory.getLogger(FeedCacheStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;

    // Upserts are UPDATE-then-INSERT, so concurrent writers of the same kind must take turns.
    private final Map<FeedKind, ReentrantLock> writeLocks = new EnumMap<>(FeedKind.class);

    public FeedCacheStore(
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            ObjectMapper objectMapper,
            Clock clock,
            FeedarrProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ttl = properties.effectiveCacheTtl();
        for (FeedKind kind : FeedKind.values()) {
            writeLocks.put(kind, new ReentrantLock());
        }
    }

    // Missing and stale look the same to the caller: both are Optional.empty().
    public Optional<JsonNode> get(FeedKind kind) {
        List<StoredPayload> rows = storage("read cache for " + kind, () -> jdbcTemplate.query(
                "SELECT payload, updated_at FROM feed_cache WHERE feed_type = ?",
                (rs, rowNum) -> new StoredPayload(rs.getString("payload"), toInstant(rs, "updated_at")),
                kind.id()));
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        StoredPayload row = rows.get(0);
        if (!isFresh(row.updatedAt(), clock.instant())) {
            log.debug("Cache entry for {} is stale (updated {})", kind, row.updatedAt());
            return Optional.empty();
        }
        return Optional.of(readJson(kind, row.payload()));
    }

    public void put(FeedKind kind, JsonNode payload) {
        String json = writeJson(kind, payload);
        OffsetDateTime now = toUtc(clock.instant());

        withWriteLock(kind, "write cache for " + kind, () -> {
            int updated = jdbcTemplate.update(
                    "UPDATE feed_cache SET payload = ?, updated_at = ? WHERE feed_type = ?",
                    json, now, kind.id());
            if (updated == 0) {
                // created_at is only ever set here, on first insert.
                jdbcTemplate.update(
                        "INSERT INTO feed_cache (feed_type, payload, created_at, updated_at) VALUES (?, ?, ?, ?)",
                        kind.id(), json, now, now);
            }
        });
    }

    // Clearing a kind that has no row is fine.
    public void clear(FeedKind kind) {
        withWriteLock(kind, "clear cache for " + kind,
                () -> jdbcTemplate.update("DELETE FROM feed_cache WHERE feed_type = ?", kind.id()));
        log.info("Cleared cached payload for {}", kind);
    }

    public void clearAll() {
        storage("clear cache", () -> jdbcTemplate.update("DELETE FROM feed_cache"));
        log.info("Cleared cached payloads for all feeds");
    }

    public void recordStatus(FeedStatus status) {
        FeedKind kind = status.feedKind();
        OffsetDateTime lastFetch = status.lastFetch() == null ? null : toUtc(status.lastFetch());
        OffsetDateTime now = toUtc(clock.instant());
        String state = status.state().dbValue();

        withWriteLock(kind, "record status for " + kind, () -> {
            int updated = jdbcTemplate.update(
                    "UPDATE feed_metadata SET last_fetch = ?, item_count = ?, status = ?, error_message = ?, updated_at = ?"
                            + " WHERE feed_type = ?",
                    lastFetch, status.itemCount(), state, status.errorMessage(), now, kind.id());
            if (updated == 0) {
                jdbcTemplate.update(
                        "INSERT INTO feed_metadata (feed_type, last_fetch, item_count, status, error_message, updated_at)"
                                + " VALUES (?, ?, ?, ?, ?, ?)",
                        kind.id(), lastFetch, status.itemCount(), state, status.errorMessage(), now);
            }
        });
    }

    public Optional<FeedStatus> findStatus(FeedKind kind) {
        List<FeedStatus> rows = storage("read status for " + kind, () -> jdbcTemplate.query(
                "SELECT feed_type, last_fetch, item_count, status, error_message FROM feed_metadata WHERE feed_type = ?",
                (rs, rowNum) -> toFeedStatus(rs),
                kind.id()));
        return rows.stream().findFirst();
    }

    public CacheStatistics statistics() {
        Instant now = clock.instant();
        List<FeedStatus> statuses = storage("read feed statistics", () -> jdbcTemplate.query(
                "SELECT feed_type, last_fetch, item_count, status, error_message FROM feed_metadata ORDER BY feed_type",
                (rs, rowNum) -> toFeedStatus(rs)));
        List<CacheEntrySummary> entries = storage("read cache statistics", () -> jdbcTemplate.query(
                "SELECT feed_type, created_at, updated_at FROM feed_cache ORDER BY feed_type",
                (rs, rowNum) -> {
                    Instant updatedAt = toInstant(rs, "updated_at");
                    return new CacheEntrySummary(
                            FeedKind.fromId(rs.getString("feed_type")),
                            toInstant(rs, "created_at"),
                            updatedAt,
                            isFresh(updatedAt, now));
                }));
        return new CacheStatistics(statuses, entries, entries.size());
    }

    private boolean isFresh(Instant updatedAt, Instant now) {
        return updatedAt != null && Duration.between(updatedAt, now).compareTo(ttl) < 0;
    }

    private void withWriteLock(FeedKind kind, String action, Runnable work) {
        ReentrantLock lock = writeLocks.get(kind);
        lock.lock();
        try {
            storage(action, () -> {
                transactionTemplate.executeWithoutResult(tx -> work.run());
                return null;
            });
        } finally {
            lock.unlock();
        }
    }

    private <T> T storage(String action, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException ex) {
            throw new StorageException("Failed to " + action + ": " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    private FeedStatus toFeedStatus(ResultSet rs) throws SQLException {
        return new FeedStatus(
                FeedKind.fromId(rs.getString("feed_type")),
                toInstant(rs, "last_fetch"),
                rs.getInt("item_count"),
                FeedState.fromDbValue(rs.getString("status")),
                rs.getString("error_message"));
    }

    // Columns carry their offset, so neither direction depends on the JVM default time zone.
    private static OffsetDateTime toUtc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private String writeJson(FeedKind kind, JsonNode payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new StorageException("Failed to serialize " + kind + " payload", ex);
        }
    }

    private JsonNode readJson(FeedKind kind, String json) {
        try {
            return objectMapper.readTree(json == null ? "null" : json);
        } catch (JsonProcessingException ex) {
            throw new StorageException("Cached " + kind + " payload is not valid JSON", ex);
        }
    }

    private record StoredPayload(String payload, Instant updatedAt) {
    }
}
