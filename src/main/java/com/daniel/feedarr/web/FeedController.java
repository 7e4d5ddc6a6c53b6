package com.daniel.feedarr.web;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.CacheControl; // Builds the Cache-Control header for feed responses.
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType; // Represents HTTP media types like application/rss+xml.
import org.springframework.http.ResponseEntity; // Wraps HTTP status/headers/body in controller responses.
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping; // Maps GET requests to controller methods.
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController; // Marks this class as a REST endpoint controller.
import org.springframework.web.servlet.support.ServletUriComponentsBuilder; // Absolute URLs for discovery/status.

import com.daniel.feedarr.config.FeedarrProperties; // Cache TTL for Cache-Control.
import com.daniel.feedarr.feed.FeedKind; // Validates the {feedType} path segment.
import com.daniel.feedarr.sync.FeedService; // Read/refresh/clear/status facade over the sync core.
import com.daniel.feedarr.sync.RefreshOutcome;
import com.daniel.feedarr.sync.SchedulerStatus;

@RestController
@RequestMapping("/rss")
// Serves the generated RSS documents and the manual control endpoints (status, refresh, cache clear).
public class FeedController {

    private static final MediaType RSS_MEDIA_TYPE = MediaType.parseMediaType("application/rss+xml;charset=UTF-8");

    private final FeedService feedService;
    private final FeedarrProperties properties;

    public FeedController(FeedService feedService, FeedarrProperties properties) {
        this.feedService = feedService;
        this.properties = properties;
    }

    @GetMapping
    public Map<String, Object> discovery() {
        String base = rssBaseUrl();
        Map<String, Object> feeds = new LinkedHashMap<>();
        for (FeedKind kind : FeedKind.values()) {
            feeds.put(kind.id(), Map.of(
                    "url", base + "/" + kind.id(),
                    "description", kind.channelDescription()));
        }

        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("status", base + "/status");
        endpoints.put("refresh", base + "/refresh");
        endpoints.put("refreshSpecific", base + "/refresh/{feedType}");
        endpoints.put("clearCache", base + "/cache");
        endpoints.put("clearCacheSpecific", base + "/cache/{feedType}");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Feedarr RSS Service");
        body.put("availableFeeds", feeds);
        body.put("endpoints", endpoints);
        return body;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        SchedulerStatus status = feedService.getStatus();
        String base = rssBaseUrl();

        Map<String, String> feedUrls = new LinkedHashMap<>();
        for (FeedKind kind : FeedKind.values()) {
            feedUrls.put(kind.id(), base + "/" + kind.id());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("isRunning", status.running());
        body.put("fetchFrequency", status.fetchFrequencyMillis());
        body.put("lastFetchTimes", status.lastFetchTimes());
        body.put("activeJobs", status.activeJobs());
        body.put("database", status.database() != null ? status.database() : Map.of("error", status.databaseError()));
        body.put("availableFeeds", FeedKind.ids());
        body.put("feedUrls", feedUrls);
        return body;
    }

    // Unknown kinds -> 400 (ApiExceptionHandler); not generated yet -> 404.
    @GetMapping("/{feedType}")
    public ResponseEntity<?> feed(@PathVariable String feedType) {
        FeedKind kind = FeedKind.fromId(feedType);
        return feedService.readArtifact(kind)
                .<ResponseEntity<?>>map(bytes -> ResponseEntity.ok()
                        .contentType(RSS_MEDIA_TYPE)
                        .cacheControl(CacheControl.maxAge(properties.effectiveCacheTtl()).cachePublic())
                        .body(bytes))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        // Readers ask for application/rss+xml; the error body is JSON regardless.
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(Map.of(
                                "error", capitalize(kind.id()) + " RSS feed not found",
                                "message", "Feed may not have been generated yet. Try again in a few minutes.")));
    }

    @PostMapping("/refresh")
    public Map<String, Object> refreshAll() {
        List<RefreshOutcome> outcomes = feedService.refreshNow(null);
        long failed = outcomes.stream().filter(outcome -> !outcome.success()).count();
        String message = failed == 0
                ? "All feeds refreshed successfully"
                : "Feed refresh completed with " + failed + " of " + outcomes.size() + " feeds failing";
        return actionResponse(message, outcomes);
    }

    @PostMapping("/refresh/{feedType}")
    public Map<String, Object> refresh(@PathVariable String feedType) {
        FeedKind kind = FeedKind.fromId(feedType);
        List<RefreshOutcome> outcomes = feedService.refreshNow(kind);
        return actionResponse(kind.id() + " feed refreshed successfully", outcomes);
    }

    @DeleteMapping("/cache")
    public Map<String, Object> clearAll() {
        feedService.clearCache(null);
        return actionResponse("All caches cleared successfully", null);
    }

    @DeleteMapping("/cache/{feedType}")
    public Map<String, Object> clear(@PathVariable String feedType) {
        FeedKind kind = FeedKind.fromId(feedType);
        feedService.clearCache(kind);
        return actionResponse(kind.id() + " cache cleared successfully", null);
    }

    private Map<String, Object> actionResponse(String message, List<RefreshOutcome> outcomes) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        if (outcomes != null) {
            body.put("outcomes", outcomes);
        }
        return body;
    }

    private String rssBaseUrl() {
        return ServletUriComponentsBuilder.fromCurrentContextPath().path("/rss").toUriString();
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
