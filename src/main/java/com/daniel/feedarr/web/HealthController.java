package com.daniel.feedarr.web;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.core.env.Environment;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import com.daniel.feedarr.config.FeedarrProperties;
import com.daniel.feedarr.sync.FeedService;
import com.daniel.feedarr.sync.SchedulerStatus;

@RestController
public class HealthController {

    private final FeedService feedService;
    private final FeedarrProperties properties;
    private final Environment environment;

    public HealthController(FeedService feedService, FeedarrProperties properties, Environment environment) {
        this.feedService = feedService;
        this.properties = properties;
        this.environment = environment;
    }

    // Landing page: what this service is and where to go next.
    @GetMapping("/")
    public Map<String, Object> root() {
        String base = ServletUriComponentsBuilder.fromCurrentContextPath().toUriString();

        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("rssFeeds", base + "/rss");
        endpoints.put("health", base + "/health");
        endpoints.put("status", base + "/rss/status");

        String[] profiles = environment.getActiveProfiles();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Welcome to Feedarr API");
        body.put("description", "RSS feed generator for media server APIs");
        body.put("status", "Server is running");
        body.put("environment", profiles.length == 0 ? "default" : String.join(",", profiles));
        body.put("endpoints", endpoints);
        return body;
    }

    // Status never throws: a broken cache database shows up under scheduler.database.error.
    @GetMapping("/health")
    public Map<String, Object> health() {
        SchedulerStatus status = feedService.getStatus();

        Map<String, Object> scheduler = new LinkedHashMap<>();
        scheduler.put("isRunning", status.running());
        scheduler.put("lastFetchTimes", status.lastFetchTimes());
        scheduler.put("database", status.database() != null ? status.database() : Map.of("error", status.databaseError()));

        // API key is deliberately left out.
        Map<String, Object> configuration = new LinkedHashMap<>();
        configuration.put("apiBaseUrl", properties.normalizedApiBaseUrl());
        configuration.put("apiKeyConfigured", properties.hasApiKey());
        configuration.put("fetchFrequency", properties.effectiveFetchFrequency().toMillis());
        configuration.put("cacheTimeToLive", properties.effectiveCacheTtl().toMillis());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "OK");
        body.put("timestamp", Instant.now().toString());
        body.put("scheduler", scheduler);
        body.put("configuration", configuration);
        return body;
    }
}
