package com.daniel.feedarr.config;

import java.nio.file.Path;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
// Binds feedarr.* values (application.properties / environment) to fields in this class.

@ConfigurationProperties(prefix = "feedarr")
public class FeedarrProperties {

    private static final Duration DEFAULT_FETCH_FREQUENCY = Duration.ofMinutes(5);
    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(10);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private String serverUrl = "http://localhost";
    private Integer serverPort = 7878;
    private String apiBasePath = "/api/v3";
    private String apiKey = "";
    private Duration fetchFrequency = DEFAULT_FETCH_FREQUENCY;
    private Duration cacheTtl = DEFAULT_CACHE_TTL;
    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    private String feedsDir = "feeds";
    private String publicUrl = "http://localhost:8080";
    private int calendarDaysAhead = 30;
    private int queuePageSize = 50;
    private final Scheduler scheduler = new Scheduler();

    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(String serverUrl) {
        this.serverUrl = serverUrl;
    }

    public Integer getServerPort() {
        return serverPort;
    }

    public void setServerPort(Integer serverPort) {
        this.serverPort = serverPort;
    }

    public String getApiBasePath() {
        return apiBasePath;
    }

    public void setApiBasePath(String apiBasePath) {
        this.apiBasePath = apiBasePath;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public Duration getFetchFrequency() {
        return fetchFrequency;
    }

    public void setFetchFrequency(Duration fetchFrequency) {
        this.fetchFrequency = fetchFrequency;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public String getFeedsDir() {
        return feedsDir;
    }

    public void setFeedsDir(String feedsDir) {
        this.feedsDir = feedsDir;
    }

    public String getPublicUrl() {
        return publicUrl;
    }

    public void setPublicUrl(String publicUrl) {
        this.publicUrl = publicUrl;
    }

    public int getCalendarDaysAhead() {
        return calendarDaysAhead;
    }

    public void setCalendarDaysAhead(int calendarDaysAhead) {
        this.calendarDaysAhead = calendarDaysAhead;
    }

    public int getQueuePageSize() {
        return queuePageSize;
    }

    public void setQueuePageSize(int queuePageSize) {
        this.queuePageSize = queuePageSize;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Path feedsRoot() {
        // Same idea as a media root: one stable absolute directory for every artifact path.
        String dir = (feedsDir == null || feedsDir.isBlank()) ? "feeds" : feedsDir.trim();
        return Path.of(dir).toAbsolutePath().normalize();
    }

    /*
     * Upstream base URL is assembled the same way the media server documents it:
     * scheme://host[:port]/api/vN. Trailing/duplicate slashes are removed so path joining stays predictable.
     */
    public String normalizedApiBaseUrl() {
        String host = trimTrailingSlash(serverUrl == null ? "" : serverUrl);
        StringBuilder url = new StringBuilder(host);
        if (serverPort != null && serverPort > 0) {
            url.append(':').append(serverPort);
        }
        String path = apiBasePath == null ? "" : apiBasePath.trim();
        if (!path.isEmpty()) {
            if (!path.startsWith("/")) {
                url.append('/');
            }
            url.append(trimTrailingSlash(path));
        }
        return url.toString();
    }

    public String normalizedPublicUrl() {
        if (publicUrl == null || publicUrl.trim().isEmpty()) {
            return "http://localhost:8080";
        }
        return trimTrailingSlash(publicUrl);
    }

    // Non-positive or missing values would stall the scheduler, so fall back to five minutes.
    public Duration effectiveFetchFrequency() {
        if (fetchFrequency == null || fetchFrequency.isZero() || fetchFrequency.isNegative()) {
            return DEFAULT_FETCH_FREQUENCY;
        }
        return fetchFrequency;
    }

    public Duration effectiveCacheTtl() {
        if (cacheTtl == null || cacheTtl.isZero() || cacheTtl.isNegative()) {
            return DEFAULT_CACHE_TTL;
        }
        return cacheTtl;
    }

    public Duration effectiveRequestTimeout() {
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            return DEFAULT_REQUEST_TIMEOUT;
        }
        return requestTimeout;
    }

    public int effectiveCalendarDaysAhead() {
        return calendarDaysAhead > 0 ? calendarDaysAhead : 30;
    }

    public int effectiveQueuePageSize() {
        return queuePageSize > 0 ? queuePageSize : 50;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    private String trimTrailingSlash(String value) {
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public static class Scheduler {

        // Off in tests so the context can start without reaching a media server.
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
