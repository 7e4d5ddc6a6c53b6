package com.daniel.feedarr.upstream;

import java.net.URI;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriBuilder;

import com.daniel.feedarr.config.FeedarrProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

public class MediaServerClient {

    /*
     * One authenticated GET per feed kind against the media server API.
     * The client never retries; a failed call surfaces as UpstreamException and the
     * scheduler decides what happens next (today: wait for the next tick).
     */
    private static final Logger log = LoggerFactory.getLogger(MediaServerClient.class);
    static final String API_KEY_HEADER = "X-Api-Key";

    private final RestClient restClient;

    // The builder arrives with its request factory (timeouts) already set by FeedarrConfig.
    public MediaServerClient(RestClient.Builder restClientBuilder, FeedarrProperties properties) {
        this.restClient = restClientBuilder
                .baseUrl(properties.normalizedApiBaseUrl())
                .defaultHeader(API_KEY_HEADER, properties.getApiKey() == null ? "" : properties.getApiKey())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    public JsonNode fetchCalendar(CalendarQuery query) {
        return get("/calendar", uri -> uri.path("/calendar")
                .queryParam("end", query.end().toString())
                .queryParam("unmonitored", query.unmonitored())
                .build());
    }

    public JsonNode fetchNotifications() {
        return get("/notification", uri -> uri.path("/notification").build());
    }

    // Answer is either a bare list or a {records: [...]} page; FeedRecords.from(...) accepts both.
    public JsonNode fetchQueue(QueueQuery query) {
        return get("/queue", uri -> uri.path("/queue")
                .queryParam("pageSize", query.pageSize())
                .queryParam("includeUnknownMovieItems", query.includeUnknownMovieItems())
                .build());
    }

    private JsonNode get(String path, Function<UriBuilder, URI> uriFunction) {
        try {
            JsonNode body = restClient.get()
                    .uri(uriFunction)
                    .retrieve()
                    .body(JsonNode.class);
            return body == null ? NullNode.getInstance() : body;
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            log.error("API error: {} {} for GET {}", status, ex.getStatusText(), path);
            throw new UpstreamException(status, "GET " + path + " failed with HTTP " + status + " " + ex.getStatusText(), ex);
        } catch (RestClientException ex) {
            log.error("API request GET {} failed: {}", path, ex.getMessage());
            throw new UpstreamException(null, "GET " + path + " failed: " + ex.getMessage(), ex);
        }
    }
}
