package com.daniel.feedarr.upstream;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/*
 * Canonical list form of an upstream payload.
 * The media server answers with a bare JSON array for calendar/notification and with either an array
 * or a paged envelope ({"page":1,...,"records":[...]}) for the queue. Everything downstream
 * (item counts, RSS items) only ever sees this list.
 */
public record FeedRecords(List<JsonNode> records) {

    private static final String RECORDS_FIELD = "records";

    public FeedRecords {
        records = List.copyOf(records);
    }

    public static FeedRecords from(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return new FeedRecords(List.of());
        }
        if (payload.isArray()) {
            return new FeedRecords(elements(payload));
        }
        JsonNode paged = payload.get(RECORDS_FIELD);
        if (paged != null && paged.isArray()) {
            return new FeedRecords(elements(paged));
        }
        return new FeedRecords(List.of());
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    private static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> elements = new ArrayList<>(array.size());
        array.forEach(elements::add);
        return elements;
    }
}
