package com.daniel.feedarr.feed;

import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonValue;

/*
 * The three fixed feeds. Each kind names its cache partition, its upstream resource,
 * its RSS artifact file and its channel title/description.
 */
public enum FeedKind {

    CALENDAR("calendar", "Calendar Feed", "Upcoming movies from calendar"),
    NOTIFICATION("notification", "Notifications Feed", "System notifications and alerts"),
    QUEUE("queue", "Queue Feed", "Download queue status and progress");

    private final String id;
    private final String channelTitle;
    private final String channelDescription;

    FeedKind(String id, String channelTitle, String channelDescription) {
        this.id = id;
        this.channelTitle = channelTitle;
        this.channelDescription = channelDescription;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String channelTitle() {
        return channelTitle;
    }

    public String channelDescription() {
        return channelDescription;
    }

    public String artifactFileName() {
        return id + ".xml";
    }

    // Exact, case-sensitive match. Rejects anything outside the fixed set before callers touch the cache or the network.
    public static FeedKind fromId(String value) {
        if (value == null) {
            throw new UnknownFeedKindException(null);
        }
        return Arrays.stream(values())
                .filter(kind -> kind.id.equals(value))
                .findFirst()
                .orElseThrow(() -> new UnknownFeedKindException(value));
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(FeedKind::id).toList();
    }

    @Override
    public String toString() {
        return id;
    }
}
