package com.daniel.feedarr.feed;

public class UnknownFeedKindException extends RuntimeException {

    private final String requestedKind;

    public UnknownFeedKindException(String requestedKind) {
        super("Unknown feed type: " + requestedKind + " (expected one of " + FeedKind.ids() + ")");
        this.requestedKind = requestedKind;
    }

    public String getRequestedKind() {
        return requestedKind;
    }
}
