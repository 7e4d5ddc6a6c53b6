package com.daniel.feedarr.feed;

import java.nio.charset.StandardCharsets;

// Rendered RSS document for one feed kind, exactly as written to the artifact store.
public record RssDocument(FeedKind feedKind, byte[] content, String contentType, int itemCount) {

    public String asString() {
        return new String(content, StandardCharsets.UTF_8);
    }
}
