package com.daniel.feedarr.feed;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.daniel.feedarr.config.FeedarrProperties;

class FeedArtifactStoreTests {

    @Test
    void readIsEmptyBeforeFirstWrite(@TempDir Path dir) {
        FeedArtifactStore store = storeIn(dir.resolve("not-created-yet"));

        assertTrue(store.read(FeedKind.CALENDAR).isEmpty());
    }

    // The directory is created on demand and no temp files are left behind.
    @Test
    void writeReplacesDocumentWithoutLeftovers(@TempDir Path dir) throws IOException {
        Path feedsDir = dir.resolve("feeds");
        FeedArtifactStore store = storeIn(feedsDir);

        store.write(FeedKind.NOTIFICATION, "<rss>old</rss>".getBytes(StandardCharsets.UTF_8));
        store.write(FeedKind.NOTIFICATION, "<rss>new</rss>".getBytes(StandardCharsets.UTF_8));

        assertArrayEquals("<rss>new</rss>".getBytes(StandardCharsets.UTF_8),
                store.read(FeedKind.NOTIFICATION).orElseThrow());
        assertEquals(feedsDir.toAbsolutePath().normalize().resolve("notification.xml"), store.pathFor(FeedKind.NOTIFICATION));
        try (Stream<Path> files = Files.list(feedsDir)) {
            assertEquals(1, files.count());
        }
    }

    private static FeedArtifactStore storeIn(Path dir) {
        FeedarrProperties properties = new FeedarrProperties();
        properties.setFeedsDir(dir.toString());
        return new FeedArtifactStore(properties);
    }
}
