package com.daniel.feedarr.feed;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.daniel.feedarr.cache.StorageException;
import com.daniel.feedarr.config.FeedarrProperties;

@Component
// Keeps one <kind>.xml per feed under the configured feeds directory.
public class FeedArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FeedArtifactStore.class);

    private final Path feedsRoot;

    public FeedArtifactStore(FeedarrProperties properties) {
        this.feedsRoot = properties.feedsRoot();
    }

    /*
     * Write to a temp file in the same directory, then rename over the old document,
     * so a reader sees either the previous feed or the new one and never a half-written file.
     */
    public void write(FeedKind kind, byte[] content) {
        Path target = pathFor(kind);
        Path temp = null;
        try {
            Files.createDirectories(feedsRoot);
            temp = Files.createTempFile(feedsRoot, kind.id() + "-", ".xml.tmp");
            Files.write(temp, content);
            moveIntoPlace(temp, target);
            log.debug("Wrote {} ({} bytes)", target, content.length);
        } catch (IOException ex) {
            throw new StorageException("Failed to write " + kind + " feed to " + target, ex);
        } finally {
            deleteQuietly(temp);
        }
    }

    // Empty until the first successful materialization of that kind.
    public Optional<byte[]> read(FeedKind kind) {
        Path path = pathFor(kind);
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (NoSuchFileException ex) {
            return Optional.empty();
        } catch (IOException ex) {
            throw new StorageException("Failed to read " + kind + " feed from " + path, ex);
        }
    }

    public boolean exists(FeedKind kind) {
        return Files.isRegularFile(pathFor(kind));
    }

    public Path pathFor(FeedKind kind) {
        return feedsRoot.resolve(kind.artifactFileName());
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            log.warn("Atomic move not supported in {}, falling back to replace", feedsRoot);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            log.warn("Could not remove temp file {}: {}", temp, ex.getMessage());
        }
    }
}
