package com.thumbservice.thumbnail_engine.service.image;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Tracks every local file one thumbnail run creates and removes them all on close.
 * <p>
 * Paths are recorded when they are allocated, before any bytes are written, so a
 * partially written download is still cleaned up. Not thread-safe; one tracker per run.
 */
@Slf4j
public class TempArtifactTracker implements AutoCloseable {

    private final Path directory;
    private final String prefix;
    private final Set<Path> everRegistered = new LinkedHashSet<>();
    private List<Path> current = List.of();
    private boolean closed;

    TempArtifactTracker(Path directory, String prefix) {
        this.directory = directory;
        this.prefix = prefix;
    }

    /**
     * Reserves a unique path for {@code name} and records it. The file is not created.
     *
     * @param name file name hint; only its last path segment is used
     * @return path of the form {@code {dir}/{prefix}{uuid}-{name}}
     */
    public Path allocate(String name) {
        ensureOpen();
        String baseName = Paths.get(name).getFileName().toString();
        String unique = UUID.randomUUID().toString().replace("-", "");
        Path path = directory.resolve(prefix + unique + "-" + baseName);
        everRegistered.add(path);
        return path;
    }

    /**
     * Replaces the current working set. Every path is also kept for cleanup.
     */
    public void register(List<Path> paths) {
        ensureOpen();
        current = List.copyOf(paths);
        everRegistered.addAll(paths);
    }

    /**
     * Records a produced output without touching the working set.
     */
    public void registerOutput(Path path) {
        ensureOpen();
        everRegistered.add(path);
    }

    public List<Path> current() {
        return current;
    }

    public Set<Path> allEverRegistered() {
        return Collections.unmodifiableSet(everRegistered);
    }

    /**
     * Deletes every recorded path that still exists. Deletion errors are logged, never thrown.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<Path> failed = new ArrayList<>();
        for (Path path : everRegistered) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                failed.add(path);
                log.warn("Failed to delete temporary file {}: {}", path, e.getMessage());
            }
        }
        if (failed.isEmpty()) {
            log.debug("Removed {} temporary paths", everRegistered.size());
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Tracker already closed");
        }
    }
}
