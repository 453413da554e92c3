package com.thumbservice.thumbnail_engine.service.image;

import com.thumbservice.thumbnail_engine.config.ThumbnailConfigurationProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Creates one {@link TempArtifactTracker} per thumbnail run, rooted in the configured scratch directory.
 */
@Slf4j
@Component
public class TempArtifactTrackerFactory {

    private final Path directory;
    private final String prefix;

    @Autowired
    public TempArtifactTrackerFactory(ThumbnailConfigurationProperties properties) {
        this(Paths.get(properties.getTmpDir()), properties.getTmpFilenamePrefix());
    }

    public TempArtifactTrackerFactory(Path directory, String prefix) {
        this.directory = directory;
        this.prefix = prefix == null ? "" : prefix;
    }

    @PostConstruct
    public void init() {
        try {
            Files.createDirectories(directory);
            log.info("Temporary thumbnail artifacts go to {}", directory.toAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("Could not create temporary directory " + directory, e);
        }
    }

    public TempArtifactTracker create() {
        return new TempArtifactTracker(directory, prefix);
    }
}
