package com.thumbservice.thumbnail_engine.service.image;

import com.thumbservice.thumbnail_engine.config.ThumbnailConfigurationProperties;
import com.thumbservice.thumbnail_engine.util.ExternalCommandRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link FrameAligner} backed by an external alignment tool.
 * <p>
 * Invoked as {@code <command...> --output <file> <reference> <candidate>}. The tool prints
 * {@code OK} once the aligned file is written or {@code FAIL} when it could not match the stars.
 */
@Slf4j
@Component
public class CommandLineFrameAligner implements FrameAligner {

    private final ExternalCommandRunner commandRunner;
    private final ThumbnailConfigurationProperties.Command config;

    public CommandLineFrameAligner(ExternalCommandRunner commandRunner, ThumbnailConfigurationProperties properties) {
        this.commandRunner = commandRunner;
        this.config = properties.getAligner();
    }

    @Override
    public Optional<Path> align(Path reference, Path candidate, Path output) {
        if (config.getCommand().isEmpty()) {
            log.warn("No aligner command configured; skipping alignment of {}", candidate.getFileName());
            return Optional.empty();
        }
        List<String> command = new ArrayList<>(config.getCommand());
        command.add("--output");
        command.add(output.toString());
        command.add(reference.toString());
        command.add(candidate.toString());

        List<String> lines = commandRunner.run(command, config.getTimeout());
        for (int i = lines.size() - 1; i >= 0; i--) {
            String line = lines.get(i).trim();
            if (line.equals("OK") || line.startsWith("OK ")) {
                if (!Files.isRegularFile(output)) {
                    throw new IllegalStateException("Aligner reported success but wrote no file for " + candidate.getFileName());
                }
                return Optional.of(output);
            }
            if (line.equals("FAIL")) {
                return Optional.empty();
            }
        }
        throw new IllegalStateException("Aligner produced no result line for " + candidate.getFileName());
    }
}
