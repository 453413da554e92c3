package com.thumbservice.thumbnail_engine.util;

import com.thumbservice.thumbnail_engine.exception.ExternalCommandException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the converter and aligner tools as child processes.
 * Stderr is merged into stdout; the combined output is read on the calling thread and returned line by line.
 * A single watchdog thread kills commands that outlive their timeout.
 */
@Slf4j
@Component
public class ExternalCommandRunner {

    private final ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "external-command-watchdog");
        thread.setDaemon(true);
        return thread;
    });

    public List<String> run(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Command must not be empty");
        }
        String commandLine = String.join(" ", command);
        log.debug("[COMMAND] Running: {}", commandLine);

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ExternalCommandException("Failed to start command: " + commandLine, e);
        }

        AtomicBoolean timedOut = new AtomicBoolean();
        ScheduledFuture<?> kill = watchdog.schedule(() -> {
            timedOut.set(true);
            destroyTree(process);
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        try {
            List<String> lines = readLines(process);
            int exitCode = process.waitFor();
            if (timedOut.get()) {
                throw new ExternalCommandException("Command timed out after " + timeout + ": " + commandLine, -1);
            }
            if (exitCode != 0) {
                log.error("[COMMAND] Exit code {} from: {}\n{}", exitCode, commandLine, String.join("\n", lines));
                throw new ExternalCommandException("Non-zero exit (" + exitCode + ") from command: " + commandLine, exitCode);
            }
            lines.forEach(line -> log.debug("[COMMAND] {}", line));
            return lines;
        } catch (IOException e) {
            destroyTree(process);
            if (timedOut.get()) {
                throw new ExternalCommandException("Command timed out after " + timeout + ": " + commandLine, -1);
            }
            throw new ExternalCommandException("Failed to read output of command: " + commandLine, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process);
            throw new ExternalCommandException("Interrupted while running command: " + commandLine, e);
        } finally {
            kill.cancel(false);
        }
    }

    @PreDestroy
    public void shutdown() {
        watchdog.shutdownNow();
    }

    // Children first; a surviving grandchild would keep the output pipe open
    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static List<String> readLines(Process process) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        }
        return lines;
    }
}
