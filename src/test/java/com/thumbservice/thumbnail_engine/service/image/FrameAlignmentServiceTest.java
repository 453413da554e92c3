package com.thumbservice.thumbnail_engine.service.image;

import com.thumbservice.thumbnail_engine.model.AlignmentResult;
import com.thumbservice.thumbnail_engine.monitoring.MetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.stubbing.Answer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FrameAlignmentServiceTest {

    @TempDir
    Path tempDir;

    private FrameAligner aligner;
    private SimpleMeterRegistry meterRegistry;
    private FrameAlignmentService service;
    private TempArtifactTracker tracker;
    private Path red;
    private Path visual;
    private Path blue;

    @BeforeEach
    void setUp() throws IOException {
        aligner = mock(FrameAligner.class);
        meterRegistry = new SimpleMeterRegistry();
        service = new FrameAlignmentService(aligner, new MetricsService(meterRegistry));
        tracker = new TempArtifactTracker(tempDir, "thumbservice-");
        red = Files.writeString(tempDir.resolve("red.fits"), "r");
        visual = Files.writeString(tempDir.resolve("visual.fits"), "v");
        blue = Files.writeString(tempDir.resolve("blue.fits"), "b");
    }

    @Test
    void returnsReferencePlusBothAlignedFiles() throws Exception {
        when(aligner.align(eq(red), eq(visual), any())).thenAnswer(writesOutput());
        when(aligner.align(eq(red), eq(blue), any())).thenAnswer(writesOutput());

        AlignmentResult result = service.reproject(red, List.of(red, visual, blue), tracker);

        assertThat(result.aligned()).isTrue();
        assertThat(result.paths()).hasSize(3).startsWith(red);
        assertThat(result.paths().get(1).getFileName().toString()).endsWith("-aligned-visual.fits");
        assertThat(result.paths().get(2).getFileName().toString()).endsWith("-aligned-blue.fits");
        assertThat(tracker.allEverRegistered()).containsAll(result.paths().subList(1, 3));
        assertThat(meterRegistry.counter("thumbnails.alignment.fallbacks").count()).isZero();
    }

    @Test
    void partialAlignmentFallsBackAndDeletesTheLoneAlignedFile() throws Exception {
        ArgumentCaptor<Path> visualOutput = ArgumentCaptor.forClass(Path.class);
        when(aligner.align(eq(red), eq(visual), visualOutput.capture())).thenAnswer(writesOutput());
        when(aligner.align(eq(red), eq(blue), any())).thenReturn(Optional.empty());

        AlignmentResult result = service.reproject(red, List.of(red, visual, blue), tracker);

        assertThat(result.aligned()).isFalse();
        assertThat(result.paths()).containsExactly(red, visual, blue);
        assertThat(visualOutput.getValue()).doesNotExist();
        assertThat(meterRegistry.counter("thumbnails.alignment.fallbacks").count()).isEqualTo(1.0);
    }

    @Test
    void solverExceptionIsSwallowedAndEarlierOutputRemoved() throws Exception {
        ArgumentCaptor<Path> visualOutput = ArgumentCaptor.forClass(Path.class);
        when(aligner.align(eq(red), eq(visual), visualOutput.capture())).thenAnswer(writesOutput());
        when(aligner.align(eq(red), eq(blue), any())).thenThrow(new IllegalStateException("no stars"));

        AlignmentResult result = service.reproject(red, List.of(red, visual, blue), tracker);

        assertThat(result.paths()).containsExactly(red, visual, blue);
        assertThat(visualOutput.getValue()).doesNotExist();
        assertThat(red).exists();
        assertThat(visual).exists();
        assertThat(blue).exists();
    }

    @Test
    void outputLeftByAFailingAlignerIsRemovedWithTheRun() throws Exception {
        ArgumentCaptor<Path> visualOutput = ArgumentCaptor.forClass(Path.class);
        when(aligner.align(eq(red), eq(visual), visualOutput.capture())).thenAnswer(invocation -> {
            Files.writeString(invocation.getArgument(2), "half written");
            throw new IllegalStateException("aligner exited 139");
        });

        AlignmentResult result = service.reproject(red, List.of(red, visual, blue), tracker);
        tracker.close();

        assertThat(result.aligned()).isFalse();
        assertThat(tracker.allEverRegistered()).contains(visualOutput.getValue());
        assertThat(visualOutput.getValue()).doesNotExist();
    }

    @Test
    void failureOnFirstCandidateSkipsTheSecond() throws Exception {
        when(aligner.align(eq(red), eq(visual), any())).thenThrow(new IllegalStateException("no stars"));

        AlignmentResult result = service.reproject(red, List.of(red, visual, blue), tracker);

        assertThat(result.aligned()).isFalse();
        verify(aligner, never()).align(eq(red), eq(blue), any());
    }

    private static Answer<Optional<Path>> writesOutput() {
        return invocation -> {
            Path output = invocation.getArgument(2);
            return Optional.of(Files.writeString(output, "aligned"));
        };
    }
}
