package com.thumbservice.thumbnail_engine.service.image;

import com.thumbservice.thumbnail_engine.model.AlignmentResult;
import com.thumbservice.thumbnail_engine.monitoring.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Best-effort registration of the secondary color frames onto the first one.
 * <p>
 * Alignment either fully succeeds (both secondaries aligned) or the original inputs are used unchanged.
 * Failures never propagate; a misaligned color thumbnail is still a thumbnail.
 */
@Slf4j
@Service
public class FrameAlignmentService {

    private final FrameAligner frameAligner;
    private final MetricsService metricsService;

    public FrameAlignmentService(FrameAligner frameAligner, MetricsService metricsService) {
        this.frameAligner = frameAligner;
        this.metricsService = metricsService;
    }

    /**
     * @param reference frame kept as is, normally {@code frames.get(0)}
     * @param frames the three band frames
     * @param tracker run tracker; every aligner output path is allocated from it before the aligner starts
     * @return reference plus two aligned files, or exactly {@code frames}
     */
    public AlignmentResult reproject(Path reference, List<Path> frames, TempArtifactTracker tracker) {
        List<Path> aligned = new ArrayList<>(2);
        try {
            for (Path candidate : frames.subList(1, Math.min(3, frames.size()))) {
                Path output = tracker.allocate("aligned-" + candidate.getFileName());
                Optional<Path> result = frameAligner.align(reference, candidate, output);
                result.ifPresent(aligned::add);
            }
        } catch (Exception e) {
            log.warn("Error aligning images, falling back to original image list", e);
        }

        if (aligned.size() == 2) {
            return AlignmentResult.aligned(reference, aligned.get(0), aligned.get(1));
        }

        for (Path path : aligned) {
            deleteQuietly(path);
        }
        metricsService.incrementAlignmentFallback();
        log.info("Using {} unaligned frames ({} of 2 aligned)", frames.size(), aligned.size());
        return AlignmentResult.unaligned(frames);
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete unused aligned file {}: {}", path, e.getMessage());
        }
    }
}
