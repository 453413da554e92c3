/**
 * Generates or retrieves the thumbnail for one frame
 *
 * Features:
 * - Rejects ineligible frames before any network or disk access
 * - Serves an existing object straight from storage when the key is already present
 * - Fetches one raw frame, or the three band frames of the request for color thumbnails
 * - Attempts alignment of color frames and falls back to the unaligned inputs
 * - Removes every temporary file of the run on success and on failure
 */
package com.thumbservice.thumbnail_engine.service;

import com.thumbservice.thumbnail_engine.config.ThumbnailConfigurationProperties;
import com.thumbservice.thumbnail_engine.model.AlignmentResult;
import com.thumbservice.thumbnail_engine.model.Frame;
import com.thumbservice.thumbnail_engine.model.ThumbnailParameters;
import com.thumbservice.thumbnail_engine.monitoring.MetricsService;
import com.thumbservice.thumbnail_engine.service.image.FrameAlignmentService;
import com.thumbservice.thumbnail_engine.service.image.RgbFrameSelector;
import com.thumbservice.thumbnail_engine.service.image.TempArtifactTracker;
import com.thumbservice.thumbnail_engine.service.image.TempArtifactTrackerFactory;
import com.thumbservice.thumbnail_engine.service.image.ThumbnailConversionService;
import com.thumbservice.thumbnail_engine.service.storage.ThumbnailStorageGateway;
import com.thumbservice.thumbnail_engine.util.ThumbnailKeyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class ThumbnailPipelineService {

    private final FrameEligibilityService eligibilityService;
    private final ArchiveApiClient archiveApiClient;
    private final RgbFrameSelector rgbFrameSelector;
    private final FrameAlignmentService alignmentService;
    private final ThumbnailConversionService conversionService;
    private final ThumbnailStorageGateway storageGateway;
    private final TempArtifactTrackerFactory trackerFactory;
    private final MetricsService metricsService;
    private final ThumbnailConfigurationProperties properties;

    public ThumbnailPipelineService(FrameEligibilityService eligibilityService,
                                    ArchiveApiClient archiveApiClient,
                                    RgbFrameSelector rgbFrameSelector,
                                    FrameAlignmentService alignmentService,
                                    ThumbnailConversionService conversionService,
                                    ThumbnailStorageGateway storageGateway,
                                    TempArtifactTrackerFactory trackerFactory,
                                    MetricsService metricsService,
                                    ThumbnailConfigurationProperties properties) {
        this.eligibilityService = eligibilityService;
        this.archiveApiClient = archiveApiClient;
        this.rgbFrameSelector = rgbFrameSelector;
        this.alignmentService = alignmentService;
        this.conversionService = conversionService;
        this.storageGateway = storageGateway;
        this.trackerFactory = trackerFactory;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    /**
     * Returns a presigned URL for the thumbnail of {@code frame}, generating and storing it first if needed.
     *
     * @param frame frame metadata from the archive
     * @param parameters rendering options
     * @param authorization caller's Authorization header, forwarded to archive metadata calls; may be null
     * @return presigned GET URL of the stored JPEG
     */
    public String generateOrRetrieve(Frame frame, ThumbnailParameters parameters, String authorization) {
        eligibilityService.requireEligible(frame, parameters);

        String key = ThumbnailKeyUtils.keyFor(frame.id(), parameters);
        if (storageGateway.exists(key)) {
            metricsService.incrementCacheHit();
            log.debug("Thumbnail {} already stored", key);
            return storageGateway.presignedUrl(key);
        }

        metricsService.incrementCacheMiss();
        metricsService.incrementActiveGenerations();
        try (TempArtifactTracker tracker = trackerFactory.create()) {
            List<Path> inputs = parameters.color()
                ? acquireColorFrames(frame, authorization, tracker)
                : List.of(download(frame, tracker));
            tracker.register(inputs);

            if (parameters.color()) {
                AlignmentResult alignment = alignmentService.reproject(inputs.get(0), inputs, tracker);
                tracker.register(alignment.paths());
            }

            Path jpeg = conversionService.convert(tracker.current(), key, parameters, tracker);
            storageGateway.upload(key, jpeg, ThumbnailStorageGateway.JPEG_CONTENT_TYPE);
            log.info("Generated thumbnail {} from {} frame(s)", key, tracker.current().size());
        } finally {
            metricsService.decrementActiveGenerations();
        }
        return storageGateway.presignedUrl(key);
    }

    private List<Path> acquireColorFrames(Frame frame, String authorization, TempArtifactTracker tracker) {
        // Color composites are always built from processed frames, whatever level was requested
        List<Frame> siblings = archiveApiClient.findFramesForRequest(
            frame.requestId(), properties.getColorReductionLevel(), authorization);
        List<Frame> bands = rgbFrameSelector.select(siblings);

        List<Path> paths = new ArrayList<>(bands.size());
        for (Frame band : bands) {
            paths.add(download(band, tracker));
        }
        return paths;
    }

    private Path download(Frame frame, TempArtifactTracker tracker) {
        Path path = tracker.allocate(frame.filename());
        archiveApiClient.fetchBytes(frame.url(), properties.getArchive().getFrameDownloadTimeout(), path);
        return path;
    }
}
