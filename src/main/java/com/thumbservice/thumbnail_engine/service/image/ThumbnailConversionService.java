package com.thumbservice.thumbnail_engine.service.image;

import com.thumbservice.thumbnail_engine.exception.ThumbnailErrorKind;
import com.thumbservice.thumbnail_engine.exception.ThumbnailException;
import com.thumbservice.thumbnail_engine.model.ThumbnailParameters;
import com.thumbservice.thumbnail_engine.monitoring.MetricsService;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Produces the thumbnail JPEG for the frames of one run.
 */
@Slf4j
@Service
public class ThumbnailConversionService {

    static final String CONVERSION_FAILED_MESSAGE = "Failed to generate thumbnail";

    private final FitsImageConverter converter;
    private final MetricsService metricsService;

    public ThumbnailConversionService(FitsImageConverter converter, MetricsService metricsService) {
        this.converter = converter;
        this.metricsService = metricsService;
    }

    /**
     * Converts {@code inputs} into a JPEG whose path is owned by {@code tracker}.
     *
     * @param inputs one frame or three band frames
     * @param key storage key, used as the output file name
     * @param parameters rendering options
     * @param tracker run tracker; the output path is recorded before the converter starts
     * @return path of the written JPEG
     * @throws ThumbnailException CONVERSION_FAILED on any converter failure or missing output
     */
    public Path convert(List<Path> inputs, String key, ThumbnailParameters parameters, TempArtifactTracker tracker) {
        Path output = tracker.allocate(key);
        tracker.registerOutput(output);

        Timer.Sample sample = metricsService.startConversionTimer();
        try {
            converter.convert(inputs, output, parameters);
        } catch (Exception e) {
            metricsService.incrementConversionFailure();
            log.error("Conversion of {} input(s) to {} failed: {}", inputs.size(), key, e.getMessage(), e);
            throw new ThumbnailException(ThumbnailErrorKind.CONVERSION_FAILED, CONVERSION_FAILED_MESSAGE, e);
        } finally {
            metricsService.stopConversionTimer(sample);
        }

        if (!Files.isRegularFile(output)) {
            metricsService.incrementConversionFailure();
            log.error("Converter reported success but wrote no file for {}", key);
            throw new ThumbnailException(ThumbnailErrorKind.CONVERSION_FAILED, CONVERSION_FAILED_MESSAGE);
        }
        log.debug("Converted {} input(s) into {}", inputs.size(), output.getFileName());
        return output;
    }
}
