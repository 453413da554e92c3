package com.thumbservice.thumbnail_engine.service.image;

import com.thumbservice.thumbnail_engine.model.ThumbnailParameters;

import java.nio.file.Path;
import java.util.List;

/**
 * Renders one FITS frame (grayscale) or three band frames (red, visual, blue) into a JPEG.
 */
public interface FitsImageConverter {

    /**
     * @param inputs one frame, or exactly three for a color rendering
     * @param output JPEG file to write
     * @param parameters size, stretch and labelling options
     * @throws Exception on any decode or encode failure
     */
    void convert(List<Path> inputs, Path output, ThumbnailParameters parameters) throws Exception;
}
