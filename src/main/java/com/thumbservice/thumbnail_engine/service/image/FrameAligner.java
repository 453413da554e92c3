package com.thumbservice.thumbnail_engine.service.image;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Registers one frame onto a reference frame's pixel grid.
 */
public interface FrameAligner {

    /**
     * @param reference frame whose geometry is kept
     * @param candidate frame to reproject
     * @param output file the aligned copy is written to; already recorded for cleanup by the caller
     * @return {@code output} once written, or empty when the candidate could not be matched to the reference
     * @throws Exception on any solver failure; callers treat it as "not aligned"
     */
    Optional<Path> align(Path reference, Path candidate, Path output) throws Exception;
}
