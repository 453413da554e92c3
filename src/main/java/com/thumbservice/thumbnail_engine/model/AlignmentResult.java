package com.thumbservice.thumbnail_engine.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Frames to hand to the converter after an alignment attempt: either the reference plus two
 * registered copies ({@code aligned == true}) or exactly the original inputs.
 */
public record AlignmentResult(List<Path> paths, boolean aligned) {

    public AlignmentResult {
        paths = List.copyOf(paths);
    }

    public static AlignmentResult aligned(Path reference, Path first, Path second) {
        return new AlignmentResult(List.of(reference, first, second), true);
    }

    public static AlignmentResult unaligned(List<Path> originals) {
        return new AlignmentResult(originals, false);
    }
}
