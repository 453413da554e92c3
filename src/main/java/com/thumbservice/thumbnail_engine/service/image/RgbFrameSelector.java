package com.thumbservice.thumbnail_engine.service.image;

import com.thumbservice.thumbnail_engine.exception.ThumbnailException;
import com.thumbservice.thumbnail_engine.model.Frame;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Picks the red, visual and blue exposures out of the frames of one observation request.
 */
@Component
public class RgbFrameSelector {

    static final String MISSING_BANDS_MESSAGE = "RVB frames not found";

    // Order matters: the converter maps inputs to R, G, B channels positionally
    private static final Map<String, Set<String>> FILTERS_BY_BAND = new LinkedHashMap<>();

    static {
        FILTERS_BY_BAND.put("red", Set.of("R", "rp"));
        FILTERS_BY_BAND.put("visual", Set.of("V"));
        FILTERS_BY_BAND.put("blue", Set.of("B"));
    }

    /**
     * @param frames sibling frames, in archive order
     * @return exactly {@code [red, visual, blue]}, the first match per band
     * @throws ThumbnailException NOT_FOUND when any band has no frame
     */
    public List<Frame> select(List<Frame> frames) {
        List<Frame> selected = new ArrayList<>(FILTERS_BY_BAND.size());
        for (Set<String> filters : FILTERS_BY_BAND.values()) {
            Frame match = frames.stream()
                .filter(frame -> frame.primaryOpticalElement() != null && filters.contains(frame.primaryOpticalElement()))
                .findFirst()
                .orElseThrow(() -> ThumbnailException.notFound(MISSING_BANDS_MESSAGE));
            selected.add(match);
        }
        return selected;
    }
}
