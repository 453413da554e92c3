package com.thumbservice.thumbnail_engine.service;

import com.thumbservice.thumbnail_engine.config.ThumbnailConfigurationProperties;
import com.thumbservice.thumbnail_engine.exception.ThumbnailException;
import com.thumbservice.thumbnail_engine.model.EligibilityResult;
import com.thumbservice.thumbnail_engine.model.Frame;
import com.thumbservice.thumbnail_engine.model.ThumbnailParameters;
import com.thumbservice.thumbnail_engine.util.ValidationUtils;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides from frame metadata alone whether a thumbnail can be rendered.
 * No I/O happens here, so rejected requests cost nothing.
 */
@Service
public class FrameEligibilityService {

    static final String MISSING_FIELDS_REASON = "Cannot generate thumbnail for given frame";
    static final String CONFIGURATION_TYPE_REASON = "Cannot generate thumbnail for configuration_type=";
    static final String COLOR_WITHOUT_REQUEST_REASON = "Cannot generate color thumbnail for a frame that does not have a request";
    static final String COLOR_CONFIGURATION_TYPE_REASON = "Cannot generate color thumbnail for configuration_type=";
    static final String NOT_FITS_REASON = "Cannot generate thumbnail for non FITS-type frame";

    private final Set<String> validConfigurationTypes;
    private final Set<String> validConfigurationTypesForColor;
    private final List<String> rawImageExtensions;

    public FrameEligibilityService(ThumbnailConfigurationProperties properties) {
        this.validConfigurationTypes = upperCased(properties.getValidConfigurationTypes());
        this.validConfigurationTypesForColor = upperCased(properties.getValidConfigurationTypesForColor());
        this.rawImageExtensions = List.copyOf(properties.getRawImageExtensions());
    }

    /**
     * Checks are applied in a fixed order and the first failing one supplies the reason.
     */
    public EligibilityResult evaluate(Frame frame, ThumbnailParameters parameters) {
        if (frame == null
            || !ValidationUtils.hasText(frame.id())
            || frame.filename() == null
            || frame.configurationType() == null
            || frame.url() == null) {
            return EligibilityResult.rejected(MISSING_FIELDS_REASON);
        }

        String configurationType = ValidationUtils.upperCaseOrEmpty(frame.configurationType());
        if (!validConfigurationTypes.contains(configurationType)) {
            return EligibilityResult.rejected(CONFIGURATION_TYPE_REASON + configurationType);
        }
        if (parameters.color() && !frame.hasRequest()) {
            return EligibilityResult.rejected(COLOR_WITHOUT_REQUEST_REASON);
        }
        if (parameters.color() && !validConfigurationTypesForColor.contains(configurationType)) {
            return EligibilityResult.rejected(COLOR_CONFIGURATION_TYPE_REASON + configurationType);
        }
        if (!ValidationUtils.endsWithAny(frame.filename(), rawImageExtensions)) {
            return EligibilityResult.rejected(NOT_FITS_REASON);
        }
        return EligibilityResult.ok();
    }

    /**
     * @throws ThumbnailException VALIDATION with the rejection reason
     */
    public void requireEligible(Frame frame, ThumbnailParameters parameters) {
        EligibilityResult result = evaluate(frame, parameters);
        if (!result.eligible()) {
            throw ThumbnailException.validation(result.reason());
        }
    }

    private static Set<String> upperCased(List<String> values) {
        return values.stream()
            .map(ValidationUtils::upperCaseOrEmpty)
            .collect(Collectors.toCollection(HashSet::new));
    }
}
