package com.thumbservice.thumbnail_engine.service;

import com.thumbservice.thumbnail_engine.config.ThumbnailConfigurationProperties;
import com.thumbservice.thumbnail_engine.exception.ThumbnailErrorKind;
import com.thumbservice.thumbnail_engine.exception.ThumbnailException;
import com.thumbservice.thumbnail_engine.model.EligibilityResult;
import com.thumbservice.thumbnail_engine.model.Frame;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static com.thumbservice.thumbnail_engine.testutil.FrameTestData.color;
import static com.thumbservice.thumbnail_engine.testutil.FrameTestData.exposure;
import static com.thumbservice.thumbnail_engine.testutil.FrameTestData.grayscale;
import static com.thumbservice.thumbnail_engine.testutil.FrameTestData.withConfigurationType;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameEligibilityServiceTest {

    private final FrameEligibilityService service = new FrameEligibilityService(new ThumbnailConfigurationProperties());

    @Test
    void exposureIsEligibleForGrayscaleAndColor() {
        assertThat(service.evaluate(exposure("1"), grayscale())).isEqualTo(EligibilityResult.ok());
        assertThat(service.evaluate(exposure("1"), color()).eligible()).isTrue();
    }

    @Test
    void missingRequiredFieldIsRejected() {
        Frame noUrl = new Frame("1", "1234", "a.fits", null, "EXPOSE", "V", "p");

        EligibilityResult result = service.evaluate(noUrl, grayscale());

        assertThat(result.eligible()).isFalse();
        assertThat(result.reason()).isEqualTo("Cannot generate thumbnail for given frame");
    }

    @Test
    void configurationTypeIsCheckedCaseInsensitively() {
        assertThat(service.evaluate(withConfigurationType("expose"), grayscale()).eligible()).isTrue();

        EligibilityResult bias = service.evaluate(withConfigurationType("bias"), grayscale());
        assertThat(bias.reason()).isEqualTo("Cannot generate thumbnail for configuration_type=BIAS");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "0"})
    void colorNeedsARequest(String requestId) {
        Frame frame = new Frame("1", requestId, "a.fits", "u", "EXPOSE", "V", "p");

        assertThat(service.evaluate(frame, color()).reason())
            .isEqualTo("Cannot generate color thumbnail for a frame that does not have a request");
    }

    @Test
    void colorIsLimitedToColorConfigurationTypes() {
        assertThat(service.evaluate(withConfigurationType("SKYFLAT"), grayscale()).eligible()).isTrue();
        assertThat(service.evaluate(withConfigurationType("SKYFLAT"), color()).reason())
            .isEqualTo("Cannot generate color thumbnail for configuration_type=SKYFLAT");
    }

    @ParameterizedTest
    @ValueSource(strings = {"frame.fits", "frame.fits.fz"})
    void fitsExtensionsAreAccepted(String filename) {
        Frame frame = new Frame("1", "1234", filename, "u", "EXPOSE", "V", "p");

        assertThat(service.evaluate(frame, grayscale()).eligible()).isTrue();
    }

    @Test
    void nonFitsFileIsRejected() {
        Frame frame = new Frame("1", "1234", "frame.tar.gz", "u", "EXPOSE", "V", "p");

        assertThat(service.evaluate(frame, grayscale()).reason())
            .isEqualTo("Cannot generate thumbnail for non FITS-type frame");
    }

    @Test
    void requireEligibleThrowsValidationWithReason() {
        assertThatThrownBy(() -> service.requireEligible(withConfigurationType("BIAS"), grayscale()))
            .isInstanceOf(ThumbnailException.class)
            .hasMessage("Cannot generate thumbnail for configuration_type=BIAS")
            .satisfies(e -> {
                ThumbnailException te = (ThumbnailException) e;
                assertThat(te.getKind()).isEqualTo(ThumbnailErrorKind.VALIDATION);
                assertThat(te.getStatus()).isEqualTo(400);
            });
    }
}
