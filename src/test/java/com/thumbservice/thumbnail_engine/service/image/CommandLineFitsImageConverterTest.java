package com.thumbservice.thumbnail_engine.service.image;

import com.thumbservice.thumbnail_engine.config.ThumbnailConfigurationProperties;
import com.thumbservice.thumbnail_engine.model.ThumbnailParameters;
import com.thumbservice.thumbnail_engine.util.ExternalCommandRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class CommandLineFitsImageConverterTest {

    @Mock
    private ExternalCommandRunner commandRunner;

    private ThumbnailConfigurationProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ThumbnailConfigurationProperties();
        properties.getConverter().setCommand(List.of("fits2jpg", "--quiet"));
        properties.getConverter().setTimeout(Duration.ofSeconds(30));
    }

    @Test
    void grayscaleCommandOmitsOptionalFlags() {
        CommandLineFitsImageConverter converter = new CommandLineFitsImageConverter(commandRunner, properties);

        List<String> command = converter.buildCommand(
            List.of(Path.of("/tmp/in.fits")), Path.of("/tmp/out.jpg"), ThumbnailParameters.defaults());

        assertThat(command).containsExactly(
            "fits2jpg", "--quiet",
            "--width", "200", "--height", "200",
            "--percentile", "99.5", "--quality", "80",
            "--output", "/tmp/out.jpg", "/tmp/in.fits");
    }

    @Test
    void colorCommandCarriesLabelFlagsAndAllInputsInOrder() {
        CommandLineFitsImageConverter converter = new CommandLineFitsImageConverter(commandRunner, properties);
        ThumbnailParameters parameters = new ThumbnailParameters(400, 300, "M31", true, true, 98.0, 90);

        List<String> command = converter.buildCommand(
            List.of(Path.of("/tmp/r.fits"), Path.of("/tmp/v.fits"), Path.of("/tmp/b.fits")),
            Path.of("/tmp/out.jpg"), parameters);

        assertThat(command).containsSubsequence("--label", "M31")
            .contains("--color", "--median")
            .endsWith("--output", "/tmp/out.jpg", "/tmp/r.fits", "/tmp/v.fits", "/tmp/b.fits");
    }

    @Test
    void convertRunsCommandWithConfiguredTimeout() {
        CommandLineFitsImageConverter converter = new CommandLineFitsImageConverter(commandRunner, properties);

        converter.convert(List.of(Path.of("/tmp/in.fits")), Path.of("/tmp/out.jpg"), ThumbnailParameters.defaults());

        verify(commandRunner).run(anyList(), eq(Duration.ofSeconds(30)));
    }

    @Test
    void missingCommandIsAConfigurationError() {
        properties.getConverter().setCommand(List.of());
        CommandLineFitsImageConverter converter = new CommandLineFitsImageConverter(commandRunner, properties);

        assertThatThrownBy(() -> converter.convert(
                List.of(Path.of("/tmp/in.fits")), Path.of("/tmp/out.jpg"), ThumbnailParameters.defaults()))
            .isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(commandRunner);
    }
}
