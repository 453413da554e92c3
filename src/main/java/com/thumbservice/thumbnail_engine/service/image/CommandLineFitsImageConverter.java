package com.thumbservice.thumbnail_engine.service.image;

import com.thumbservice.thumbnail_engine.config.ThumbnailConfigurationProperties;
import com.thumbservice.thumbnail_engine.model.ThumbnailParameters;
import com.thumbservice.thumbnail_engine.util.ExternalCommandRunner;
import com.thumbservice.thumbnail_engine.util.ValidationUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link FitsImageConverter} backed by an external fits-to-jpg tool.
 */
@Component
public class CommandLineFitsImageConverter implements FitsImageConverter {

    private final ExternalCommandRunner commandRunner;
    private final ThumbnailConfigurationProperties.Command config;

    public CommandLineFitsImageConverter(ExternalCommandRunner commandRunner, ThumbnailConfigurationProperties properties) {
        this.commandRunner = commandRunner;
        this.config = properties.getConverter();
    }

    @Override
    public void convert(List<Path> inputs, Path output, ThumbnailParameters parameters) {
        if (config.getCommand().isEmpty()) {
            throw new IllegalStateException("No converter command configured (thumbnails.converter.command)");
        }
        commandRunner.run(buildCommand(inputs, output, parameters), config.getTimeout());
    }

    List<String> buildCommand(List<Path> inputs, Path output, ThumbnailParameters parameters) {
        List<String> command = new ArrayList<>(config.getCommand());
        command.add("--width");
        command.add(Integer.toString(parameters.width()));
        command.add("--height");
        command.add(Integer.toString(parameters.height()));
        if (ValidationUtils.hasText(parameters.labelText())) {
            command.add("--label");
            command.add(parameters.labelText());
        }
        if (parameters.color()) {
            command.add("--color");
        }
        if (parameters.median()) {
            command.add("--median");
        }
        command.add("--percentile");
        command.add(Double.toString(parameters.percentile()));
        command.add("--quality");
        command.add(Integer.toString(parameters.quality()));
        command.add("--output");
        command.add(output.toString());
        inputs.forEach(input -> command.add(input.toString()));
        return command;
    }
}
