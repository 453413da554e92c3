/**
 * Thumbnail pipeline configuration properties
 * Centralizes all thumbnails.* configuration properties for type safety and IDE support
 */

package com.thumbservice.thumbnail_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "thumbnails")
public class ThumbnailConfigurationProperties {

    @NestedConfigurationProperty
    private Archive archive = new Archive();

    @NestedConfigurationProperty
    private Command converter = new Command();

    @NestedConfigurationProperty
    private Command aligner = new Command();

    private String tmpDir = System.getProperty("java.io.tmpdir");
    private String tmpFilenamePrefix = "thumbservice-";
    private int colorReductionLevel = 91;
    private List<String> validConfigurationTypes = new ArrayList<>(List.of(
        "ARC", "EXPERIMENTAL", "EXPOSE", "GUIDE", "LAMPFLAT", "REPEAT_EXPOSE",
        "SKYFLAT", "SPECTRUM", "STANDARD", "TARGET", "TRAILED"));
    private List<String> validConfigurationTypesForColor = new ArrayList<>(List.of(
        "EXPOSE", "REPEAT_EXPOSE", "STANDARD"));
    private List<String> rawImageExtensions = new ArrayList<>(List.of(".fits", ".fits.fz"));
    private String faviconUrl = "https://cdn.lco.global/mainstyle/img/favicon.ico";
    private String documentationUrl = "https://developers.lco.global";

    // Getters and setters
    public Archive getArchive() { return archive; }
    public void setArchive(Archive archive) { this.archive = archive; }

    public Command getConverter() { return converter; }
    public void setConverter(Command converter) { this.converter = converter; }

    public Command getAligner() { return aligner; }
    public void setAligner(Command aligner) { this.aligner = aligner; }

    public String getTmpDir() { return tmpDir; }
    public void setTmpDir(String tmpDir) { this.tmpDir = tmpDir; }

    public String getTmpFilenamePrefix() { return tmpFilenamePrefix; }
    public void setTmpFilenamePrefix(String tmpFilenamePrefix) { this.tmpFilenamePrefix = tmpFilenamePrefix; }

    public int getColorReductionLevel() { return colorReductionLevel; }
    public void setColorReductionLevel(int colorReductionLevel) { this.colorReductionLevel = colorReductionLevel; }

    public List<String> getValidConfigurationTypes() { return validConfigurationTypes; }
    public void setValidConfigurationTypes(List<String> validConfigurationTypes) { this.validConfigurationTypes = validConfigurationTypes; }

    public List<String> getValidConfigurationTypesForColor() { return validConfigurationTypesForColor; }
    public void setValidConfigurationTypesForColor(List<String> validConfigurationTypesForColor) { this.validConfigurationTypesForColor = validConfigurationTypesForColor; }

    public List<String> getRawImageExtensions() { return rawImageExtensions; }
    public void setRawImageExtensions(List<String> rawImageExtensions) { this.rawImageExtensions = rawImageExtensions; }

    public String getFaviconUrl() { return faviconUrl; }
    public void setFaviconUrl(String faviconUrl) { this.faviconUrl = faviconUrl; }

    public String getDocumentationUrl() { return documentationUrl; }
    public void setDocumentationUrl(String documentationUrl) { this.documentationUrl = documentationUrl; }

    // Nested configuration classes
    public static class Archive {
        private String apiUrl = "https://archive-api.lco.global/";
        private Duration metadataTimeout = Duration.ofSeconds(10);
        private Duration frameDownloadTimeout = Duration.ofSeconds(60);
        private Duration requestFramesTimeout = Duration.ofSeconds(30);

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }

        public Duration getMetadataTimeout() { return metadataTimeout; }
        public void setMetadataTimeout(Duration metadataTimeout) { this.metadataTimeout = metadataTimeout; }

        public Duration getFrameDownloadTimeout() { return frameDownloadTimeout; }
        public void setFrameDownloadTimeout(Duration frameDownloadTimeout) { this.frameDownloadTimeout = frameDownloadTimeout; }

        public Duration getRequestFramesTimeout() { return requestFramesTimeout; }
        public void setRequestFramesTimeout(Duration requestFramesTimeout) { this.requestFramesTimeout = requestFramesTimeout; }
    }

    /**
     * External tool invocation: executable plus fixed leading arguments, and a wall-clock limit.
     */
    public static class Command {
        private List<String> command = new ArrayList<>();
        private Duration timeout = Duration.ofMinutes(2);

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }
}
