package com.thumbservice.thumbnail_engine.controller;

import com.thumbservice.thumbnail_engine.model.Frame;
import com.thumbservice.thumbnail_engine.model.ThumbnailParameters;
import com.thumbservice.thumbnail_engine.service.ArchiveApiClient;
import com.thumbservice.thumbnail_engine.service.ThumbnailPipelineService;
import com.thumbservice.thumbnail_engine.util.ValidationUtils;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Thumbnail endpoints
 *
 * Features:
 * - {@code GET /{frameId}/} resolves a numeric archive frame id
 * - {@code GET /{basename}/} resolves a frame by exact basename
 * - Paths without the trailing slash are redirected to it
 * - Returns {@code {url, propid}} JSON, or redirects to the image when {@code image} is set
 * - Forwards the caller's Authorization header to the archive
 */
@RestController
@Slf4j
public class ThumbnailController {

    private static final Pattern FRAME_ID = Pattern.compile("\\d+");

    private final ArchiveApiClient archiveApiClient;
    private final ThumbnailPipelineService pipelineService;

    public ThumbnailController(ArchiveApiClient archiveApiClient, ThumbnailPipelineService pipelineService) {
        this.archiveApiClient = archiveApiClient;
        this.pipelineService = pipelineService;
    }

    /**
     * Thumbnail URLs always end with a slash; the bare form redirects there with the query intact.
     */
    @GetMapping("/{identifier}")
    public ResponseEntity<Void> addTrailingSlash(@PathVariable String identifier, HttpServletRequest request) {
        String location = UriComponentsBuilder.fromPath("/")
            .pathSegment(identifier)
            .path("/")
            .query(request.getQueryString())
            .build()
            .toUriString();
        return ResponseEntity.status(HttpStatus.PERMANENT_REDIRECT).location(URI.create(location)).build();
    }

    /**
     * Numeric identifiers are archive ids; anything else is looked up as a basename.
     */
    @GetMapping("/{identifier}/")
    public ResponseEntity<Object> getThumbnail(
            @PathVariable String identifier,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(defaultValue = "" + ThumbnailParameters.DEFAULT_WIDTH) int width,
            @RequestParam(defaultValue = "" + ThumbnailParameters.DEFAULT_HEIGHT) int height,
            @RequestParam(required = false) String label,
            @RequestParam(required = false) String color,
            @RequestParam(required = false) String median,
            @RequestParam(defaultValue = "" + ThumbnailParameters.DEFAULT_PERCENTILE) double percentile,
            @RequestParam(defaultValue = "" + ThumbnailParameters.DEFAULT_QUALITY) int quality,
            @RequestParam(required = false) String image) {

        ThumbnailParameters parameters = new ThumbnailParameters(
            width,
            height,
            label,
            ThumbnailParameters.flagEnabled(color),
            ThumbnailParameters.flagEnabled(median),
            percentile,
            quality);

        Frame frame = FRAME_ID.matcher(identifier).matches()
            ? archiveApiClient.getFrame(identifier, authorization)
            : archiveApiClient.findFrameByBasename(identifier, authorization);

        String url = pipelineService.generateOrRetrieve(frame, parameters, authorization);

        if (ValidationUtils.hasText(image)) {
            return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(url)).build();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("url", url);
        body.put("propid", frame.proposalId());
        return ResponseEntity.ok(body);
    }
}
