/**
 * Client for the science archive: frame metadata lookups and raw frame downloads
 *
 * Features:
 * - Looks up a frame by id or by exact basename
 * - Lists the frames produced for an observation request at a given reduction level
 * - Streams raw frame bytes straight to a local file
 * - Forwards the caller's Authorization header to metadata calls only
 * - Classifies every failure as timeout, not found, upstream error or client error
 * - Performs no retries; every failure surfaces immediately
 */
package com.thumbservice.thumbnail_engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.thumbservice.thumbnail_engine.config.ThumbnailConfigurationProperties;
import com.thumbservice.thumbnail_engine.exception.ThumbnailException;
import com.thumbservice.thumbnail_engine.model.Frame;
import com.thumbservice.thumbnail_engine.util.ErrorHandlingUtils;
import com.thumbservice.thumbnail_engine.util.ExternalApiLogger;
import com.thumbservice.thumbnail_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class ArchiveApiClient {

    private static final String API_NAME = "Archive";

    private final WebClient webClient;
    private final ThumbnailConfigurationProperties properties;

    /**
     * Constructs ArchiveApiClient with required dependencies
     *
     * @param webClientBuilder WebClient builder
     * @param properties thumbnail configuration holding the archive base URL and timeouts
     */
    public ArchiveApiClient(WebClient.Builder webClientBuilder, ThumbnailConfigurationProperties properties) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
    }

    /**
     * Fetches a single frame's metadata by archive id
     *
     * @param frameId archive frame id
     * @param authorization caller's Authorization header value, may be null
     * @return the frame
     */
    public Frame getFrame(String frameId, String authorization) {
        String url = UriComponentsBuilder.fromHttpUrl(properties.getArchive().getApiUrl())
            .pathSegment("frames", frameId)
            .path("/")
            .toUriString();
        JsonNode node = fetchMetadata(url, null, authorization, properties.getArchive().getMetadataTimeout());
        return Frame.fromJson(node);
    }

    /**
     * Finds the single frame whose basename matches exactly
     *
     * @param basename frame basename without extension
     * @param authorization caller's Authorization header value, may be null
     * @return the frame
     * @throws ThumbnailException NOT_FOUND unless exactly one frame matches
     */
    public Frame findFrameByBasename(String basename, String authorization) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("basename_exact", basename);
        JsonNode node = fetchMetadata(framesUrl(), params, authorization, properties.getArchive().getMetadataTimeout());

        if (node.path("count").asInt(-1) != 1 || !node.path("results").isArray() || node.path("results").size() < 1) {
            throw ThumbnailException.notFound("Not found");
        }
        return Frame.fromJson(node.path("results").get(0));
    }

    /**
     * Lists every frame of an observation request at a reduction level
     *
     * @param requestId observation request id
     * @param reductionLevel archive reduction level, e.g. 91 for processed frames
     * @param authorization caller's Authorization header value, may be null
     * @return frames in archive order
     */
    public List<Frame> findFramesForRequest(String requestId, int reductionLevel, String authorization) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("request_id", requestId);
        params.put("reduction_level", reductionLevel);
        JsonNode node = fetchMetadata(framesUrl(), params, authorization, properties.getArchive().getRequestFramesTimeout());

        List<Frame> frames = new ArrayList<>();
        for (JsonNode result : node.path("results")) {
            frames.add(Frame.fromJson(result));
        }
        log.debug("Request {} has {} frames at reduction level {}", requestId, frames.size(), reductionLevel);
        return frames;
    }

    /**
     * Issues one GET against a metadata endpoint and parses the JSON body
     *
     * @param url endpoint URL
     * @param params query parameters, null values are skipped
     * @param authorization caller's Authorization header value, may be null
     * @param timeout overall response timeout
     * @return parsed body, or a missing node when the body is empty
     */
    public JsonNode fetchMetadata(String url, Map<String, ?> params, String authorization, Duration timeout) {
        URI uri = buildUri(url, params);
        boolean authenticated = ValidationUtils.hasText(authorization);
        ExternalApiLogger.logHttpRequest(log, "GET", uri.toString(), authenticated);

        try {
            ResponseEntity<JsonNode> response = webClient.get()
                .uri(uri)
                .headers(headers -> {
                    if (authenticated) {
                        headers.set(HttpHeaders.AUTHORIZATION, authorization);
                    }
                })
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .toEntity(JsonNode.class)
                .timeout(timeout)
                .block();

            if (response == null || response.getBody() == null) {
                return MissingNode.getInstance();
            }
            JsonNode body = response.getBody();
            ExternalApiLogger.logHttpResponse(log, response.getStatusCode().value(), uri.toString(), body.toString().length());
            return body;
        } catch (RuntimeException e) {
            ThumbnailException failure = ErrorHandlingUtils.toThumbnailException(e, url, params);
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "FETCH_METADATA", uri.toString(), failure.getMessage() + " (" + failure.getStatus() + ")");
            throw failure;
        }
    }

    /**
     * Streams raw frame bytes into a local file. No Authorization header is sent.
     *
     * @param url frame download URL
     * @param timeout overall download timeout
     * @param destination file to create or overwrite
     */
    public void fetchBytes(String url, Duration timeout, Path destination) {
        URI uri = URI.create(url);
        String logTarget = withoutQuery(uri);
        ExternalApiLogger.logHttpRequest(log, "GET", logTarget, false);

        try {
            Flux<DataBuffer> body = webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToFlux(DataBuffer.class);
            DataBufferUtils.write(body, destination,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)
                .timeout(timeout)
                .block();
            ExternalApiLogger.logHttpResponse(log, 200, logTarget, sizeOf(destination));
        } catch (RuntimeException e) {
            ThumbnailException failure = ErrorHandlingUtils.toThumbnailException(e, url, null);
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "FETCH_FRAME", logTarget, failure.getMessage() + " (" + failure.getStatus() + ")");
            throw failure;
        }
    }

    private String framesUrl() {
        return UriComponentsBuilder.fromHttpUrl(properties.getArchive().getApiUrl())
            .pathSegment("frames")
            .path("/")
            .toUriString();
    }

    private static URI buildUri(String url, Map<String, ?> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(url);
        if (params != null) {
            params.forEach((name, value) -> {
                if (value != null) {
                    builder.queryParam(name, value);
                }
            });
        }
        return builder.encode().build().toUri();
    }

    // Frame URLs are usually presigned; the signature stays out of the logs
    static String withoutQuery(URI uri) {
        return uri.getHost() == null ? uri.getPath() : uri.getHost() + uri.getPath();
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            return -1L;
        }
    }
}
