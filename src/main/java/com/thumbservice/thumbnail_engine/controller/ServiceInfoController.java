package com.thumbservice.thumbnail_engine.controller;

import com.thumbservice.thumbnail_engine.config.ThumbnailConfigurationProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.util.HtmlUtils;

import java.net.URI;

/**
 * Favicon redirect and a pointer to the documentation for every path no other handler claims.
 */
@Controller
public class ServiceInfoController {

    private final ThumbnailConfigurationProperties properties;

    public ServiceInfoController(ThumbnailConfigurationProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/favicon.ico")
    public ResponseEntity<Void> favicon() {
        return ResponseEntity.status(HttpStatus.FOUND)
            .location(URI.create(properties.getFaviconUrl()))
            .build();
    }

    @GetMapping(value = "/**", produces = MediaType.TEXT_HTML_VALUE)
    @ResponseBody
    public String index() {
        String url = HtmlUtils.htmlEscape(properties.getDocumentationUrl());
        String label = HtmlUtils.htmlEscape(properties.getDocumentationUrl().replaceFirst("^https?://", ""));
        return "Please see the documentation for the thumbnail service at <a href=\"" + url + "\">" + label + "</a>";
    }
}
