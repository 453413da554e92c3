package com.thumbservice.thumbnail_engine.controller;

import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ResponseBody;

/**
 * Keeps crawlers away from thumbnail URLs, which are per-request signed links.
 */
@Controller
public class RobotsController {

    static final String ROBOTS_TXT = String.join("\n",
            "User-agent: *",
            "Disallow: /"
    ) + "\n";

    @GetMapping(value = "/robots.txt", produces = "text/plain")
    @ResponseBody
    public String getRobotsTxt() {
        return ROBOTS_TXT;
    }
}
