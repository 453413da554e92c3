/**
 * Main application class for the thumbnail service
 *
 * Features:
 * - Serves JPEG thumbnails of archived FITS frames through presigned object storage URLs
 * - Entry point for Spring Boot application
 */

package com.thumbservice.thumbnail_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ThumbnailEngineApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(ThumbnailEngineApplication.class, args);
    }
}
