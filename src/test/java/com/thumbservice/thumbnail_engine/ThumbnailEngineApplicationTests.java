/**
 * Basic application context load test for the thumbnail engine
 *
 * Features:
 * - Boots the full context against the real application.yml, logging setup included
 * - Supplies dummy S3 credentials so the storage beans pass their startup checks
 * - Serves as a smoke test for the entire application
 */

package com.thumbservice.thumbnail_engine;

import com.thumbservice.thumbnail_engine.config.ThumbnailConfigurationProperties;
import com.thumbservice.thumbnail_engine.service.ThumbnailPipelineService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(properties = {
    "s3.access-key-id=test-access-key",
    "s3.secret-access-key=test-secret-key",
    "s3.bucket-name=thumbnails-test",
    "s3.server-url=http://localhost:9000"
})
class ThumbnailEngineApplicationTests {

    @Autowired
    private ThumbnailPipelineService thumbnailPipelineService;

    @Autowired
    private ThumbnailConfigurationProperties thumbnailProperties;

    /**
     * Verifies that the Spring application context loads successfully
     */
    @Test
    void contextLoads() {
        assertNotNull(thumbnailPipelineService);
        assertThat(thumbnailProperties.getColorReductionLevel()).isEqualTo(91);
        assertThat(thumbnailProperties.getArchive().getMetadataTimeout()).hasSeconds(10);
    }
}
