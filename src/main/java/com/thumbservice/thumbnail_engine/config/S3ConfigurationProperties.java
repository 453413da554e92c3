/**
 * S3 configuration properties
 */

package com.thumbservice.thumbnail_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "s3")
public class S3ConfigurationProperties {
    private String accessKeyId;
    private String secretAccessKey;
    private String serverUrl;
    private String region = "us-west-2";
    private String bucketName;
    private Duration presignedUrlTtl = Duration.ofHours(8);

    // Getters and setters
    public String getAccessKeyId() { return accessKeyId; }
    public void setAccessKeyId(String accessKeyId) { this.accessKeyId = accessKeyId; }

    public String getSecretAccessKey() { return secretAccessKey; }
    public void setSecretAccessKey(String secretAccessKey) { this.secretAccessKey = secretAccessKey; }

    public String getServerUrl() { return serverUrl; }
    public void setServerUrl(String serverUrl) { this.serverUrl = serverUrl; }

    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }

    public String getBucketName() { return bucketName; }
    public void setBucketName(String bucketName) { this.bucketName = bucketName; }

    public Duration getPresignedUrlTtl() { return presignedUrlTtl; }
    public void setPresignedUrlTtl(Duration presignedUrlTtl) { this.presignedUrlTtl = presignedUrlTtl; }
}
