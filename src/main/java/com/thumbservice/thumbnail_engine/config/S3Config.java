/**
 * Configuration for the S3 client and presigner used for thumbnail storage
 *
 * Features:
 * - Builds one S3Client and one S3Presigner per process from explicit s3.* properties
 * - Supports a custom endpoint URL for MinIO or other S3 compatible services
 * - Uses virtual-host style addressing and SigV4 presigning
 * - Refuses to start with missing bucket or credentials
 */
package com.thumbservice.thumbnail_engine.config;

import com.thumbservice.thumbnail_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

@Configuration
public class S3Config {
    private static final Logger logger = LoggerFactory.getLogger(S3Config.class);

    private final S3ConfigurationProperties properties;

    public S3Config(S3ConfigurationProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates the S3Client bean shared by every pipeline run
     *
     * @return Configured S3Client instance
     */
    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        validate();
        logger.info("Configuring S3Client for bucket {} in region {} (endpoint: {})",
            properties.getBucketName(), properties.getRegion(),
            ValidationUtils.hasText(properties.getServerUrl()) ? properties.getServerUrl() : "AWS default");

        var builder = S3Client.builder()
            .region(Region.of(properties.getRegion()))
            .serviceConfiguration(serviceConfiguration())
            .credentialsProvider(credentialsProvider());
        if (ValidationUtils.hasText(properties.getServerUrl())) {
            builder.endpointOverride(URI.create(properties.getServerUrl()));
        }
        return builder.build();
    }

    /**
     * Creates the S3Presigner bean used to sign time-limited GET URLs
     *
     * @return Configured S3Presigner instance
     */
    @Bean(destroyMethod = "close")
    public S3Presigner s3Presigner() {
        validate();
        var builder = S3Presigner.builder()
            .region(Region.of(properties.getRegion()))
            .serviceConfiguration(serviceConfiguration())
            .credentialsProvider(credentialsProvider());
        if (ValidationUtils.hasText(properties.getServerUrl())) {
            builder.endpointOverride(URI.create(properties.getServerUrl()));
        }
        return builder.build();
    }

    private S3Configuration serviceConfiguration() {
        return S3Configuration.builder()
            .pathStyleAccessEnabled(false)
            .build();
    }

    private StaticCredentialsProvider credentialsProvider() {
        return StaticCredentialsProvider.create(
            AwsBasicCredentials.create(properties.getAccessKeyId(), properties.getSecretAccessKey()));
    }

    private void validate() {
        if (!ValidationUtils.hasText(properties.getBucketName())) {
            throw new IllegalStateException("s3.bucket-name must be configured for thumbnail storage");
        }
        if (!ValidationUtils.hasText(properties.getAccessKeyId()) || !ValidationUtils.hasText(properties.getSecretAccessKey())) {
            throw new IllegalStateException("s3.access-key-id and s3.secret-access-key must be configured for thumbnail storage");
        }
    }
}
