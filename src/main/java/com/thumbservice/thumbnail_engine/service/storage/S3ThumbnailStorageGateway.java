package com.thumbservice.thumbnail_engine.service.storage;

import com.thumbservice.thumbnail_engine.config.S3ConfigurationProperties;
import com.thumbservice.thumbnail_engine.exception.ThumbnailErrorKind;
import com.thumbservice.thumbnail_engine.exception.ThumbnailException;
import com.thumbservice.thumbnail_engine.monitoring.MetricsService;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * {@link ThumbnailStorageGateway} over a single S3 bucket.
 */
@Slf4j
@Service
public class S3ThumbnailStorageGateway implements ThumbnailStorageGateway {

    static final String STORAGE_FAILED_MESSAGE = "Failed to store thumbnail";

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final String bucketName;
    private final Duration presignedUrlTtl;
    private final MetricsService metricsService;

    public S3ThumbnailStorageGateway(S3Client s3Client,
                                     S3Presigner s3Presigner,
                                     S3ConfigurationProperties properties,
                                     MetricsService metricsService) {
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.bucketName = properties.getBucketName();
        this.presignedUrlTtl = properties.getPresignedUrlTtl();
        this.metricsService = metricsService;
    }

    @Override
    public boolean exists(String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (RuntimeException e) {
            // Unknown state is treated as a miss; the thumbnail is regenerated and re-uploaded
            log.warn("Could not check S3 key {} in bucket {}: {}", key, bucketName, e.getMessage());
            metricsService.incrementStorageError();
            return false;
        }
    }

    @Override
    public void upload(String key, Path file, String contentType) {
        Timer.Sample sample = metricsService.startUploadTimer();
        try {
            PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .contentType(contentType)
                .build();
            s3Client.putObject(putObjectRequest, RequestBody.fromFile(file));
            log.info("Successfully uploaded {} to S3 bucket {}", key, bucketName);
        } catch (SdkException | UncheckedIOException e) {
            metricsService.incrementStorageError();
            log.error("Error uploading {} to S3 bucket {}: {}", key, bucketName, e.getMessage(), e);
            throw new ThumbnailException(ThumbnailErrorKind.STORAGE_FAILED, STORAGE_FAILED_MESSAGE, e);
        } finally {
            metricsService.stopUploadTimer(sample);
        }
    }

    @Override
    public String presignedUrl(String key) {
        GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
            .signatureDuration(presignedUrlTtl)
            .getObjectRequest(GetObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build())
            .build();
        try {
            return s3Presigner.presignGetObject(presignRequest).url().toString();
        } catch (SdkException e) {
            log.error("Error signing URL for {} in S3 bucket {}: {}", key, bucketName, e.getMessage(), e);
            throw new ThumbnailException(ThumbnailErrorKind.STORAGE_FAILED, "Failed to sign thumbnail URL", e);
        }
    }
}
