package com.thumbservice.thumbnail_engine.service.storage;

import com.thumbservice.thumbnail_engine.config.S3ConfigurationProperties;
import com.thumbservice.thumbnail_engine.exception.ThumbnailErrorKind;
import com.thumbservice.thumbnail_engine.exception.ThumbnailException;
import com.thumbservice.thumbnail_engine.monitoring.MetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class S3ThumbnailStorageGatewayTest {

    @Mock
    private S3Client s3Client;

    @Mock
    private S3Presigner s3Presigner;

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry meterRegistry;
    private S3ThumbnailStorageGateway gateway;

    @BeforeEach
    void setUp() {
        S3ConfigurationProperties properties = new S3ConfigurationProperties();
        properties.setBucketName("thumbnails");
        meterRegistry = new SimpleMeterRegistry();
        gateway = new S3ThumbnailStorageGateway(s3Client, s3Presigner, properties, new MetricsService(meterRegistry));
    }

    @Test
    void existsIsTrueWhenHeadSucceeds() {
        when(s3Client.headObject(any(HeadObjectRequest.class))).thenReturn(HeadObjectResponse.builder().build());

        assertThat(gateway.exists("42.abc.jpg")).isTrue();

        ArgumentCaptor<HeadObjectRequest> request = ArgumentCaptor.forClass(HeadObjectRequest.class);
        verify(s3Client).headObject(request.capture());
        assertThat(request.getValue().bucket()).isEqualTo("thumbnails");
        assertThat(request.getValue().key()).isEqualTo("42.abc.jpg");
    }

    @Test
    void existsIsFalseForMissingKey() {
        when(s3Client.headObject(any(HeadObjectRequest.class))).thenThrow(NoSuchKeyException.builder().build());

        assertThat(gateway.exists("42.abc.jpg")).isFalse();
    }

    @Test
    void existsIsFalseOnAnyOtherError() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
            .thenThrow(S3Exception.builder().statusCode(403).message("Forbidden").build());

        assertThat(gateway.exists("42.abc.jpg")).isFalse();
        assertThat(meterRegistry.counter("s3.errors").count()).isEqualTo(1.0);
    }

    @Test
    void uploadPutsJpegWithContentType() throws IOException {
        Path jpeg = Files.write(tempDir.resolve("out.jpg"), new byte[] {(byte) 0xFF, (byte) 0xD8});
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
            .thenReturn(PutObjectResponse.builder().build());

        gateway.upload("42.abc.jpg", jpeg, ThumbnailStorageGateway.JPEG_CONTENT_TYPE);

        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(request.capture(), any(RequestBody.class));
        assertThat(request.getValue().bucket()).isEqualTo("thumbnails");
        assertThat(request.getValue().key()).isEqualTo("42.abc.jpg");
        assertThat(request.getValue().contentType()).isEqualTo("image/jpeg");
    }

    @Test
    void uploadFailureIsStorageFailed() throws IOException {
        Path jpeg = Files.write(tempDir.resolve("out.jpg"), new byte[] {1});
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
            .thenThrow(SdkClientException.create("connection reset"));

        assertThatThrownBy(() -> gateway.upload("42.abc.jpg", jpeg, "image/jpeg"))
            .isInstanceOf(ThumbnailException.class)
            .satisfies(e -> assertThat(((ThumbnailException) e).getKind()).isEqualTo(ThumbnailErrorKind.STORAGE_FAILED))
            .satisfies(e -> assertThat(((ThumbnailException) e).getStatus()).isEqualTo(500));
    }

    @Test
    void presignedUrlUsesConfiguredTtlWithoutCheckingExistence() throws Exception {
        PresignedGetObjectRequest presigned = mock(PresignedGetObjectRequest.class);
        when(presigned.url()).thenReturn(new URL("https://thumbnails.s3.us-west-2.amazonaws.com/42.abc.jpg?X-Amz-Signature=x"));
        when(s3Presigner.presignGetObject(any(GetObjectPresignRequest.class))).thenReturn(presigned);

        String url = gateway.presignedUrl("42.abc.jpg");

        assertThat(url).startsWith("https://thumbnails.s3.us-west-2.amazonaws.com/42.abc.jpg");
        ArgumentCaptor<GetObjectPresignRequest> request = ArgumentCaptor.forClass(GetObjectPresignRequest.class);
        verify(s3Presigner).presignGetObject(request.capture());
        assertThat(request.getValue().signatureDuration()).isEqualTo(Duration.ofHours(8));
        assertThat(request.getValue().getObjectRequest().key()).isEqualTo("42.abc.jpg");
        verify(s3Client, never()).headObject(any(HeadObjectRequest.class));
    }
}
