package net.closetcapture.support.s3;

import net.closetcapture.exception.RelayException;
import net.closetcapture.exception.RelayFailureReason;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class S3BlobStorageGatewayTest {

    private static final String BUCKET = "clothes-photos";
    private static final String PATH = "profile-1/1718900000000_0123456789abcdef.jpg";

    private S3Client s3Client;
    private S3Presigner s3Presigner;
    private S3BlobStorageGateway gateway;

    @BeforeEach
    void setUp() {
        s3Client = Mockito.mock(S3Client.class);
        s3Presigner = S3Presigner.builder()
            .region(Region.US_EAST_1)
            .credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create("AKIDTEST", "secret")))
            .build();
        gateway = new S3BlobStorageGateway(s3Client, s3Presigner, BUCKET, "max-age=3600", Schedulers.immediate());
    }

    @AfterEach
    void tearDown() {
        s3Presigner.close();
    }

    @Test
    void should_PutObjectWithContentTypeAndCacheControl_When_Uploading() {
        StepVerifier.create(gateway.upload(PATH, new byte[] {1, 2, 3}, "image/png")).verifyComplete();

        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(request.capture(), any(RequestBody.class));
        assertThat(request.getValue().bucket()).isEqualTo(BUCKET);
        assertThat(request.getValue().key()).isEqualTo(PATH);
        assertThat(request.getValue().contentType()).isEqualTo("image/png");
        assertThat(request.getValue().cacheControl()).isEqualTo("max-age=3600");
    }

    @Test
    void should_ReportUploadFailed_When_S3RejectsPut() {
        S3Exception denied = (S3Exception) S3Exception.builder().message("Access Denied").statusCode(403).build();
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class))).thenThrow(denied);

        StepVerifier.create(gateway.upload(PATH, new byte[] {1}, "image/jpeg"))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(RelayException.class);
                assertThat(((RelayException) error).getReason()).isEqualTo(RelayFailureReason.UPLOAD_FAILED);
                assertThat(((RelayException) error).getTarget()).isEqualTo(PATH);
            })
            .verify();
    }

    @Test
    void should_PresignGetWithRequestedExpiry_When_SigningUrl() {
        StepVerifier.create(gateway.createSignedUrl(PATH, Duration.ofSeconds(900)))
            .assertNext(url -> {
                assertThat(url).startsWith("https://");
                assertThat(url).contains(BUCKET).contains("1718900000000_0123456789abcdef.jpg");
                assertThat(url).contains("X-Amz-Expires=900");
            })
            .verifyComplete();
    }

    @Test
    void should_DeleteObjectInBucket_When_Removing() {
        StepVerifier.create(gateway.remove(PATH)).verifyComplete();

        ArgumentCaptor<DeleteObjectRequest> request = ArgumentCaptor.forClass(DeleteObjectRequest.class);
        verify(s3Client).deleteObject(request.capture());
        assertThat(request.getValue().bucket()).isEqualTo(BUCKET);
        assertThat(request.getValue().key()).isEqualTo(PATH);
    }

    @Test
    void should_ReportStorageUnavailable_When_ClientsAreMissing() {
        S3BlobStorageGateway unconfigured = new S3BlobStorageGateway(null, null, BUCKET, "max-age=3600", Schedulers.immediate());
        unconfigured.validateConfiguration();

        StepVerifier.create(unconfigured.upload(PATH, new byte[] {1}, "image/jpeg"))
            .expectErrorSatisfies(error -> assertThat(((RelayException) error).getReason())
                .isEqualTo(RelayFailureReason.STORAGE_UNAVAILABLE))
            .verify();
        StepVerifier.create(unconfigured.createSignedUrl(PATH, Duration.ofSeconds(900)))
            .expectErrorSatisfies(error -> assertThat(((RelayException) error).getReason())
                .isEqualTo(RelayFailureReason.STORAGE_UNAVAILABLE))
            .verify();
    }
}
