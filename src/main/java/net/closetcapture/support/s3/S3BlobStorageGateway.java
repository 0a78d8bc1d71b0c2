package net.closetcapture.support.s3;

import java.time.Duration;
import net.closetcapture.exception.RelayException;
import net.closetcapture.exception.RelayFailureReason;
import net.closetcapture.service.storage.BlobStorageGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

/**
 * Infrastructure adapter implementing {@link BlobStorageGateway} on the AWS SDK.
 *
 * <p>All direct SDK usage for garment photos lives here. Blocking SDK calls are shifted onto the
 * supplied I/O scheduler. Missing clients surface as {@link RelayFailureReason#STORAGE_UNAVAILABLE}.</p>
 */
public final class S3BlobStorageGateway implements BlobStorageGateway {

    private static final Logger logger = LoggerFactory.getLogger(S3BlobStorageGateway.class);

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final String bucketName;
    private final String cacheControl;
    private final Scheduler ioScheduler;

    public S3BlobStorageGateway(@Nullable S3Client s3Client,
                                @Nullable S3Presigner s3Presigner,
                                String bucketName,
                                String cacheControl,
                                Scheduler ioScheduler) {
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.bucketName = bucketName;
        this.cacheControl = cacheControl;
        this.ioScheduler = ioScheduler;
    }

    /**
     * Validates startup configuration for this adapter.
     */
    public void validateConfiguration() {
        if (s3Client == null || s3Presigner == null) {
            logger.warn("Garment storage gateway initialized without S3 client or presigner. Storage operations are disabled.");
            return;
        }
        if (!hasText(bucketName)) {
            throw new IllegalStateException("Storage bucket name must be configured when S3 storage is active.");
        }
    }

    @Override
    public Mono<Void> upload(String path, byte[] bytes, String contentType) {
        return Mono.fromRunnable(() -> {
                S3Client client = requireClient("upload", path);
                PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                    .bucket(bucketName)
                    .key(path)
                    .contentType(contentType)
                    .cacheControl(cacheControl)
                    .build();
                client.putObject(putObjectRequest, RequestBody.fromBytes(bytes));
                logger.info("Uploaded {} ({} bytes, {}) to bucket {}", path, bytes.length, contentType, bucketName);
            })
            .subscribeOn(ioScheduler)
            .onErrorMap(exception -> !(exception instanceof RelayException),
                exception -> new RelayException(RelayFailureReason.UPLOAD_FAILED,
                    "Upload failed for " + path + ": " + describe(exception), path, exception))
            .then();
    }

    @Override
    public Mono<String> createSignedUrl(String path, Duration ttl) {
        return Mono.fromCallable(() -> {
                S3Presigner presigner = requirePresigner(path);
                GetObjectRequest getObjectRequest = GetObjectRequest.builder()
                    .bucket(bucketName)
                    .key(path)
                    .build();
                GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                    .signatureDuration(ttl)
                    .getObjectRequest(getObjectRequest)
                    .build();
                PresignedGetObjectRequest presigned = presigner.presignGetObject(presignRequest);
                logger.debug("Signed {} for {}", path, ttl);
                return presigned.url().toString();
            })
            .onErrorMap(exception -> !(exception instanceof RelayException),
                exception -> new RelayException(RelayFailureReason.SIGNING_FAILED,
                    "Could not sign " + path + ": " + describe(exception), path, exception));
    }

    @Override
    public Mono<Void> remove(String path) {
        return Mono.fromRunnable(() -> {
                S3Client client = requireClient("delete", path);
                DeleteObjectRequest deleteRequest = DeleteObjectRequest.builder()
                    .bucket(bucketName)
                    .key(path)
                    .build();
                client.deleteObject(deleteRequest);
                logger.info("Deleted object {}", path);
            })
            .subscribeOn(ioScheduler)
            .onErrorMap(exception -> !(exception instanceof RelayException),
                exception -> new RelayException(RelayFailureReason.UPLOAD_FAILED,
                    "Delete failed for " + path + ": " + describe(exception), path, exception))
            .then();
    }

    public String bucketName() {
        return bucketName;
    }

    private S3Client requireClient(String operation, String path) {
        if (s3Client == null) {
            throw new RelayException(RelayFailureReason.STORAGE_UNAVAILABLE,
                "S3 client is not configured for " + operation + " operation", path);
        }
        return s3Client;
    }

    private S3Presigner requirePresigner(String path) {
        if (s3Presigner == null) {
            throw new RelayException(RelayFailureReason.STORAGE_UNAVAILABLE,
                "S3 presigner is not configured", path);
        }
        return s3Presigner;
    }

    private static String describe(Throwable exception) {
        if (exception instanceof S3Exception s3Exception
            && s3Exception.awsErrorDetails() != null
            && s3Exception.awsErrorDetails().errorMessage() != null) {
            return s3Exception.awsErrorDetails().errorMessage();
        }
        if (exception instanceof SdkClientException) {
            return "client error: " + exception.getMessage();
        }
        return exception.getMessage();
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
