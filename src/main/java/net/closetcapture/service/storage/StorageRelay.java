package net.closetcapture.service.storage;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import net.closetcapture.config.GarmentStorageProperties;
import net.closetcapture.config.SchedulerConfig;
import net.closetcapture.exception.ProcessingException;
import net.closetcapture.exception.RelayException;
import net.closetcapture.exception.RelayFailureReason;
import net.closetcapture.model.storage.StorageRecord;
import net.closetcapture.service.processing.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyExtractors;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Moves a remotely hosted processed asset into durable storage and mints signed read URLs.
 *
 * <p>Relay flow:
 * <ol>
 *   <li>gate the source URL on scheme and host before any I/O</li>
 *   <li>download into a per-call scratch file and check the declared content type</li>
 *   <li>upload under a fresh {@code {ownerId}/{millis}_{hex}.jpg} path</li>
 * </ol>
 * The scratch file is deleted on every exit path, before the result is signalled; a failed delete
 * is only logged.
 * The relay never retries. A fired cancellation token stops the download and prevents the upload
 * from starting; an upload already in flight is left to finish.</p>
 */
@Service
public class StorageRelay {

    private static final Logger logger = LoggerFactory.getLogger(StorageRelay.class);
    static final String DEFAULT_CONTENT_TYPE = MediaType.IMAGE_JPEG_VALUE;
    private static final String SCRATCH_PREFIX = "relay-";
    private static final String SCRATCH_SUFFIX = ".download";

    private final WebClient webClient;
    private final BlobStorageGateway storageGateway;
    private final SourceUrlSafetyValidator urlSafetyValidator;
    private final StorageKeyGenerator keyGenerator;
    private final Clock clock;
    private final Scheduler ioScheduler;
    private final Duration signedUrlTtl;
    private final Set<String> allowedContentTypes;
    private final Path scratchDirectory;

    public StorageRelay(WebClient.Builder webClientBuilder,
                        BlobStorageGateway storageGateway,
                        SourceUrlSafetyValidator urlSafetyValidator,
                        StorageKeyGenerator keyGenerator,
                        GarmentStorageProperties storageProperties,
                        Clock clock,
                        @Qualifier(SchedulerConfig.IO_SCHEDULER) Scheduler ioScheduler) {
        this.webClient = webClientBuilder.build();
        this.storageGateway = storageGateway;
        this.urlSafetyValidator = urlSafetyValidator;
        this.keyGenerator = keyGenerator;
        this.clock = clock;
        this.ioScheduler = ioScheduler;
        this.signedUrlTtl = storageProperties.getSignedUrlTtl();
        this.allowedContentTypes = storageProperties.getAllowedContentTypes().stream()
            .map(type -> type.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        this.scratchDirectory = Paths.get(storageProperties.getScratchDirectory());
    }

    /**
     * Downloads {@code sourceUrl} and stores it under the owner's prefix.
     *
     * @return the storage path of the uploaded object
     * @throws IllegalArgumentException (as an error signal) when {@code ownerId} is not path-safe
     */
    public Mono<String> relay(String sourceUrl, String ownerId) {
        return relay(sourceUrl, ownerId, CancellationToken.create());
    }

    /**
     * Same as {@link #relay(String, String)}, stopping with a {@code CANCELLED}
     * {@link ProcessingException} once {@code token} fires.
     */
    public Mono<String> relay(String sourceUrl, String ownerId, CancellationToken token) {
        return Mono.defer(() -> {
            StorageKeyGenerator.validateOwnerId(ownerId);
            if (!urlSafetyValidator.isAllowedSourceUrl(sourceUrl)) {
                return Mono.error(new RelayException(RelayFailureReason.UNSAFE_URL,
                    "Relay source URL failed the safety check", sourceUrl));
            }
            if (token.isCancelled()) {
                return Mono.error(ProcessingException.cancelled());
            }
            String storagePath = keyGenerator.generatePath(ownerId);
            return Mono.usingWhen(
                createScratchFile(sourceUrl),
                scratch -> downloadAndUpload(sourceUrl, storagePath, scratch, token),
                this::deleteScratchFile,
                (scratch, error) -> deleteScratchFile(scratch),
                this::deleteScratchFile);
        })
        .doOnSuccess(path -> logger.info("Relayed {} to {}", sourceUrl, path))
        .doOnError(RelayException.class, error -> logger.warn("[code={}] Relay of {} failed: {}",
            error.getReason().code(), sourceUrl, error.getMessage()));
    }

    /**
     * Mints a signed read URL for an already stored object. Can be called again at any time to
     * replace an expired URL.
     */
    public Mono<StorageRecord> mintSignedUrl(String storagePath) {
        return Mono.defer(() -> {
            Instant issuedAt = clock.instant();
            return storageGateway.createSignedUrl(storagePath, signedUrlTtl)
                .map(signedUrl -> new StorageRecord(storagePath, signedUrl, issuedAt.plus(signedUrlTtl)));
        })
        .onErrorMap(error -> !(error instanceof RelayException),
            error -> new RelayException(RelayFailureReason.SIGNING_FAILED,
                "Could not sign " + storagePath, storagePath, error));
    }

    /**
     * Compensating delete. Completes normally even when the delete fails.
     */
    public Mono<Void> remove(String storagePath) {
        return storageGateway.remove(storagePath)
            .doOnSuccess(ignored -> logger.info("Removed stored object {}", storagePath))
            .onErrorResume(error -> {
                logger.warn("Failed to remove stored object {}: {}", storagePath, error.getMessage());
                return Mono.empty();
            });
    }

    private Mono<Path> createScratchFile(String sourceUrl) {
        return Mono.fromCallable(() -> {
                Files.createDirectories(scratchDirectory);
                return Files.createTempFile(scratchDirectory, SCRATCH_PREFIX, SCRATCH_SUFFIX);
            })
            .subscribeOn(ioScheduler)
            .onErrorMap(IOException.class, error -> new RelayException(RelayFailureReason.DOWNLOAD_FAILED,
                "Could not create scratch file", sourceUrl, error));
    }

    private Mono<String> downloadAndUpload(String sourceUrl, String storagePath, Path scratch,
                                           CancellationToken token) {
        Mono<String> cancelled = token.whenCancelled().then(Mono.<String>error(ProcessingException::cancelled));
        return Mono.firstWithSignal(download(sourceUrl, scratch), cancelled)
            .flatMap(contentType -> Mono.fromCallable(() -> Files.readAllBytes(scratch))
                .subscribeOn(ioScheduler)
                .onErrorMap(IOException.class, error -> new RelayException(RelayFailureReason.DOWNLOAD_FAILED,
                    "Could not read downloaded asset", sourceUrl, error))
                .flatMap(bytes -> token.isCancelled()
                    ? Mono.<Void>error(ProcessingException.cancelled())
                    : storageGateway.upload(storagePath, bytes, contentType)))
            .onErrorMap(error -> !(error instanceof RelayException || error instanceof ProcessingException),
                error -> new RelayException(RelayFailureReason.UPLOAD_FAILED,
                    "Upload failed for " + storagePath, storagePath, error))
            .thenReturn(storagePath);
    }

    /**
     * Streams the response body into {@code scratch} and returns the content type to store.
     */
    private Mono<String> download(String sourceUrl, Path scratch) {
        return webClient.get()
            .uri(URI.create(sourceUrl))
            .exchangeToMono(response -> handleDownloadResponse(response, sourceUrl, scratch))
            .onErrorMap(error -> !(error instanceof RelayException),
                error -> new RelayException(RelayFailureReason.DOWNLOAD_FAILED,
                    "Download failed: " + error.getMessage(), sourceUrl, error));
    }

    private Mono<String> handleDownloadResponse(ClientResponse response, String sourceUrl, Path scratch) {
        if (!response.statusCode().is2xxSuccessful()) {
            int status = response.statusCode().value();
            return response.releaseBody().then(Mono.error(new RelayException(RelayFailureReason.DOWNLOAD_FAILED,
                "Download returned HTTP " + status, sourceUrl)));
        }

        String contentType = declaredContentType(response);
        if (contentType == null) {
            contentType = DEFAULT_CONTENT_TYPE;
        } else if (!allowedContentTypes.contains(contentType)) {
            return response.releaseBody().then(Mono.error(new RelayException(
                RelayFailureReason.INVALID_CONTENT_TYPE,
                "Downloaded asset declared unsupported content type " + contentType, sourceUrl)));
        }

        // Raw buffers: the codec path would re-parse Content-Type and reject unusual parameters
        return DataBufferUtils.write(response.body(BodyExtractors.toDataBuffers()), scratch, StandardOpenOption.WRITE)
            .thenReturn(contentType);
    }

    /**
     * The {@code type/subtype} of the raw header, lowercased, or null when absent. Parameters are
     * ignored without being parsed, so values Spring's {@link MediaType} rejects (such as
     * {@code charset=binary}) are still judged on their type.
     */
    static String declaredContentType(ClientResponse response) {
        String raw = response.headers().asHttpHeaders().getFirst(HttpHeaders.CONTENT_TYPE);
        if (raw == null) {
            return null;
        }
        int separator = raw.indexOf(';');
        String type = (separator >= 0 ? raw.substring(0, separator) : raw).trim().toLowerCase(Locale.ROOT);
        return type.isEmpty() ? null : type;
    }

    private Mono<Void> deleteScratchFile(Path scratch) {
        return Mono.fromCallable(() -> Files.deleteIfExists(scratch))
            .subscribeOn(ioScheduler)
            .doOnNext(deleted -> logger.debug("Deleted scratch file {} (present={})", scratch, deleted))
            .onErrorResume(error -> {
                logger.warn("Failed to delete scratch file {}: {}", scratch, error.getMessage());
                return Mono.empty();
            })
            .then();
    }
}
