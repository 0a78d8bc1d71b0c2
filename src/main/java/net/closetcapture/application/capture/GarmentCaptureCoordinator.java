package net.closetcapture.application.capture;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import net.closetcapture.exception.ProcessingErrorCode;
import net.closetcapture.exception.ProcessingException;
import net.closetcapture.exception.RelayException;
import net.closetcapture.exception.RelayFailureReason;
import net.closetcapture.model.image.ImageDescriptor;
import net.closetcapture.model.image.ValidationOutcome;
import net.closetcapture.model.image.ValidationStatus;
import net.closetcapture.model.processing.ProcessingResult;
import net.closetcapture.model.storage.StoredGarment;
import net.closetcapture.service.acquisition.AcquisitionSource;
import net.closetcapture.service.acquisition.ImageAcquisitionService;
import net.closetcapture.service.image.ImageFormatValidator;
import net.closetcapture.service.processing.CancellationToken;
import net.closetcapture.service.processing.PreparedSubmission;
import net.closetcapture.service.processing.ProcessingClient;
import net.closetcapture.service.processing.ProcessingRun;
import net.closetcapture.service.storage.StorageKeyGenerator;
import net.closetcapture.service.storage.StorageRelay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Chains acquisition, processing and storage for one garment photo.
 *
 * <p>Every failure is folded into a {@link CaptureOutcome}; the returned {@code Mono} only errors
 * for an invalid owner id. The acquired image is released on every exit path, including
 * subscription cancellation. Uploaded objects are removed again when a later step before the
 * record save fails or the run is cancelled. No relay starts once the token has fired.</p>
 */
@Service
public class GarmentCaptureCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(GarmentCaptureCoordinator.class);

    private static final String RELAY_USER_MESSAGE = "Could not save your photo, please try again";
    private static final String UNEXPECTED_USER_MESSAGE = "Something went wrong, please try again";

    /** Structured codes for capture pipeline diagnostics. */
    enum CaptureErrorCode {
        IMAGE_UNREADABLE("CAPTURE_IMAGE_UNREADABLE"),
        FALLBACK_TOO_LARGE("CAPTURE_FALLBACK_TOO_LARGE"),
        PROCESSED_RELAY_DEGRADED("CAPTURE_PROCESSED_RELAY_DEGRADED"),
        COMPENSATION_TRIGGERED("CAPTURE_COMPENSATION_TRIGGERED"),
        UNEXPECTED_FAILURE("CAPTURE_UNEXPECTED_FAILURE");

        private final String code;
        CaptureErrorCode(String code) { this.code = code; }
        String code() { return code; }
    }

    private final ImageAcquisitionService acquisitionService;
    private final ImageFormatValidator validator;
    private final ProcessingClient processingClient;
    private final StorageRelay storageRelay;
    private final GarmentRecordSink recordSink;

    private final Counter captureAttempts;
    private final Counter captureSuccesses;
    private final Counter captureFailures;
    private final Counter captureCancellations;
    private final Counter processingFallbacks;
    private final Counter compensations;

    public GarmentCaptureCoordinator(ImageAcquisitionService acquisitionService,
                                     ImageFormatValidator validator,
                                     ProcessingClient processingClient,
                                     StorageRelay storageRelay,
                                     GarmentRecordSink recordSink,
                                     MeterRegistry meterRegistry) {
        this.acquisitionService = acquisitionService;
        this.validator = validator;
        this.processingClient = processingClient;
        this.storageRelay = storageRelay;
        this.recordSink = recordSink;

        this.captureAttempts = meterRegistry.counter("garment.capture.attempts");
        this.captureSuccesses = meterRegistry.counter("garment.capture.success");
        this.captureFailures = meterRegistry.counter("garment.capture.failure");
        this.captureCancellations = meterRegistry.counter("garment.capture.cancelled");
        this.processingFallbacks = meterRegistry.counter("garment.capture.processing.fallback");
        this.compensations = meterRegistry.counter("garment.capture.compensations");
    }

    /**
     * Runs one capture from the acquisition prompt to a stored, signed garment photo.
     */
    public Mono<CaptureOutcome> capture(AcquisitionSource source, String ownerId, CancellationToken token) {
        return Mono.defer(() -> {
            StorageKeyGenerator.validateOwnerId(ownerId);
            captureAttempts.increment();
            CancellationToken runToken = CancellationToken.linkedTo(token);
            return acquisitionService.acquireValidated(source, runToken)
                .flatMap(validation -> afterValidation(validation, source, ownerId, runToken))
                .doFinally(signal -> runToken.detach());
        })
        .doOnNext(this::recordOutcome);
    }

    private Mono<CaptureOutcome> afterValidation(ValidationOutcome validation,
                                                 AcquisitionSource source,
                                                 String ownerId,
                                                 CancellationToken token) {
        if (validation.status() == ValidationStatus.CANCELLED) {
            return Mono.just(CaptureOutcome.cancelled());
        }
        if (!validation.isAccepted()) {
            return Mono.just(CaptureOutcome.validationFailed(validation.status().name(), validation.message()));
        }

        ImageDescriptor descriptor = Objects.requireNonNull(validation.descriptor());
        return Mono.usingWhen(
            Mono.just(descriptor),
            accepted -> processAndStore(accepted, ownerId, token)
                .onErrorResume(error -> Mono.just(classify(error, ownerId))),
            accepted -> acquisitionService.safeRelease(source, accepted),
            (accepted, error) -> acquisitionService.safeRelease(source, accepted),
            accepted -> acquisitionService.safeRelease(source, accepted)
        );
    }

    private Mono<CaptureOutcome> processAndStore(ImageDescriptor descriptor, String ownerId, CancellationToken token) {
        ProcessingRun run = processingClient.newRun(ownerId, token);
        return checkpoint(token)
            .then(acquisitionService.load(descriptor))
            .flatMap(image -> processingClient.prepare(image.bytes(), image.mimeType(), run))
            .flatMap(prepared -> {
                if (exceedsCeilingAfterFallback(prepared)) {
                    logger.warn("[code={}] Run {}: uncompressed fallback of {} bytes exceeds the size ceiling.",
                        CaptureErrorCode.FALLBACK_TOO_LARGE.code(), run.idempotencyKey(), prepared.submittedBytes());
                    return Mono.just(CaptureOutcome.validationFailed(
                        ValidationStatus.FILE_TOO_LARGE.name(), validator.tooLargeMessage(prepared.submittedBytes())));
                }
                return processingClient.submit(prepared, run)
                    .flatMap(result -> store(result, ownerId, token));
            });
    }

    private boolean exceedsCeilingAfterFallback(PreparedSubmission prepared) {
        return prepared.compressionFallback() && !validator.validateSize(prepared.submittedBytes());
    }

    private Mono<CaptureOutcome> store(ProcessingResult result, String ownerId, CancellationToken token) {
        if (result.usedFallback()) {
            processingFallbacks.increment();
        }
        List<String> uploadedPaths = new CopyOnWriteArrayList<>();

        Mono<SavedGarment> saved = checkpoint(token)
            .then(storageRelay.relay(result.originalAssetUrl(), ownerId, token))
            .doOnNext(uploadedPaths::add)
            .flatMap(originalPath -> checkpoint(token)
                .then(relayProcessed(result, ownerId, token)
                    .doOnNext(uploadedPaths::add)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty()))
                .map(processedPath -> new StoredGarment(ownerId, result.assetId(), originalPath,
                    processedPath.orElse(null), result.suggestedCategory())))
            .flatMap(garment -> checkpoint(token)
                .then(persist(garment))
                .map(recordId -> new SavedGarment(garment, recordId)))
            .onErrorResume(error -> compensate(uploadedPaths, error));

        return saved
            .flatMap(record -> storageRelay.mintSignedUrl(record.garment().displayPath())
                .map(signed -> CaptureOutcome.stored(record.garment(), record.recordId(), signed, result)))
            .onErrorMap(RelayException.class, error -> new RelayOutcomeException(error, result));
    }

    /**
     * Relays the processed asset when there is one distinct from the original. Failure degrades to
     * original-only storage.
     */
    private Mono<String> relayProcessed(ProcessingResult result, String ownerId, CancellationToken token) {
        String processedUrl = result.processedAssetUrl();
        if (processedUrl == null || processedUrl.equals(result.originalAssetUrl())) {
            return Mono.empty();
        }
        return storageRelay.relay(processedUrl, ownerId, token)
            .onErrorResume(RelayException.class, error -> {
                logger.warn("[code={}] Processed asset {} not stored, keeping original only: {}",
                    CaptureErrorCode.PROCESSED_RELAY_DEGRADED.code(), result.assetId(), error.getMessage());
                return Mono.empty();
            });
    }

    private Mono<String> persist(StoredGarment garment) {
        return recordSink.save(garment)
            .switchIfEmpty(Mono.error(() -> new RelayException(RelayFailureReason.RECORD_PERSIST_FAILED,
                "Record sink returned no id", garment.originalPath())))
            .onErrorMap(error -> !(error instanceof RelayException),
                error -> new RelayException(RelayFailureReason.RECORD_PERSIST_FAILED,
                    "Could not save garment record: " + error.getMessage(), garment.originalPath(), error));
    }

    private <T> Mono<T> compensate(List<String> uploadedPaths, Throwable error) {
        if (uploadedPaths.isEmpty()) {
            return Mono.error(error);
        }
        compensations.increment();
        logger.warn("[code={}] Removing {} uploaded object(s) after failure: {}",
            CaptureErrorCode.COMPENSATION_TRIGGERED.code(), uploadedPaths.size(), error.getMessage());
        return Mono.when(uploadedPaths.stream().map(storageRelay::remove).toList())
            .then(Mono.error(error));
    }

    private static Mono<Void> checkpoint(CancellationToken token) {
        return Mono.defer(() -> token.isCancelled()
            ? Mono.error(ProcessingException.cancelled())
            : Mono.empty());
    }

    private CaptureOutcome classify(Throwable error, String ownerId) {
        if (error instanceof ProcessingException processingException) {
            if (processingException.getErrorCode() == ProcessingErrorCode.CANCELLED) {
                return CaptureOutcome.cancelled();
            }
            return CaptureOutcome.processingFailed(
                processingException.getErrorCode().code(), processingException.getUserMessage());
        }
        if (error instanceof RelayOutcomeException relayOutcome) {
            RelayException relayException = relayOutcome.relayException;
            return CaptureOutcome.relayFailed(relayException.getReason().code(), RELAY_USER_MESSAGE, relayOutcome.result);
        }
        if (error instanceof RelayException relayException) {
            return CaptureOutcome.relayFailed(relayException.getReason().code(), RELAY_USER_MESSAGE, null);
        }
        if (error instanceof IOException || error instanceof UncheckedIOException) {
            logger.warn("[code={}] Could not read accepted image for owner {}: {}",
                CaptureErrorCode.IMAGE_UNREADABLE.code(), ownerId, error.getMessage());
            return CaptureOutcome.validationFailed(ValidationStatus.PICKER_ERROR.name(),
                "Could not read the selected image");
        }
        logger.error("[code={}] Unexpected capture failure for owner {}: {}",
            CaptureErrorCode.UNEXPECTED_FAILURE.code(), ownerId, error.getMessage(), error);
        return CaptureOutcome.processingFailed(CaptureErrorCode.UNEXPECTED_FAILURE.code(), UNEXPECTED_USER_MESSAGE);
    }

    private void recordOutcome(CaptureOutcome outcome) {
        switch (outcome.status()) {
            case STORED:
                captureSuccesses.increment();
                break;
            case CANCELLED:
                captureCancellations.increment();
                break;
            default:
                captureFailures.increment();
                logger.info("Capture ended with {} [code={}]", outcome.status(), outcome.code());
                break;
        }
    }

    private record SavedGarment(StoredGarment garment, String recordId) {}

    /** Carries the processing result alongside a relay failure so the outcome can report it. */
    private static final class RelayOutcomeException extends RuntimeException {
        private final RelayException relayException;
        private final ProcessingResult result;

        private RelayOutcomeException(RelayException relayException, ProcessingResult result) {
            super(relayException.getMessage(), relayException);
            this.relayException = relayException;
            this.result = result;
        }
    }
}
