package net.closetcapture.service.acquisition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import net.closetcapture.config.CaptureProperties;
import net.closetcapture.config.ProcessingProperties;
import net.closetcapture.config.SchedulerConfig;
import net.closetcapture.model.image.CompressedImage;
import net.closetcapture.model.image.CompressionProfile;
import net.closetcapture.model.image.ImageDescriptor;
import net.closetcapture.model.image.ValidationOutcome;
import net.closetcapture.service.image.ImageCompressionService;
import net.closetcapture.service.image.ImageFormatValidator;
import net.closetcapture.service.processing.CancellationToken;
import net.closetcapture.util.ImageLocators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Acquires and validates an image, re-prompting the source on recoverable rejections, then loads
 * the accepted image. The preview rendition is produced on request only.
 */
@Service
public class ImageAcquisitionService {

    private static final Logger logger = LoggerFactory.getLogger(ImageAcquisitionService.class);

    private final ImageFormatValidator validator;
    private final ImageCompressionService compressionService;
    private final Scheduler ioScheduler;
    private final int maxReacquisitions;
    private final CompressionProfile previewProfile;

    public ImageAcquisitionService(ImageFormatValidator validator,
                                   ImageCompressionService compressionService,
                                   CaptureProperties captureProperties,
                                   ProcessingProperties processingProperties,
                                   @Qualifier(SchedulerConfig.IO_SCHEDULER) Scheduler ioScheduler) {
        this.validator = validator;
        this.compressionService = compressionService;
        this.ioScheduler = ioScheduler;
        this.maxReacquisitions = Math.max(0, captureProperties.getMaxReacquisitions());
        this.previewProfile = new CompressionProfile(
            processingProperties.getPreviewMaxEdge(), processingProperties.getPreviewQuality());
    }

    /**
     * Prompts {@code source} until it yields an accepted image, a cancellation, a picker error, or
     * the re-acquisition budget runs out (the last rejection is then returned).
     *
     * <p>Rejected descriptors are released before the next prompt. Never signals an error.</p>
     */
    public Mono<ValidationOutcome> acquireValidated(AcquisitionSource source, CancellationToken token) {
        return attempt(source, token, 0);
    }

    private Mono<ValidationOutcome> attempt(AcquisitionSource source, CancellationToken token, int reacquisitions) {
        return Mono.defer(() -> {
            if (token.isCancelled()) {
                return Mono.just(ValidationOutcome.cancelled());
            }
            return source.acquire()
                .switchIfEmpty(Mono.fromSupplier(AcquisitionResult::cancelled))
                .onErrorResume(error -> {
                    logger.warn("Acquisition source failed: {}", error.getMessage());
                    return Mono.just(AcquisitionResult.error(error.getMessage()));
                })
                .flatMap(result -> handle(result, source, token, reacquisitions));
        });
    }

    private Mono<ValidationOutcome> handle(AcquisitionResult result,
                                           AcquisitionSource source,
                                           CancellationToken token,
                                           int reacquisitions) {
        switch (result.status()) {
            case CANCELLED:
                logger.debug("Acquisition cancelled by the user.");
                return Mono.just(ValidationOutcome.cancelled());
            case ERROR:
                return Mono.just(ValidationOutcome.pickerError(
                    result.message() == null ? "Could not access the selected image" : result.message()));
            default:
                break;
        }

        ImageDescriptor descriptor = result.descriptor();
        return Mono.fromCallable(() -> validator.validate(descriptor))
            .subscribeOn(ioScheduler)
            .flatMap(outcome -> {
                if (!outcome.status().isRecoverable()) {
                    return Mono.just(outcome);
                }
                Mono<Void> released = safeRelease(source, descriptor);
                if (reacquisitions >= maxReacquisitions) {
                    logger.info("Re-acquisition budget of {} spent; last rejection: {}", maxReacquisitions, outcome.message());
                    return released.thenReturn(outcome);
                }
                logger.info("Image rejected ({}): {}. Re-prompting ({}/{}).",
                    outcome.status(), outcome.message(), reacquisitions + 1, maxReacquisitions);
                return released.then(attempt(source, token, reacquisitions + 1));
            });
    }

    /**
     * Reads the accepted image on the I/O scheduler.
     */
    public Mono<AcquiredImage> load(ImageDescriptor descriptor) {
        return Mono.fromCallable(() -> {
                Path path = ImageLocators.toPath(descriptor.locator());
                if (path == null) {
                    throw new IOException("Locator is not a readable local file: " + descriptor.locator());
                }
                byte[] bytes = Files.readAllBytes(path);
                String mimeType = descriptor.mimeType() != null
                    ? descriptor.mimeType()
                    : validator.mimeTypeFor(descriptor.fileName() != null ? descriptor.fileName() : descriptor.locator());
                return new AcquiredImage(descriptor, bytes, mimeType);
            })
            .subscribeOn(ioScheduler);
    }

    /**
     * Compresses a loaded image with the preview profile for display before submission.
     */
    public Mono<CompressedImage> renderPreview(AcquiredImage image) {
        return Mono.fromCallable(() -> {
                CompressedImage preview = compressionService.compress(
                    image.bytes(), image.mimeType(), previewProfile, image.descriptor().fileName());
                if (preview.fallbackToOriginal()) {
                    logger.warn("Preview for {} fell back to original bytes.", image.descriptor().fileName());
                }
                return preview;
            })
            .subscribeOn(ioScheduler);
    }

    /**
     * Releases a descriptor, logging instead of failing.
     */
    public Mono<Void> safeRelease(AcquisitionSource source, ImageDescriptor descriptor) {
        return Mono.defer(() -> source.release(descriptor))
            .onErrorResume(error -> {
                logger.warn("Failed to release acquired image {}: {}", descriptor.locator(), error.getMessage());
                return Mono.empty();
            });
    }
}
