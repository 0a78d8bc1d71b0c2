package net.closetcapture.service.acquisition;

import net.closetcapture.config.CaptureProperties;
import net.closetcapture.config.ProcessingProperties;
import net.closetcapture.model.image.ImageDescriptor;
import net.closetcapture.model.image.ValidationStatus;
import net.closetcapture.service.image.ImageCompressionService;
import net.closetcapture.service.image.ImageFormatValidator;
import net.closetcapture.service.processing.CancellationToken;
import net.closetcapture.testutil.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class ImageAcquisitionServiceTest {

    private static final long MB = 1024L * 1024L;

    @TempDir
    Path tempDir;

    private CaptureProperties captureProperties;
    private ImageAcquisitionService service;

    @BeforeEach
    void setUp() {
        captureProperties = new CaptureProperties();
        service = newService();
    }

    @Test
    void should_RepromptAndAccept_When_FirstPickIsRejected() {
        Path good = TestImages.writeJpeg(tempDir, "shirt.jpg", 120, 80);
        ScriptedSource source = new ScriptedSource(
            AcquisitionResult.picked(new ImageDescriptor("content://picker/1", "scarf.gif", 1024, 0, 0, null)),
            AcquisitionResult.picked(new ImageDescriptor(good.toUri().toString(), "shirt.jpg", 0, 120, 80, null))
        );

        StepVerifier.create(service.acquireValidated(source, CancellationToken.create()))
            .assertNext(outcome -> {
                assertThat(outcome.isAccepted()).isTrue();
                assertThat(outcome.descriptor().fileName()).isEqualTo("shirt.jpg");
            })
            .verifyComplete();

        assertThat(source.prompts).isEqualTo(2);
        assertThat(source.released).extracting(ImageDescriptor::fileName).containsExactly("scarf.gif");
    }

    @Test
    void should_ReturnLastRejection_When_ReacquisitionBudgetSpent() {
        captureProperties.setMaxReacquisitions(1);
        service = newService();
        ImageDescriptor tooBig = new ImageDescriptor("content://picker/2", "coat.jpg", 15 * MB, 0, 0, null);
        ScriptedSource source = new ScriptedSource(
            AcquisitionResult.picked(tooBig), AcquisitionResult.picked(tooBig), AcquisitionResult.picked(tooBig));

        StepVerifier.create(service.acquireValidated(source, CancellationToken.create()))
            .assertNext(outcome -> {
                assertThat(outcome.status()).isEqualTo(ValidationStatus.FILE_TOO_LARGE);
                assertThat(outcome.message()).isEqualTo("Image too large (15.0MB). Maximum: 10MB");
            })
            .verifyComplete();

        assertThat(source.prompts).isEqualTo(2);
    }

    @Test
    void should_ReturnSilentCancellation_When_UserDismissesPicker() {
        ScriptedSource source = new ScriptedSource(AcquisitionResult.cancelled());

        StepVerifier.create(service.acquireValidated(source, CancellationToken.create()))
            .assertNext(outcome -> {
                assertThat(outcome.status()).isEqualTo(ValidationStatus.CANCELLED);
                assertThat(outcome.message()).isNull();
            })
            .verifyComplete();
    }

    @Test
    void should_ClassifyAsPickerError_When_SourceThrows() {
        AcquisitionSource failing = () -> Mono.error(new IllegalStateException("camera permission denied"));

        StepVerifier.create(service.acquireValidated(failing, CancellationToken.create()))
            .assertNext(outcome -> {
                assertThat(outcome.status()).isEqualTo(ValidationStatus.PICKER_ERROR);
                assertThat(outcome.status().isRecoverable()).isFalse();
            })
            .verifyComplete();
    }

    @Test
    void should_NotPrompt_When_TokenAlreadyCancelled() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        ScriptedSource source = new ScriptedSource(AcquisitionResult.cancelled());

        StepVerifier.create(service.acquireValidated(source, token))
            .assertNext(outcome -> assertThat(outcome.status()).isEqualTo(ValidationStatus.CANCELLED))
            .verifyComplete();

        assertThat(source.prompts).isZero();
    }

    @Test
    void should_LoadRawBytes_When_DescriptorIsLocalFile() {
        Path large = TestImages.writeJpeg(tempDir, "dress.jpg", 3000, 1500);
        ImageDescriptor descriptor = new ImageDescriptor(large.toString(), "dress.jpg", 0, 0, 0, null);

        StepVerifier.create(service.load(descriptor))
            .assertNext(image -> {
                assertThat(image.mimeType()).isEqualTo("image/jpeg");
                assertThat(image.bytes()).hasSize((int) large.toFile().length());
            })
            .verifyComplete();
    }

    @Test
    void should_BoundPreviewToProfileEdge_When_RenderedOnRequest() {
        Path large = TestImages.writeJpeg(tempDir, "dress.jpg", 3000, 1500);
        ImageDescriptor descriptor = new ImageDescriptor(large.toString(), "dress.jpg", 0, 0, 0, null);

        StepVerifier.create(service.load(descriptor).flatMap(service::renderPreview))
            .assertNext(preview -> {
                assertThat(preview.fallbackToOriginal()).isFalse();
                assertThat(preview.longestEdge()).isEqualTo(2048);
                assertThat(preview.mimeType()).isEqualTo("image/jpeg");
            })
            .verifyComplete();
    }

    @Test
    void should_FailWithIoError_When_LocatorIsNotLocal() {
        ImageDescriptor remote = new ImageDescriptor("content://picker/9", "top.jpg", 10, 0, 0, null);

        StepVerifier.create(service.load(remote))
            .expectError(IOException.class)
            .verify();
    }

    private ImageAcquisitionService newService() {
        return new ImageAcquisitionService(new ImageFormatValidator(), new ImageCompressionService(),
            captureProperties, new ProcessingProperties(), Schedulers.immediate());
    }

    private static final class ScriptedSource implements AcquisitionSource {
        private final Deque<AcquisitionResult> script;
        private final List<ImageDescriptor> released = new CopyOnWriteArrayList<>();
        private int prompts;

        private ScriptedSource(AcquisitionResult... results) {
            this.script = new ArrayDeque<>(List.of(results));
        }

        @Override
        public Mono<AcquisitionResult> acquire() {
            return Mono.fromSupplier(() -> {
                prompts++;
                AcquisitionResult next = script.poll();
                return next == null ? AcquisitionResult.cancelled() : next;
            });
        }

        @Override
        public Mono<Void> release(ImageDescriptor descriptor) {
            return Mono.fromRunnable(() -> released.add(descriptor));
        }
    }
}
