package net.closetcapture.service.acquisition;

import net.closetcapture.testutil.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LocalFileAcquisitionSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void should_OfferFilesInOrderThenCancel_When_ListIsExhausted() {
        Path first = TestImages.writeJpeg(tempDir, "a.jpg", 10, 10);
        LocalFileAcquisitionSource source = new LocalFileAcquisitionSource(List.of(first, tempDir.resolve("missing.jpg")));

        StepVerifier.create(source.acquire())
            .assertNext(result -> {
                assertThat(result.status()).isEqualTo(AcquisitionResult.Status.PICKED);
                assertThat(result.descriptor().fileName()).isEqualTo("a.jpg");
                assertThat(result.descriptor().byteSize()).isEqualTo(first.toFile().length());
                assertThat(result.descriptor().locator()).startsWith("file:");
            })
            .verifyComplete();
        StepVerifier.create(source.acquire())
            .assertNext(result -> assertThat(result.status()).isEqualTo(AcquisitionResult.Status.ERROR))
            .verifyComplete();
        StepVerifier.create(source.acquire())
            .assertNext(result -> assertThat(result.status()).isEqualTo(AcquisitionResult.Status.CANCELLED))
            .verifyComplete();
    }
}
