package net.closetcapture.service.image;

import net.closetcapture.model.image.CompressedImage;
import net.closetcapture.model.image.CompressionProfile;
import net.closetcapture.testutil.TestImages;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ImageCompressionServiceTest {

    private final ImageCompressionService service = new ImageCompressionService();

    @Test
    void should_BoundLongestEdge_When_ImageExceedsSubmissionProfile() throws IOException {
        byte[] raw = TestImages.jpeg(3000, 2000);

        CompressedImage result = service.compress(raw, "image/jpeg", CompressionProfile.SUBMISSION, "test-1");

        assertThat(result.fallbackToOriginal()).isFalse();
        assertThat(result.mimeType()).isEqualTo("image/jpeg");
        assertThat(result.width()).isEqualTo(1500);
        assertThat(result.height()).isEqualTo(1000);
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(result.bytes()));
        assertThat(Math.max(decoded.getWidth(), decoded.getHeight())).isLessThanOrEqualTo(1500);
    }

    @Test
    void should_NotUpscale_When_ImageIsSmallerThanProfile() {
        byte[] raw = TestImages.png(300, 400);

        CompressedImage result = service.compress(raw, "image/png", CompressionProfile.PREVIEW, "test-2");

        assertThat(result.fallbackToOriginal()).isFalse();
        assertThat(result.width()).isEqualTo(300);
        assertThat(result.height()).isEqualTo(400);
        assertThat(result.mimeType()).isEqualTo("image/jpeg");
    }

    @Test
    void should_ProduceIdenticalBytes_When_InputAndProfileRepeat() {
        byte[] raw = TestImages.jpeg(2200, 1100);

        CompressedImage first = service.compress(raw, "image/jpeg", CompressionProfile.SUBMISSION, "test-3a");
        CompressedImage second = service.compress(raw, "image/jpeg", CompressionProfile.SUBMISSION, "test-3b");

        assertThat(first.bytes()).isEqualTo(second.bytes());
    }

    @Test
    void should_PassOriginalThroughFlagged_When_BytesAreNotAnImage() {
        byte[] raw = "definitely not an image".getBytes();

        CompressedImage result = service.compress(raw, "image/heic", CompressionProfile.SUBMISSION, "test-4");

        assertThat(result.fallbackToOriginal()).isTrue();
        assertThat(result.bytes()).isEqualTo(raw);
        assertThat(result.mimeType()).isEqualTo("image/heic");
        assertThat(result.failureDetail()).isNotBlank();
    }

    @Test
    void should_HonourCustomProfile_When_ParametersDiffer() {
        byte[] raw = TestImages.jpeg(1000, 1000);

        CompressedImage result = service.compress(raw, "image/jpeg", new CompressionProfile(256, 0.5f), "test-5");

        assertThat(result.longestEdge()).isEqualTo(256);
    }
}
