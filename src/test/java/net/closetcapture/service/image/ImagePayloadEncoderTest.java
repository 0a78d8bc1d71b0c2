package net.closetcapture.service.image;

import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImagePayloadEncoderTest {

    private final ImagePayloadEncoder encoder = new ImagePayloadEncoder();

    @Test
    void should_EncodeWithoutPrefixOrLineBreaks_When_PayloadIsLarge() {
        byte[] bytes = new byte[10_000];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) i;
        }

        String encoded = encoder.encode(bytes);

        assertThat(encoded).doesNotStartWith("data:").doesNotContain("\n");
        assertThat(Base64.getDecoder().decode(encoded)).isEqualTo(bytes);
        assertThat((long) encoded.length()).isEqualTo(encoder.encodedLength(bytes.length));
    }

    @Test
    void should_Reject_When_BytesAreNull() {
        assertThatThrownBy(() -> encoder.encode(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
