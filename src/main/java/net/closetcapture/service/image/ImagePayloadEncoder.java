package net.closetcapture.service.image;

import java.util.Base64;
import org.springframework.stereotype.Component;

/**
 * Serializes compressed image bytes to standard base64 for the processing request.
 *
 * <p>The payload is encoded and sent as one unit, so the largest supported image is whatever the
 * transport and the remote service accept in a single request body.</p>
 */
@Component
public class ImagePayloadEncoder {

    public String encode(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Cannot encode null image bytes");
        }
        return Base64.getEncoder().encodeToString(bytes);
    }

    /** Length of the base64 text for {@code byteCount} input bytes, padding included. */
    public long encodedLength(long byteCount) {
        return 4 * ((byteCount + 2) / 3);
    }
}
