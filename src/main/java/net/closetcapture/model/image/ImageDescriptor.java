package net.closetcapture.model.image;

import jakarta.annotation.Nullable;

/**
 * Raw image handed over by an acquisition source, before validation.
 *
 * @param locator  file path or {@code file:} URI of the captured or selected image
 * @param fileName display file name, may differ from the locator's last segment
 * @param byteSize size declared by the source, 0 when unknown
 * @param width    pixel width reported by the source, 0 when unknown
 * @param height   pixel height reported by the source, 0 when unknown
 * @param mimeType MIME type reported by the source, null when unknown
 */
public record ImageDescriptor(
    String locator,
    String fileName,
    long byteSize,
    int width,
    int height,
    @Nullable String mimeType
) {

    public ImageDescriptor {
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("Image locator cannot be null or blank");
        }
    }
}
