/**
 * Record representing the output of one compression pass
 *
 * Features:
 * - Immutable container for image data and metadata
 * - Flags the degraded path where the original bytes were passed through unchanged
 * - Implements defensive copy for mutable byte arrays
 *
 * @param bytes              image data to submit
 * @param mimeType           MIME type matching {@code bytes}
 * @param width              pixel width, 0 when the original passed through undecoded
 * @param height             pixel height, 0 when the original passed through undecoded
 * @param fallbackToOriginal true when compression failed and {@code bytes} are the untouched input
 * @param failureDetail      why compression fell back, null on success
 */

package net.closetcapture.model.image;

import jakarta.annotation.Nullable;
import java.util.Arrays;

public record CompressedImage(
        byte[] bytes,
        String mimeType,
        int width,
        int height,
        boolean fallbackToOriginal,
        @Nullable String failureDetail) {

    public CompressedImage {
        if (bytes != null) {
            bytes = Arrays.copyOf(bytes, bytes.length);
        }
    }

    public static CompressedImage jpeg(byte[] bytes, int width, int height) {
        return new CompressedImage(bytes, "image/jpeg", width, height, false, null);
    }

    public static CompressedImage passthrough(byte[] originalBytes, String mimeType, String failureDetail) {
        return new CompressedImage(originalBytes, mimeType, 0, 0, true, failureDetail);
    }

    @Override
    public byte[] bytes() {
        return bytes == null ? null : Arrays.copyOf(bytes, bytes.length);
    }

    public int size() {
        return bytes == null ? 0 : bytes.length;
    }

    public int longestEdge() {
        return Math.max(width, height);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompressedImage that)) return false;
        return width == that.width
            && height == that.height
            && fallbackToOriginal == that.fallbackToOriginal
            && Arrays.equals(bytes, that.bytes)
            && java.util.Objects.equals(mimeType, that.mimeType)
            && java.util.Objects.equals(failureDetail, that.failureDetail);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(Arrays.hashCode(bytes), mimeType, width, height, fallbackToOriginal, failureDetail);
    }

    @Override
    public String toString() {
        return "CompressedImage{" +
            "bytes=" + size() + " bytes" +
            ", mimeType='" + mimeType + '\'' +
            ", width=" + width +
            ", height=" + height +
            ", fallbackToOriginal=" + fallbackToOriginal +
            '}';
    }
}
