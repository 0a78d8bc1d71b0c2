package net.closetcapture.model.image;

/**
 * Target bounds for one compression pass.
 *
 * @param maxEdge longest edge in pixels the output may have
 * @param quality JPEG quality between 0 (exclusive) and 1 (inclusive)
 */
public record CompressionProfile(int maxEdge, float quality) {

    /** Pass run before the preview screen. */
    public static final CompressionProfile PREVIEW = new CompressionProfile(2048, 0.8f);

    /** Pass run before submission to the processing service. */
    public static final CompressionProfile SUBMISSION = new CompressionProfile(1500, 0.85f);

    public CompressionProfile {
        if (maxEdge <= 0) {
            throw new IllegalArgumentException("maxEdge must be positive: " + maxEdge);
        }
        if (quality <= 0f || quality > 1f) {
            throw new IllegalArgumentException("quality must be in (0, 1]: " + quality);
        }
    }
}
