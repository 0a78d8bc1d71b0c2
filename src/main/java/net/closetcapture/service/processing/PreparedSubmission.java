package net.closetcapture.service.processing;

import net.closetcapture.model.image.CompressedImage;
import net.closetcapture.model.processing.ProcessingRequest;

/**
 * Output of the compress and encode steps, ready to be sent and re-sent unchanged.
 *
 * @param request    request body shared by every attempt
 * @param compressed bytes that were encoded into {@code request}
 */
public record PreparedSubmission(ProcessingRequest request, CompressedImage compressed) {

    public boolean compressionFallback() {
        return compressed.fallbackToOriginal();
    }

    /** Size in bytes of the image actually submitted. */
    public long submittedBytes() {
        return compressed.size();
    }
}
