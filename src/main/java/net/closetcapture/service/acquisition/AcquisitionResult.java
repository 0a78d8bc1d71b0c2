package net.closetcapture.service.acquisition;

import jakarta.annotation.Nullable;
import net.closetcapture.model.image.ImageDescriptor;

/**
 * What an acquisition source handed back: an image, a user cancellation, or a picker failure.
 * User cancellation is a normal outcome, never an exception.
 *
 * @param status     outcome kind
 * @param descriptor the picked image, only for {@link Status#PICKED}
 * @param message    failure detail, only for {@link Status#ERROR}
 */
public record AcquisitionResult(Status status, @Nullable ImageDescriptor descriptor, @Nullable String message) {

    public enum Status {
        PICKED,
        CANCELLED,
        ERROR
    }

    public AcquisitionResult {
        if (status == Status.PICKED && descriptor == null) {
            throw new IllegalArgumentException("A picked result requires a descriptor");
        }
    }

    public static AcquisitionResult picked(ImageDescriptor descriptor) {
        return new AcquisitionResult(Status.PICKED, descriptor, null);
    }

    public static AcquisitionResult cancelled() {
        return new AcquisitionResult(Status.CANCELLED, null, null);
    }

    public static AcquisitionResult error(String message) {
        return new AcquisitionResult(Status.ERROR, null, message);
    }
}
