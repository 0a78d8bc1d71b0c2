package net.closetcapture.model.image;

import jakarta.annotation.Nullable;

/**
 * Outcome of validating an acquired image.
 *
 * @param status     validation category
 * @param message    user-facing message for failure variants, null otherwise
 * @param descriptor the accepted descriptor, null for every other status
 * @param byteSize   effective size that was checked, 0 when the check did not run
 */
public record ValidationOutcome(
    ValidationStatus status,
    @Nullable String message,
    @Nullable ImageDescriptor descriptor,
    long byteSize
) {

    public static ValidationOutcome accepted(ImageDescriptor descriptor, long byteSize) {
        return new ValidationOutcome(ValidationStatus.ACCEPTED, null, descriptor, byteSize);
    }

    public static ValidationOutcome cancelled() {
        return new ValidationOutcome(ValidationStatus.CANCELLED, null, null, 0L);
    }

    public static ValidationOutcome fileTooLarge(String message, long byteSize) {
        return new ValidationOutcome(ValidationStatus.FILE_TOO_LARGE, message, null, byteSize);
    }

    public static ValidationOutcome invalidFormat(String message) {
        return new ValidationOutcome(ValidationStatus.INVALID_FORMAT, message, null, 0L);
    }

    public static ValidationOutcome pickerError(String message) {
        return new ValidationOutcome(ValidationStatus.PICKER_ERROR, message, null, 0L);
    }

    public boolean isAccepted() {
        return status == ValidationStatus.ACCEPTED;
    }
}
