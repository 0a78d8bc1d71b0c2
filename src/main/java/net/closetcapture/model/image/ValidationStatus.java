package net.closetcapture.model.image;

/** Result categories of acquisition validation. */
public enum ValidationStatus {
    ACCEPTED,
    /** User dismissed the picker; never shown as an error. */
    CANCELLED,
    /** Recoverable: acquisition should be re-prompted. */
    FILE_TOO_LARGE,
    /** Recoverable: acquisition should be re-prompted. */
    INVALID_FORMAT,
    /** Terminal for the current attempt. */
    PICKER_ERROR;

    /** Whether the caller should re-invoke acquisition automatically after showing feedback. */
    public boolean isRecoverable() {
        return this == FILE_TOO_LARGE || this == INVALID_FORMAT;
    }
}
