package net.closetcapture.exception;

import jakarta.annotation.Nullable;

/**
 * Moving a processed asset into durable storage failed (unsafe source, download, content type,
 * upload, signing or record persistence).
 * RETRYABLE: depends on {@link RelayFailureReason#isRetryable()}; the relay itself never retries.
 */
public class RelayException extends RuntimeException {

    private final RelayFailureReason reason;
    @Nullable
    private final String target;

    public RelayException(RelayFailureReason reason, String message, @Nullable String target, @Nullable Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.target = target;
    }

    public RelayException(RelayFailureReason reason, String message, @Nullable String target) {
        this(reason, message, target, null);
    }

    public RelayFailureReason getReason() {
        return reason;
    }

    /** Source URL or storage path the failure concerns, when known. */
    @Nullable
    public String getTarget() {
        return target;
    }

    public boolean isRetryable() {
        return reason.isRetryable();
    }
}
