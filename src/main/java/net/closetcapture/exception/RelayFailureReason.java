package net.closetcapture.exception;

/** Typed reasons a storage relay step can fail. */
public enum RelayFailureReason {
    UNSAFE_URL("RELAY_UNSAFE_URL", false),
    DOWNLOAD_FAILED("RELAY_DOWNLOAD_FAILED", true),
    INVALID_CONTENT_TYPE("RELAY_INVALID_CONTENT_TYPE", false),
    UPLOAD_FAILED("RELAY_UPLOAD_FAILED", true),
    SIGNING_FAILED("RELAY_SIGNING_FAILED", true),
    STORAGE_UNAVAILABLE("RELAY_STORAGE_UNAVAILABLE", false),
    RECORD_PERSIST_FAILED("RELAY_RECORD_PERSIST_FAILED", true);

    private final String code;
    private final boolean retryable;

    RelayFailureReason(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    public String code() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
