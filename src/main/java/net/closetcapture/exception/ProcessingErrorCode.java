package net.closetcapture.exception;

/**
 * Structured failure codes for the remote processing call.
 *
 * <p>Collaborators report one of these codes; control flow branches on the code, never on
 * exception message text.</p>
 */
public enum ProcessingErrorCode {
    AUTH_EXPIRED("PROCESSING_AUTH_EXPIRED", false, "Session expired, please sign in again"),
    SERVER_ERROR("PROCESSING_SERVER_ERROR", true, "The processing service failed, please try again"),
    NETWORK_UNAVAILABLE("PROCESSING_NETWORK_UNAVAILABLE", true, "Connection error, check your network"),
    TIMEOUT("PROCESSING_TIMEOUT", true, "Processing took too long, please try again"),
    CANCELLED("PROCESSING_CANCELLED", false, "Processing cancelled");

    private final String code;
    private final boolean transientFailure;
    private final String userMessage;

    ProcessingErrorCode(String code, boolean transientFailure, String userMessage) {
        this.code = code;
        this.transientFailure = transientFailure;
        this.userMessage = userMessage;
    }

    /** Log-friendly code. */
    public String code() {
        return code;
    }

    /** Whether a failure with this code may succeed when the identical request is re-issued. */
    public boolean isTransient() {
        return transientFailure;
    }

    public String userMessage() {
        return userMessage;
    }
}
