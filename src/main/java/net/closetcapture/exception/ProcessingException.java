package net.closetcapture.exception;

/**
 * Remote processing failed or was cancelled.
 * RETRYABLE: only while the local retry budget of the current action is not spent. Terminal
 * exceptions handed back to callers always report {@code retryable == false}.
 */
public class ProcessingException extends RuntimeException {

    private final ProcessingErrorCode errorCode;
    private final boolean retryable;

    public ProcessingException(ProcessingErrorCode errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    /** Creates an exception whose retryable flag follows the code's transience. */
    public static ProcessingException of(ProcessingErrorCode errorCode, String message, Throwable cause) {
        return new ProcessingException(errorCode, message, errorCode.isTransient(), cause);
    }

    public static ProcessingException of(ProcessingErrorCode errorCode, String message) {
        return of(errorCode, message, null);
    }

    public static ProcessingException cancelled() {
        return new ProcessingException(ProcessingErrorCode.CANCELLED, "Processing cancelled", false, null);
    }

    public ProcessingErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Returns a copy with {@code retryable} forced to false, keeping code, message and cause.
     */
    public ProcessingException asTerminal() {
        if (!retryable) {
            return this;
        }
        ProcessingException terminal = new ProcessingException(errorCode, getMessage(), false, getCause());
        terminal.setStackTrace(getStackTrace());
        return terminal;
    }

    public String getUserMessage() {
        return errorCode.userMessage();
    }
}
