package net.closetcapture.service.processing;

import java.util.EnumSet;
import java.util.Set;
import net.closetcapture.exception.ProcessingErrorCode;
import net.closetcapture.exception.ProcessingException;

/**
 * Bounded automatic retry for one logical processing action.
 *
 * @param maxRetries     re-issues allowed after the first attempt
 * @param retryableCodes codes eligible for an automatic re-issue
 */
public record RetryPolicy(int maxRetries, Set<ProcessingErrorCode> retryableCodes) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative: " + maxRetries);
        }
        retryableCodes = retryableCodes.isEmpty()
            ? EnumSet.noneOf(ProcessingErrorCode.class)
            : EnumSet.copyOf(retryableCodes);
    }

    /** Retries network, timeout and server failures {@code maxRetries} times. */
    public static RetryPolicy transientFailures(int maxRetries) {
        return new RetryPolicy(maxRetries, EnumSet.of(
            ProcessingErrorCode.NETWORK_UNAVAILABLE,
            ProcessingErrorCode.TIMEOUT,
            ProcessingErrorCode.SERVER_ERROR
        ));
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, EnumSet.noneOf(ProcessingErrorCode.class));
    }

    /** Whether {@code failure} may be re-issued, budget permitting. */
    public boolean isRetryable(Throwable failure) {
        return failure instanceof ProcessingException processingException
            && processingException.isRetryable()
            && retryableCodes.contains(processingException.getErrorCode());
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
