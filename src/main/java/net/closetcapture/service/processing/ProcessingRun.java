package net.closetcapture.service.processing;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one logical processing action: the idempotency key minted for it, its cancellation
 * token, the current phase and the number of remote attempts made.
 *
 * <p>The key is fixed at construction and shared by every retry of this action. Restarting the
 * action after a terminal failure means creating a new run, and therefore a new key.</p>
 */
public final class ProcessingRun {

    private static final Logger logger = LoggerFactory.getLogger(ProcessingRun.class);

    private final String ownerId;
    private final String idempotencyKey;
    private final CancellationToken cancellationToken;
    private final AtomicInteger attempts = new AtomicInteger(0);
    private final List<ProcessingPhase> phaseHistory = new CopyOnWriteArrayList<>();
    private volatile ProcessingPhase phase = ProcessingPhase.IDLE;
    private volatile boolean compressionFallback;

    ProcessingRun(String ownerId, String idempotencyKey, CancellationToken cancellationToken) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId cannot be null or blank");
        }
        this.ownerId = ownerId;
        this.idempotencyKey = idempotencyKey;
        this.cancellationToken = cancellationToken;
        this.phaseHistory.add(ProcessingPhase.IDLE);
    }

    public String ownerId() {
        return ownerId;
    }

    public String idempotencyKey() {
        return idempotencyKey;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public ProcessingPhase phase() {
        return phase;
    }

    /** Phases entered so far, in order, starting with IDLE. */
    public List<ProcessingPhase> phaseHistory() {
        return List.copyOf(phaseHistory);
    }

    /** Remote attempts started for this action. */
    public int attempts() {
        return attempts.get();
    }

    /** True when the submission pass could not compress and the original bytes were sent. */
    public boolean compressionFallback() {
        return compressionFallback;
    }

    void markCompressionFallback() {
        this.compressionFallback = true;
    }

    int beginAttempt() {
        transitionTo(ProcessingPhase.REQUESTING);
        return attempts.incrementAndGet();
    }

    void transitionTo(ProcessingPhase next) {
        ProcessingPhase current = phase;
        if (current.isTerminal()) {
            logger.debug("Run {} already terminal in {}; ignoring transition to {}.", idempotencyKey, current, next);
            return;
        }
        phase = next;
        phaseHistory.add(next);
    }
}
