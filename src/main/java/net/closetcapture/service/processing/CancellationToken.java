package net.closetcapture.service.processing;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Cooperative cancellation signal for one pipeline run.
 *
 * <p>A token may be linked to parent tokens: firing any parent fires the child, so a run can be
 * cancelled by the user or by the surrounding screen going away. Firing is one-way and idempotent.
 * A child holds a registration on each parent until it fires or {@link #detach()} is called, so a
 * long-lived parent does not accumulate listeners from finished runs.</p>
 */
public final class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Sinks.Empty<Void> cancelledSignal = Sinks.empty();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final List<Disposable> parentRegistrations = new CopyOnWriteArrayList<>();

    private CancellationToken() {
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Creates a token that fires as soon as any of {@code parents} fires. A parent that has already
     * fired makes the new token fire immediately.
     */
    public static CancellationToken linkedTo(CancellationToken... parents) {
        CancellationToken child = new CancellationToken();
        for (CancellationToken parent : parents) {
            if (parent != null) {
                child.parentRegistrations.add(parent.onCancel(child::cancel));
            }
        }
        return child;
    }

    /**
     * Fires the token.
     *
     * @return true if this call fired it, false if it had already fired
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        cancelledSignal.tryEmitEmpty();
        for (Listener listener : listeners) {
            listener.fire();
        }
        detach();
        return true;
    }

    /**
     * Drops this token's registrations on its parents. The token itself stays usable and can still
     * be fired directly.
     */
    public void detach() {
        for (Disposable registration : parentRegistrations) {
            registration.dispose();
        }
        parentRegistrations.clear();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Completes (empty) when the token fires; completes immediately for late subscribers.
     */
    public Mono<Void> whenCancelled() {
        return cancelledSignal.asMono();
    }

    /**
     * Registers a callback run exactly once when the token fires, or right away if it already has.
     *
     * @return a registration whose disposal removes the callback
     */
    public Disposable onCancel(Runnable callback) {
        Listener listener = new Listener(callback);
        listeners.add(listener);
        if (isCancelled()) {
            listener.fire();
        }
        return () -> listeners.remove(listener);
    }

    int listenerCount() {
        return listeners.size();
    }

    private static final class Listener {
        private final Runnable callback;
        private final AtomicBoolean fired = new AtomicBoolean(false);

        private Listener(Runnable callback) {
            this.callback = callback;
        }

        private void fire() {
            if (!fired.compareAndSet(false, true)) {
                return;
            }
            try {
                callback.run();
            } catch (RuntimeException e) {
                logger.error("Cancellation callback failed: {}", e.getMessage(), e);
            }
        }
    }
}
