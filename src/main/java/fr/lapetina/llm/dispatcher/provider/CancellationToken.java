package fr.lapetina.llm.dispatcher.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal threaded through one provider attempt.
 *
 * Cancellation is advisory: a provider variant registers callbacks (abort the HTTP exchange,
 * cancel its future) but the attempt may still finish. Callbacks run at most once.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Marks the token cancelled and runs registered callbacks.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable callback : callbacks) {
            runSafely(callback);
        }
        callbacks.clear();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a callback. Runs it at once if the token is already cancelled.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        // cancel() may have raced with add(): make sure the callback still fires
        if (cancelled.get() && callbacks.remove(callback)) {
            runSafely(callback);
        }
    }

    private static void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: error={}", e.getMessage(), e);
        }
    }
}
