package org.carball.relinfer.progress;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal, checked by the engine between candidates.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
