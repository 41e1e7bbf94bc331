package io.cronjob4j;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal handed to a running task.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile String reason;

    /**
     * @return true if this call cancelled the token
     */
    public boolean cancel(String reason) {
        if (cancelled.compareAndSet(false, true)) {
            this.reason = reason;
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String reason() {
        return reason;
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException(reason == null ? "cancelled" : reason);
        }
    }
}
