package io.concforge.internal;

import io.concforge.CancellationToken;
import io.concforge.CancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

public final class DefaultCancellationToken implements CancellationToken {

    private final AtomicBoolean cancelled;
    private final Runnable onCancel;

    public DefaultCancellationToken(Runnable onCancel) {
        this.cancelled = new AtomicBoolean(false);
        this.onCancel = onCancel;
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancelledException("Cancellation requested");
        }
    }

    /**
     * Flips the token and runs the callback; only the first call has any effect.
     *
     * @return true if this call performed the cancellation.
     */
    public boolean cancel() {
        if (cancelled.compareAndSet(false, true)) {
            onCancel.run();
            return true;
        }
        return false;
    }

    public boolean markCancelledWithoutCallback() {
        return cancelled.compareAndSet(false, true);
    }
}
