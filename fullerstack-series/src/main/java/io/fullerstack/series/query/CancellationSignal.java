package io.fullerstack.series.query;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for long-running queries. A query checks the signal
 * between samples and stops with {@link CancellationException} once it is set.
 */
public final class CancellationSignal {

    /** A signal that is never cancelled. */
    public static final CancellationSignal NONE = new CancellationSignal(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private CancellationSignal(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationSignal create() {
        return new CancellationSignal(true);
    }

    /**
     * Requests cancellation. Idempotent.
     *
     * @throws UnsupportedOperationException on {@link #NONE}
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationSignal.NONE cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Query was cancelled");
        }
    }
}
