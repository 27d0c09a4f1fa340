package no.cantara.kcr.concurrent;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a caller and a running operation.
 * Operations poll it between traversal levels and between supersession lookups.
 */
public final class CancellationSignal {

    /** A signal that is never cancelled. */
    public static final CancellationSignal NONE = new CancellationSignal();

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("NONE cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Operation cancelled");
        }
    }
}
