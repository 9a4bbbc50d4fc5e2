package ai.codenav.analyzer;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked by the resolvers between units of work. Thread interruption of the calling
 * thread is treated the same as an explicit {@link #cancel()}.
 */
public final class CancellationToken {
    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** A token that is only ever cancelled by interrupting the calling thread. */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    /** @throws CancellationException if cancellation has been requested */
    public void checkCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Query cancelled");
        }
    }
}
