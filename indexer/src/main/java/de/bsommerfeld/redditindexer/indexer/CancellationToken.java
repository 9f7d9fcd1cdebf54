package de.bsommerfeld.redditindexer.indexer;

import com.google.inject.Singleton;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide stop request. Starts out clear, is set at most once and is
 * never reset. Workers only look at it between sweeps.
 */
@Singleton
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Requests a stop.
     *
     * @return {@code true} if this call set the flag, {@code false} if it was
     *         already set
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
