package com.swarmgraph.core.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a run.
 * <p>
 * The scheduler checks it before every round and the retry wrapper checks it between
 * attempts. A call already in flight is allowed to finish.
 */
public class CancellationToken {

    /** Token that can never be cancelled. */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new RunCancelledException("Run was cancelled");
        }
    }
}
