package com.z254.loom.graph;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared between a caller, the engine and node handlers.
 * <p>
 * The engine checks the token between node executions; handlers may check it themselves to stop
 * long-running work early.
 */
public class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * A token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
