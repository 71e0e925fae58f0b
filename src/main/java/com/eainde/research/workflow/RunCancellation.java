package com.eainde.research.workflow;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token, checked by the engine before each step.
 */
public final class RunCancellation {

    private static final RunCancellation NONE = new RunCancellation();

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static RunCancellation none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
