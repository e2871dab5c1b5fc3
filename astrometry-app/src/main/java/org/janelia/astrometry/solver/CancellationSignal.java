package org.janelia.astrometry.solver;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag polled by the solver between iterations.
 */
public class CancellationSignal {

    /** Signal that is never cancelled. */
    public static final CancellationSignal NONE = new CancellationSignal() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("the shared NONE signal cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
