package com.whereq.indexnode.model;

import java.util.concurrent.Future;

/**
 * Cancels the work behind a registered task.
 * Supplied by whoever starts the task; invoked by whoever removes it from the registry.
 */
@FunctionalInterface
public interface CancelHandle {

    CancelHandle NOOP = () -> { };

    void cancel();

    /**
     * Handle that interrupts the thread running the given future.
     */
    static CancelHandle of(Future<?> future) {
        return () -> future.cancel(true);
    }
}
