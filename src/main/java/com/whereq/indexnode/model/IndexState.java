package com.whereq.indexnode.model;

/**
 * Lifecycle states of index-build and analysis tasks, as reported to the coordinator.
 *
 * State transitions:
 * UNISSUED → IN_PROGRESS → {FINISHED, FAILED}
 * FAILED → RETRY (decided by the coordinator, never by the node)
 */
public enum IndexState {
    /**
     * No task is known under the requested key
     */
    NONE,

    /**
     * Accepted but not yet started
     */
    UNISSUED,

    /**
     * Task actively executing
     */
    IN_PROGRESS,

    /**
     * Completed successfully, results attached
     */
    FINISHED,

    /**
     * Terminated with error, see the fail reason
     */
    FAILED,

    /**
     * Failed in a way the coordinator may reschedule
     */
    RETRY;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == FINISHED || this == FAILED;
    }
}
