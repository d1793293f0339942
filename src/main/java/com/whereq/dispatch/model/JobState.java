package com.whereq.dispatch.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * QUEUED → RUNNING → {DONE, ERRORED}
 * ERRORED → QUEUED (while the retry budget allows)
 */
public enum JobState {
    /**
     * Waiting in the worker type queue
     */
    QUEUED,

    /**
     * Owned by one executor of the worker pool
     */
    RUNNING,

    /**
     * Completed successfully
     */
    DONE,

    /**
     * Last attempt failed or timed out
     */
    ERRORED;

    /**
     * Check if the job left the queue for good. An errored job may still be
     * re-queued by its pool, the caller decides with the retry policy.
     */
    public boolean isFinished() {
        return this == DONE || this == ERRORED;
    }
}
