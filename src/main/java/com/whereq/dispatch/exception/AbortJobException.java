package com.whereq.dispatch.exception;

/**
 * Thrown by a worker to stop processing a job without retry. The job is
 * acknowledged as done.
 */
public class AbortJobException extends JobSystemException {
    public AbortJobException(String message) {
        super(message);
    }
}
