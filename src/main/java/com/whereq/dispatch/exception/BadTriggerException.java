package com.whereq.dispatch.exception;

/**
 * Thrown by a worker when the trigger that produced the job can never succeed.
 * The job is not retried and the trigger is deleted.
 */
public class BadTriggerException extends JobSystemException {
    public BadTriggerException(String message) {
        super(message);
    }

    public BadTriggerException(String message, Throwable cause) {
        super(message, cause);
    }
}
