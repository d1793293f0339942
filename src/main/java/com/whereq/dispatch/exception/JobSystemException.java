package com.whereq.dispatch.exception;

/**
 * Base class of the errors raised by the job system
 */
public class JobSystemException extends RuntimeException {
    public JobSystemException(String message) {
        super(message);
    }

    public JobSystemException(String message, Throwable cause) {
        super(message, cause);
    }
}
