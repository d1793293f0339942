package com.whereq.dispatch.exception;

/**
 * Exception thrown when the arguments of a trigger cannot be parsed
 */
public class MalformedTriggerException extends JobSystemException {
    public MalformedTriggerException(String message) {
        super(message);
    }

    public MalformedTriggerException(String message, Throwable cause) {
        super(message, cause);
    }
}
