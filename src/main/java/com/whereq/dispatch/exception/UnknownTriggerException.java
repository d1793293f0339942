package com.whereq.dispatch.exception;

/**
 * Exception thrown when a trigger type is not one of the supported kinds
 */
public class UnknownTriggerException extends JobSystemException {
    public UnknownTriggerException(String type) {
        super("Unknown trigger type: " + type);
    }
}
