package com.whereq.dispatch.exception;

/**
 * Exception thrown when a job message or event cannot be decoded
 */
public class MessageUnmarshalException extends JobSystemException {
    public MessageUnmarshalException(String message) {
        super(message);
    }

    public MessageUnmarshalException(String message, Throwable cause) {
        super(message, cause);
    }
}
