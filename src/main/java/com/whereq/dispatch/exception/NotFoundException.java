package com.whereq.dispatch.exception;

/**
 * Exception thrown when a job or a trigger does not exist for the asked domain.
 * A record owned by another domain is reported the same way.
 */
public class NotFoundException extends JobSystemException {
    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException job(String domain, String id) {
        return new NotFoundException("Job " + id + " not found on domain " + domain);
    }

    public static NotFoundException trigger(String domain, String id) {
        return new NotFoundException("Trigger " + id + " not found on domain " + domain);
    }
}
