package com.whereq.dispatch.exception;

/**
 * Exception thrown when a broker or a worker pool is used outside of its
 * running state
 */
public class BrokerClosedException extends JobSystemException {
    public BrokerClosedException(String message) {
        super(message);
    }
}
