package com.whereq.dispatch.exception;

import java.time.Duration;

/**
 * Exception recorded when a job attempt exceeds its timeout
 */
public class JobTimedOutException extends JobSystemException {
    public JobTimedOutException(Duration timeout) {
        super("Job execution timed out after " + timeout.toMillis() + "ms");
    }
}
