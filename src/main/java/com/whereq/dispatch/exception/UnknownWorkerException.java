package com.whereq.dispatch.exception;

/**
 * Exception thrown when a job references a worker type that is not registered
 */
public class UnknownWorkerException extends JobSystemException {

    private final String workerType;

    public UnknownWorkerException(String workerType) {
        super("Unknown worker type: " + workerType);
        this.workerType = workerType;
    }

    public String getWorkerType() {
        return workerType;
    }
}
