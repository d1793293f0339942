package com.whereq.dispatch.executor;

/**
 * Business logic of a worker type, run once per job attempt
 */
@FunctionalInterface
public interface JobWorker {
    /**
     * Execute one attempt of a job synchronously (blocking)
     *
     * @param context the job and its attempt metadata
     * @throws Exception if the attempt fails; the pool decides on a retry
     */
    void execute(WorkerContext context) throws Exception;
}
