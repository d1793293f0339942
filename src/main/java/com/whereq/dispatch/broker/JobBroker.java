package com.whereq.dispatch.broker;

import com.whereq.dispatch.executor.JobOutcome;
import com.whereq.dispatch.executor.WorkerRegistry;
import com.whereq.dispatch.model.Job;
import com.whereq.dispatch.model.JobRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Accepts job requests and dispatches them to the worker pool of their type
 *
 * @author WhereQ Inc.
 */
public interface JobBroker {

    /**
     * Start one worker pool per registered worker type
     *
     * @param registry the worker types run by this process
     * @return Mono that completes once the pools consume their queues
     */
    Mono<Void> startWorkers(WorkerRegistry registry);

    /**
     * Stop every worker pool, waiting for the running jobs
     *
     * @param timeout deadline for the running jobs to finish
     * @return Mono that fails if the deadline expires first
     */
    Mono<Void> shutdownWorkers(Duration timeout);

    /**
     * Create a job in state QUEUED and enqueue it
     *
     * @param request the job request
     * @return the created job, or an
     *         {@link com.whereq.dispatch.exception.UnknownWorkerException} error
     *         without any job record when the worker type is not registered
     */
    Mono<Job> pushJob(JobRequest request);

    /**
     * Push a job and wait for its final outcome
     *
     * @param request the job request
     * @return the outcome once the job is done or errored with no retry left
     */
    Mono<JobOutcome> pushJobAndAwait(JobRequest request);

    /**
     * Number of jobs waiting for a worker type
     */
    Mono<Long> queueLength(String workerType);

    /**
     * Registered worker types
     */
    List<String> workerTypes();

    /**
     * Final outcomes of the jobs run by this process
     */
    Flux<JobOutcome> outcomes();
}
