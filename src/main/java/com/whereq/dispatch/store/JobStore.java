package com.whereq.dispatch.store;

import com.whereq.dispatch.model.Job;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable storage of job records
 */
public interface JobStore {

    /**
     * Fetch a job of a domain
     *
     * @param domain owning domain
     * @param id job identifier
     * @return the job, or a {@link com.whereq.dispatch.exception.NotFoundException}
     *         error when it does not exist on this domain
     */
    Mono<Job> get(String domain, String id);

    /**
     * Persist a new job, assigning its identifier and revision
     *
     * @param job the job to create
     * @return the created job
     */
    Mono<Job> create(Job job);

    /**
     * Persist the new state of an existing job
     *
     * @param job the job to update
     * @return the updated job with its new revision
     */
    Mono<Job> update(Job job);

    /**
     * Most recent jobs launched by a trigger, newest first
     *
     * @param domain owning domain
     * @param triggerId trigger identifier
     * @param limit maximum number of jobs
     * @return the jobs
     */
    Flux<Job> findByTrigger(String domain, String triggerId, int limit);
}
