package com.whereq.dispatch.queue;

import com.whereq.dispatch.model.Job;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * FIFO queue of jobs waiting for one worker type
 */
public interface JobQueue {

    String getWorkerType();

    /**
     * Enqueue a job. The job must already be stored.
     *
     * @param job the job to enqueue
     * @return Mono that completes when job is enqueued
     */
    Mono<Void> enqueue(Job job);

    /**
     * Consume jobs from the queue as a reactive stream. Only one consumer is
     * supported per queue instance; the stream completes once the queue is
     * closed.
     *
     * @return Flux of dequeued jobs
     */
    Flux<Job> consumeAsFlux();

    /**
     * Get current queue size
     *
     * @return Mono with queue size
     */
    Mono<Long> size();

    /**
     * Stop handing out jobs. Jobs already dequeued are not affected.
     */
    void close();
}
