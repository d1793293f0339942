package com.whereq.dispatch.service;

import com.whereq.dispatch.broker.JobBroker;
import com.whereq.dispatch.exception.BadTriggerException;
import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.executor.JobOutcome;
import com.whereq.dispatch.executor.WorkerRegistry;
import com.whereq.dispatch.model.Job;
import com.whereq.dispatch.scheduler.TriggerScheduler;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * One broker and one scheduler started and stopped together. Several
 * independent systems can live in the same process.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class JobSystem {

    private final JobBroker broker;
    private final TriggerScheduler scheduler;
    private final WorkerRegistry registry;
    private final Duration shutdownTimeout;
    private volatile Disposable badTriggerCleanup;

    public JobSystem(JobBroker broker, TriggerScheduler scheduler, WorkerRegistry registry, Duration shutdownTimeout) {
        this.broker = broker;
        this.scheduler = scheduler;
        this.registry = registry;
        this.shutdownTimeout = shutdownTimeout;
    }

    public JobBroker getBroker() {
        return broker;
    }

    public TriggerScheduler getScheduler() {
        return scheduler;
    }

    @PostConstruct
    public void initialize() {
        start().block();
    }

    @PreDestroy
    public void destroy() {
        shutdown(shutdownTimeout)
            .doOnError(e -> log.error("Job system shutdown failed: {}", e.getMessage()))
            .onErrorResume(e -> Mono.empty())
            .block();
    }

    /**
     * Start the worker pools, then the scheduler
     */
    public Mono<Void> start() {
        return broker.startWorkers(registry)
            .then(scheduler.start(broker))
            .doOnSuccess(unused -> {
                badTriggerCleanup = broker.outcomes()
                    .filter(outcome -> outcome.getError() instanceof BadTriggerException)
                    .concatMap(this::deleteBadTrigger)
                    .subscribe();
                log.info("Job system started");
            });
    }

    /**
     * Stop the scheduler, then the worker pools, both within the timeout
     */
    public Mono<Void> shutdown(Duration timeout) {
        return scheduler.shutdown(timeout)
            .then(broker.shutdownWorkers(timeout))
            .doFinally(signal -> {
                if (badTriggerCleanup != null) {
                    badTriggerCleanup.dispose();
                }
            });
    }

    private Mono<Void> deleteBadTrigger(JobOutcome outcome) {
        Job job = outcome.getJob();
        if (job.getTriggerId() == null) {
            return Mono.empty();
        }
        log.warn("Deleting trigger {}/{} after a bad trigger error: {}",
            job.getDomain(), job.getTriggerId(), outcome.getError().getMessage());
        return scheduler.deleteTrigger(job.getDomain(), job.getTriggerId())
            .onErrorResume(NotFoundException.class, e -> Mono.empty())
            .onErrorResume(e -> {
                log.error("Could not delete trigger {}/{}: {}", job.getDomain(), job.getTriggerId(), e.getMessage());
                return Mono.empty();
            });
    }
}
