package com.whereq.dispatch.scheduler;

import com.whereq.dispatch.broker.JobBroker;
import com.whereq.dispatch.model.TriggerInfo;
import com.whereq.dispatch.trigger.Trigger;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Owns the triggers of every domain and forwards the job requests they
 * produce to the broker
 *
 * @author WhereQ Inc.
 */
public interface TriggerScheduler {

    /**
     * Start scheduling the persisted triggers
     *
     * @param broker broker receiving the produced job requests
     * @return Mono that completes once the scheduler runs
     */
    Mono<Void> start(JobBroker broker);

    /**
     * Unschedule every trigger
     *
     * @param timeout how long to wait for the trigger tasks to stop
     * @return Mono that fails if the timeout expires first
     */
    Mono<Void> shutdown(Duration timeout);

    /**
     * Validate, persist and schedule a new trigger
     *
     * @param info trigger configuration, without id
     * @return the scheduled trigger, or a
     *         {@link com.whereq.dispatch.exception.MalformedTriggerException} error
     *         when its arguments do not parse
     */
    Mono<Trigger> addTrigger(TriggerInfo info);

    /**
     * Unschedule and remove a trigger
     */
    Mono<Void> deleteTrigger(String domain, String id);

    Mono<Trigger> getTrigger(String domain, String id);

    Flux<Trigger> getAllTriggers(String domain);

    /**
     * Reschedule a {@code @cron} trigger with a new expression
     *
     * @return the updated trigger
     */
    Mono<Trigger> updateCron(String domain, String id, String arguments);

    /**
     * Drop the shared scheduling state. Nothing to do for a single process
     * scheduler.
     */
    default Mono<Void> cleanRedis() {
        return Mono.empty();
    }

    /**
     * Re-index every persisted trigger of a domain into the shared
     * scheduling state. Nothing to do for a single process scheduler.
     */
    default Mono<Void> rebuildRedis(String domain) {
        return Mono.empty();
    }
}
