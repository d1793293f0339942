package com.whereq.dispatch.scheduler;

import com.whereq.dispatch.broker.JobBroker;
import com.whereq.dispatch.exception.JobSystemException;
import com.whereq.dispatch.exception.MalformedTriggerException;
import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.model.JobRequest;
import com.whereq.dispatch.model.TriggerInfo;
import com.whereq.dispatch.model.TriggerType;
import com.whereq.dispatch.store.TriggerStore;
import com.whereq.dispatch.trigger.Trigger;
import com.whereq.dispatch.trigger.TriggerFactory;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.publisher.SignalType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Single process scheduler: every trigger runs as its own task, forwarding
 * what it produces to the broker
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class MemoryTriggerScheduler implements TriggerScheduler {

    private final TriggerStore triggerStore;
    private final TriggerFactory triggerFactory;

    private final Map<String, ScheduledTrigger> triggers = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile JobBroker broker;

    public MemoryTriggerScheduler(TriggerStore triggerStore, TriggerFactory triggerFactory) {
        this.triggerStore = triggerStore;
        this.triggerFactory = triggerFactory;
    }

    @Override
    public Mono<Void> start(JobBroker broker) {
        this.broker = broker;
        return triggerStore.findAll()
            .concatMap(info -> {
                try {
                    return Mono.just(triggerFactory.create(info));
                } catch (JobSystemException e) {
                    log.error("Could not start trigger with ID {}/{}: {}",
                        info.getDomain(), info.getId(), e.getMessage());
                    return Mono.empty();
                }
            })
            .doOnNext(this::register)
            .count()
            .doOnNext(count -> log.info("Memory scheduler started with {} trigger(s)", count))
            .then();
    }

    @Override
    public Mono<Void> shutdown(Duration timeout) {
        List<ScheduledTrigger> stopped;
        lock.writeLock().lock();
        try {
            stopped = new ArrayList<>(triggers.values());
            triggers.clear();
        } finally {
            lock.writeLock().unlock();
        }
        stopped.forEach(scheduled -> scheduled.trigger.unschedule());
        return Flux.fromIterable(stopped)
            .flatMap(scheduled -> scheduled.done.asMono())
            .then()
            .timeout(timeout)
            .onErrorMap(TimeoutException.class, e -> new JobSystemException(
                "Scheduler did not stop within " + timeout.toMillis() + "ms"))
            .doOnSuccess(unused -> log.info("Memory scheduler stopped"));
    }

    @Override
    public Mono<Trigger> addTrigger(TriggerInfo info) {
        return Mono.fromCallable(() -> triggerFactory.create(info))
            .flatMap(validated -> triggerStore.add(info.copy()))
            .map(triggerFactory::create)
            .doOnNext(this::register);
    }

    @Override
    public Mono<Void> deleteTrigger(String domain, String id) {
        return triggerStore.get(domain, id)
            .flatMap(triggerStore::delete)
            .then(Mono.fromRunnable(() -> {
                ScheduledTrigger removed;
                lock.writeLock().lock();
                try {
                    removed = triggers.remove(key(domain, id));
                } finally {
                    lock.writeLock().unlock();
                }
                if (removed != null) {
                    removed.trigger.unschedule();
                }
            }));
    }

    @Override
    public Mono<Trigger> getTrigger(String domain, String id) {
        return Mono.defer(() -> {
            lock.readLock().lock();
            try {
                ScheduledTrigger scheduled = triggers.get(key(domain, id));
                return scheduled != null
                    ? Mono.just(scheduled.trigger)
                    : Mono.error(NotFoundException.trigger(domain, id));
            } finally {
                lock.readLock().unlock();
            }
        });
    }

    @Override
    public Flux<Trigger> getAllTriggers(String domain) {
        return Flux.defer(() -> {
            List<Trigger> result = new ArrayList<>();
            lock.readLock().lock();
            try {
                for (ScheduledTrigger scheduled : triggers.values()) {
                    if (scheduled.trigger.getDomain().equals(domain)) {
                        result.add(scheduled.trigger);
                    }
                }
            } finally {
                lock.readLock().unlock();
            }
            result.sort(Comparator.comparing(Trigger::getId));
            return Flux.fromIterable(result);
        });
    }

    @Override
    public Mono<Trigger> updateCron(String domain, String id, String arguments) {
        return getTrigger(domain, id)
            .flatMap(current -> {
                if (current.getType() != TriggerType.CRON) {
                    return Mono.error(new MalformedTriggerException("Trigger " + id + " is not a @cron trigger"));
                }
                TriggerInfo info = current.getInfo();
                info.setArguments(arguments);
                triggerFactory.create(info);
                return triggerStore.update(info);
            })
            .map(triggerFactory::create)
            .doOnNext(this::register);
    }

    /**
     * Start the task of a trigger, replacing any trigger with the same id
     */
    private void register(Trigger trigger) {
        ScheduledTrigger scheduled = new ScheduledTrigger(trigger);
        ScheduledTrigger previous;
        lock.writeLock().lock();
        try {
            previous = triggers.put(key(trigger.getDomain(), trigger.getId()), scheduled);
        } finally {
            lock.writeLock().unlock();
        }
        if (previous != null) {
            previous.trigger.unschedule();
        }
        log.debug("Starting trigger {}", trigger);
        trigger.schedule()
            .concatMap(request -> pushJob(trigger, request))
            .doFinally(signal -> {
                if (signal == SignalType.ON_COMPLETE && trigger.isOneShot() && !trigger.isUnscheduled()) {
                    removeFinished(scheduled);
                }
                scheduled.done.tryEmitEmpty();
            })
            .subscribe(
                unused -> { },
                e -> log.error("Trigger {} stopped on error: {}", trigger, e.getMessage(), e));
    }

    private Mono<Void> pushJob(Trigger trigger, JobRequest request) {
        return broker.pushJob(request)
            .doOnNext(job -> log.info("Trigger {}: pushed new job {} to {}",
                trigger, job.getId(), job.getWorkerType()))
            .onErrorResume(e -> {
                log.error("Trigger {}: could not schedule a new job: {}", trigger, e.getMessage());
                return Mono.empty();
            })
            .then();
    }

    private void removeFinished(ScheduledTrigger scheduled) {
        Trigger trigger = scheduled.trigger;
        lock.writeLock().lock();
        try {
            triggers.remove(key(trigger.getDomain(), trigger.getId()), scheduled);
        } finally {
            lock.writeLock().unlock();
        }
        triggerStore.delete(trigger.getInfo())
            .onErrorResume(NotFoundException.class, e -> Mono.empty())
            .subscribe(
                unused -> { },
                e -> log.error("Could not delete finished trigger {}: {}", trigger, e.getMessage()),
                () -> log.debug("Trigger {} finished and removed", trigger));
    }

    private static String key(String domain, String id) {
        return domain + "/" + id;
    }

    private static final class ScheduledTrigger {
        private final Trigger trigger;
        private final Sinks.Empty<Void> done = Sinks.empty();

        private ScheduledTrigger(Trigger trigger) {
            this.trigger = trigger;
        }
    }
}
