package com.whereq.dispatch.trigger;

import com.whereq.dispatch.model.JobRequest;
import com.whereq.dispatch.model.TriggerInfo;
import com.whereq.dispatch.model.TriggerType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runtime object of a trigger: its persisted configuration plus the parsed,
 * type specific state, and an unschedule signal
 */
public abstract sealed class Trigger permits AtTrigger, CronTrigger, EventTrigger {

    protected final TriggerInfo info;
    private final Sinks.Empty<Void> unscheduled = Sinks.empty();
    private final AtomicBoolean stopped = new AtomicBoolean();

    protected Trigger(TriggerInfo info) {
        this.info = info.copy();
    }

    /**
     * Live stream of the job requests produced by this trigger. It completes
     * when a one-shot trigger has fired or when the trigger is unscheduled.
     */
    public abstract Flux<JobRequest> schedule();

    /**
     * Stop the stream returned by {@link #schedule()}. Can be called any
     * number of times.
     */
    public void unschedule() {
        if (stopped.compareAndSet(false, true)) {
            unscheduled.tryEmitEmpty();
        }
    }

    public boolean isUnscheduled() {
        return stopped.get();
    }

    /**
     * True for the triggers that fire once and are then removed
     */
    public boolean isOneShot() {
        return false;
    }

    public TriggerInfo getInfo() {
        return info.copy();
    }

    public String getId() {
        return info.getId();
    }

    public String getDomain() {
        return info.getDomain();
    }

    public TriggerType getType() {
        return info.getType();
    }

    protected Mono<Void> unscheduledSignal() {
        return unscheduled.asMono();
    }

    @Override
    public String toString() {
        return info.getType() + "(" + info.getDomain() + "/" + info.getId() + ")";
    }
}
