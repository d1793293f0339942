package com.whereq.dispatch.trigger;

import com.whereq.dispatch.exception.MalformedTriggerException;
import com.whereq.dispatch.model.JobRequest;
import com.whereq.dispatch.model.TriggerInfo;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * One-shot trigger for {@code @at} (absolute RFC 3339 time) and {@code @in}
 * (delay from creation)
 */
@Slf4j
public final class AtTrigger extends Trigger {

    private final Instant at;
    private final Duration maxPast;
    private final Clock clock;

    private AtTrigger(TriggerInfo info, Instant at, Duration maxPast, Clock clock) {
        super(info);
        this.at = at;
        this.maxPast = maxPast;
        this.clock = clock;
    }

    static AtTrigger at(TriggerInfo info, Duration maxPast, Clock clock) {
        try {
            Instant at = OffsetDateTime.parse(info.getArguments().trim()).toInstant();
            return new AtTrigger(info, at, maxPast, clock);
        } catch (DateTimeParseException | NullPointerException e) {
            throw new MalformedTriggerException("Invalid @at time: " + info.getArguments(), e);
        }
    }

    static AtTrigger in(TriggerInfo info, Duration maxPast, Clock clock) {
        try {
            Duration delay = Durations.parse(info.getArguments());
            return new AtTrigger(info, clock.instant().plus(delay), maxPast, clock);
        } catch (IllegalArgumentException e) {
            throw new MalformedTriggerException("Invalid @in duration: " + info.getArguments(), e);
        }
    }

    /**
     * Time at which the trigger fires
     */
    public Instant getAt() {
        return at;
    }

    /**
     * True when the fire time is older than the max-past window, in which
     * case the trigger never fires
     */
    public boolean isExpired(Instant now) {
        return at.isBefore(now.minus(maxPast));
    }

    @Override
    public boolean isOneShot() {
        return true;
    }

    @Override
    public Flux<JobRequest> schedule() {
        return Mono.defer(() -> {
                Instant now = clock.instant();
                if (isExpired(now)) {
                    log.info("Trigger {} discarded, {} is too far in the past", this, at);
                    return Mono.<JobRequest>empty();
                }
                Duration delay = Duration.between(now, at);
                return Mono.delay(delay.isNegative() ? Duration.ZERO : delay)
                    .map(tick -> info.toJobRequest());
            })
            .flux()
            .takeUntilOther(unscheduledSignal());
    }
}
