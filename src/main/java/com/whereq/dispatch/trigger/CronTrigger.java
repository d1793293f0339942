package com.whereq.dispatch.trigger;

import com.whereq.dispatch.exception.MalformedTriggerException;
import com.whereq.dispatch.model.JobRequest;
import com.whereq.dispatch.model.TriggerInfo;
import org.springframework.scheduling.support.CronExpression;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Recurring trigger for {@code @cron} (cron expression, with or without the
 * seconds field) and {@code @every} (fixed interval)
 */
public final class CronTrigger extends Trigger {

    private final CronExpression expression;
    private final Duration interval;
    private final Clock clock;

    private CronTrigger(TriggerInfo info, CronExpression expression, Duration interval, Clock clock) {
        super(info);
        this.expression = expression;
        this.interval = interval;
        this.clock = clock;
    }

    static CronTrigger cron(TriggerInfo info, Clock clock) {
        return new CronTrigger(info, parseCron(info.getArguments()), null, clock);
    }

    static CronTrigger every(TriggerInfo info, Clock clock) {
        Duration interval;
        try {
            interval = Durations.parse(info.getArguments());
        } catch (IllegalArgumentException e) {
            throw new MalformedTriggerException("Invalid @every interval: " + info.getArguments(), e);
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new MalformedTriggerException("Invalid @every interval: " + info.getArguments());
        }
        return new CronTrigger(info, null, interval, clock);
    }

    /**
     * Parse a cron expression. Five field expressions get a leading seconds
     * field set to 0.
     *
     * @throws MalformedTriggerException if the expression does not parse
     */
    public static CronExpression parseCron(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            throw new MalformedTriggerException("Empty cron expression");
        }
        String expression = arguments.trim();
        if (!expression.startsWith("@") && expression.split("\\s+").length == 5) {
            expression = "0 " + expression;
        }
        try {
            return CronExpression.parse(expression);
        } catch (IllegalArgumentException e) {
            throw new MalformedTriggerException("Invalid cron expression: " + arguments, e);
        }
    }

    /**
     * Next fire time strictly after the given one
     *
     * @return the next time, or null if the expression never matches again
     */
    public Instant nextExecution(Instant after) {
        if (interval != null) {
            return after.plus(interval);
        }
        ZonedDateTime next = expression.next(after.atZone(clock.getZone()));
        return next != null ? next.toInstant() : null;
    }

    @Override
    public Flux<JobRequest> schedule() {
        AtomicReference<Instant> last = new AtomicReference<>(clock.instant());
        AtomicBoolean exhausted = new AtomicBoolean();
        return Mono.defer(() -> {
                Instant next = nextExecution(last.get());
                if (next == null) {
                    exhausted.set(true);
                    return Mono.<JobRequest>empty();
                }
                Duration delay = Duration.between(clock.instant(), next);
                return Mono.delay(delay.isNegative() ? Duration.ZERO : delay)
                    .map(tick -> {
                        last.set(next);
                        return info.toJobRequest();
                    });
            })
            .repeat(() -> !exhausted.get())
            .takeUntilOther(unscheduledSignal());
    }
}
