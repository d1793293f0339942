package com.whereq.dispatch.trigger;

import com.whereq.dispatch.exception.MalformedTriggerException;
import com.whereq.dispatch.exception.UnknownTriggerException;
import com.whereq.dispatch.model.TriggerInfo;
import com.whereq.dispatch.realtime.RealtimeHub;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;

/**
 * Builds the runtime trigger matching the type of a persisted configuration
 */
public class TriggerFactory {

    public static final Duration DEFAULT_AT_MAX_PAST = Duration.ofHours(24);

    private final RealtimeHub hub;
    private final Clock clock;
    private final Duration atMaxPast;

    public TriggerFactory(RealtimeHub hub, Clock clock, Duration atMaxPast) {
        this.hub = hub;
        this.clock = clock;
        this.atMaxPast = atMaxPast != null ? atMaxPast : DEFAULT_AT_MAX_PAST;
    }

    /**
     * @param info persisted configuration
     * @return the runtime trigger, not scheduled yet
     * @throws UnknownTriggerException if the type is missing
     * @throws MalformedTriggerException if the arguments do not parse for the type
     */
    public Trigger create(TriggerInfo info) {
        if (info.getType() == null) {
            throw new UnknownTriggerException(null);
        }
        if (!StringUtils.hasText(info.getDomain())) {
            throw new MalformedTriggerException("Trigger without domain");
        }
        if (!StringUtils.hasText(info.getWorkerType())) {
            throw new MalformedTriggerException("Trigger without worker type");
        }
        switch (info.getType()) {
            case AT:
                return AtTrigger.at(info, atMaxPast, clock);
            case IN:
                return AtTrigger.in(info, atMaxPast, clock);
            case CRON:
                return CronTrigger.cron(info, clock);
            case EVERY:
                return CronTrigger.every(info, clock);
            case EVENT:
                return EventTrigger.of(info, hub);
            default:
                throw new UnknownTriggerException(info.getType().getTag());
        }
    }

    public Clock getClock() {
        return clock;
    }
}
