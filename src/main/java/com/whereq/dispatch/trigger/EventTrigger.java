package com.whereq.dispatch.trigger;

import com.whereq.dispatch.exception.MalformedTriggerException;
import com.whereq.dispatch.model.JobRequest;
import com.whereq.dispatch.model.Message;
import com.whereq.dispatch.model.TriggerInfo;
import com.whereq.dispatch.realtime.RealtimeEvent;
import com.whereq.dispatch.realtime.RealtimeHub;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Trigger fired by the realtime events of its domain. With a debounce, the
 * first matching event opens a window, the events matching while it is open
 * are dropped, and one job carrying the first event is pushed when it closes.
 */
@Slf4j
public final class EventTrigger extends Trigger {

    private final List<EventRule> rules;
    private final Duration debounce;
    private final RealtimeHub hub;

    private EventTrigger(TriggerInfo info, List<EventRule> rules, Duration debounce, RealtimeHub hub) {
        super(info);
        this.rules = rules;
        this.debounce = debounce;
        this.hub = hub;
    }

    static EventTrigger of(TriggerInfo info, RealtimeHub hub) {
        return new EventTrigger(info, EventRule.parseAll(info.getArguments()), parseDebounce(info), hub);
    }

    /**
     * @return the debounce of the trigger, null when it has none
     * @throws MalformedTriggerException if the debounce does not parse
     */
    public static Duration parseDebounce(TriggerInfo info) {
        if (!StringUtils.hasText(info.getDebounce())) {
            return null;
        }
        try {
            Duration debounce = Durations.parse(info.getDebounce());
            return debounce.isZero() || debounce.isNegative() ? null : debounce;
        } catch (IllegalArgumentException e) {
            throw new MalformedTriggerException("Invalid debounce: " + info.getDebounce(), e);
        }
    }

    public List<EventRule> getRules() {
        return rules;
    }

    public Duration getDebounce() {
        return debounce;
    }

    public boolean matches(RealtimeEvent event) {
        return EventRule.anyMatch(rules, event);
    }

    /**
     * Job request embedding the trigger template and the event
     */
    public JobRequest toJobRequest(RealtimeEvent event) {
        return info.toJobRequest(Message.of(event));
    }

    @Override
    public Flux<JobRequest> schedule() {
        Set<String> doctypes = new LinkedHashSet<>();
        rules.forEach(rule -> doctypes.add(rule.getDoctype()));

        Flux<JobRequest> requests = hub.subscribe(info.getDomain(), doctypes)
            .filter(this::matches)
            .map(this::toJobRequest);

        if (debounce != null) {
            AtomicBoolean windowOpen = new AtomicBoolean();
            requests = requests
                .filter(request -> windowOpen.compareAndSet(false, true))
                .flatMap(first -> Mono.delay(debounce)
                    .map(tick -> {
                        windowOpen.set(false);
                        first.setDebounced(true);
                        return first;
                    }));
        }
        return requests.takeUntilOther(unscheduledSignal());
    }
}
