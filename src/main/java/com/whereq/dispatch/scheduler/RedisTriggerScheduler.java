package com.whereq.dispatch.scheduler;

import com.whereq.dispatch.broker.JobBroker;
import com.whereq.dispatch.exception.JobSystemException;
import com.whereq.dispatch.exception.MalformedTriggerException;
import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.exception.UnknownTriggerException;
import com.whereq.dispatch.exception.UnknownWorkerException;
import com.whereq.dispatch.model.JobRequest;
import com.whereq.dispatch.model.Message;
import com.whereq.dispatch.model.TriggerInfo;
import com.whereq.dispatch.model.TriggerType;
import com.whereq.dispatch.realtime.RealtimeEvent;
import com.whereq.dispatch.realtime.RealtimeHub;
import com.whereq.dispatch.store.TriggerStore;
import com.whereq.dispatch.trigger.AtTrigger;
import com.whereq.dispatch.trigger.CronTrigger;
import com.whereq.dispatch.trigger.EventRule;
import com.whereq.dispatch.trigger.EventTrigger;
import com.whereq.dispatch.trigger.Trigger;
import com.whereq.dispatch.trigger.TriggerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Multi-process scheduler. Time based triggers are indexed in the
 * {@code triggers} sorted set by next fire time, and every process polls it
 * with an atomic claim that moves the due entry into {@code scheduling}, so
 * each firing is handled by one process. A claim left in {@code scheduling}
 * longer than the staleness window is taken over by the next poll. Event
 * triggers keep their rules in the {@code events-<domain>} hashes and are
 * matched against every local realtime event.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class RedisTriggerScheduler implements TriggerScheduler {

    public static final String TRIGGERS_KEY = "triggers";
    public static final String SCHEDULING_KEY = "scheduling";
    private static final String EVENTS_KEY_PREFIX = "events-";
    private static final String PAYLOAD_KEY_PREFIX = "payload-";
    private static final Duration PAYLOAD_TTL = Duration.ofDays(30);

    static final RedisScript<String> POLL_SCRIPT =
        RedisScript.of(new ClassPathResource("scripts/poll-triggers.lua"), String.class);
    static final RedisScript<Long> DEBOUNCE_SCRIPT =
        RedisScript.of(new ClassPathResource("scripts/debounce-trigger.lua"), Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final TriggerStore triggerStore;
    private final TriggerFactory triggerFactory;
    private final RealtimeHub hub;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration claimStaleness;
    private final int eventLoopSize;

    private volatile JobBroker broker;
    private volatile Sinks.Empty<Void> stopping;
    private volatile Mono<Void> stopped;

    public RedisTriggerScheduler(ReactiveRedisTemplate<String, String> redisTemplate, TriggerStore triggerStore,
                                 TriggerFactory triggerFactory, RealtimeHub hub,
                                 Duration pollInterval, Duration claimStaleness, int eventLoopSize) {
        this.redisTemplate = redisTemplate;
        this.triggerStore = triggerStore;
        this.triggerFactory = triggerFactory;
        this.hub = hub;
        this.clock = triggerFactory.getClock();
        this.pollInterval = pollInterval;
        this.claimStaleness = claimStaleness;
        this.eventLoopSize = eventLoopSize;
    }

    public static String eventsKey(String domain) {
        return EVENTS_KEY_PREFIX + domain;
    }

    public static String payloadKey(TriggerInfo info) {
        return PAYLOAD_KEY_PREFIX + info.redisKey();
    }

    @Override
    public Mono<Void> start(JobBroker broker) {
        return Mono.fromRunnable(() -> {
            this.broker = broker;
            Sinks.Empty<Void> stop = Sinks.empty();
            Sinks.Empty<Void> pollDone = Sinks.empty();
            Sinks.Empty<Void> eventsDone = Sinks.empty();
            Flux.interval(pollInterval)
                .onBackpressureDrop()
                .takeUntilOther(stop.asMono())
                .concatMap(tick -> poll(clock.instant()), 1)
                .doFinally(signal -> pollDone.tryEmitEmpty())
                .subscribe();
            hub.subscribeAll()
                .takeUntilOther(stop.asMono())
                .flatMap(this::handleEvent, eventLoopSize)
                .doFinally(signal -> eventsDone.tryEmitEmpty())
                .subscribe(
                    unused -> { },
                    e -> log.error("Event loop of the Redis scheduler stopped: {}", e.getMessage(), e));
            stopping = stop;
            stopped = Mono.when(pollDone.asMono(), eventsDone.asMono());
            log.info("Redis scheduler started, polling every {}ms", pollInterval.toMillis());
        });
    }

    /**
     * Stop polling and wait for the firings in progress, so no claim is left
     * behind in the {@code scheduling} set
     */
    @Override
    public Mono<Void> shutdown(Duration timeout) {
        return Mono.defer(() -> {
            Sinks.Empty<Void> stop = stopping;
            if (stop == null) {
                return Mono.empty();
            }
            stop.tryEmitEmpty();
            return stopped
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new JobSystemException(
                    "Scheduler did not stop within " + timeout.toMillis() + "ms"))
                .doOnSuccess(unused -> log.info("Redis scheduler stopped"));
        });
    }

    /**
     * Claim and fire every trigger due at the given time
     *
     * @param now poll time
     * @return number of claims handled
     */
    public Mono<Long> poll(Instant now) {
        return pollFrom(now, 0L)
            .onErrorResume(e -> {
                log.error("Error while polling the Redis scheduler: {}", e.getMessage(), e);
                return Mono.just(0L);
            });
    }

    private Mono<Long> pollFrom(Instant now, long handled) {
        return claim(now)
            .flatMap(claim -> fire(claim, now)
                .onErrorResume(e -> {
                    log.error("Could not fire trigger {}: {}", claim.member, e.getMessage());
                    return Mono.empty();
                })
                .then(Mono.defer(() -> pollFrom(now, handled + 1))))
            .defaultIfEmpty(handled);
    }

    private Mono<Claim> claim(Instant now) {
        return redisTemplate.execute(POLL_SCRIPT,
                List.of(TRIGGERS_KEY, SCHEDULING_KEY),
                List.of(String.valueOf(now.getEpochSecond()), String.valueOf(claimStaleness.toSeconds())))
            .next()
            .filter(result -> !result.isEmpty())
            .map(Claim::parse);
    }

    private Mono<Void> fire(Claim claim, Instant now) {
        int slash = claim.member.indexOf('/');
        if (slash <= 0 || slash == claim.member.length() - 1) {
            log.warn("Invalid scheduling entry {}", claim.member);
            return unclaim(claim.member);
        }
        String domain = claim.member.substring(0, slash);
        String id = claim.member.substring(slash + 1);
        return triggerStore.get(domain, id)
            .map(triggerFactory::create)
            .onErrorResume(e -> e instanceof NotFoundException
                    || e instanceof MalformedTriggerException
                    || e instanceof UnknownTriggerException,
                e -> {
                    log.warn("Dropping claimed trigger {}: {}", claim.member, e.getMessage());
                    return unclaim(claim.member).then(Mono.<Trigger>empty());
                })
            .flatMap(trigger -> {
                if (trigger instanceof EventTrigger) {
                    return fireDebounced((EventTrigger) trigger);
                } else if (trigger instanceof AtTrigger) {
                    return fireOnce((AtTrigger) trigger, now);
                } else {
                    return fireRecurring((CronTrigger) trigger, claim, now);
                }
            });
    }

    private Mono<Void> fireDebounced(EventTrigger trigger) {
        JobRequest request = trigger.getInfo().toJobRequest();
        request.setDebounced(true);
        String payloadKey = payloadKey(trigger.getInfo());
        return redisTemplate.opsForValue().get(payloadKey)
            .doOnNext(event -> request.setEvent(Message.fromJson(event)))
            .then(Mono.defer(() -> push(trigger, request)))
            .then(redisTemplate.delete(payloadKey))
            .then(unclaim(trigger.getInfo().redisKey()));
    }

    private Mono<Void> fireOnce(AtTrigger trigger, Instant now) {
        if (trigger.isExpired(now)) {
            log.info("Trigger {} discarded, {} is too far in the past", trigger, trigger.getAt());
            return deleteTrigger(trigger);
        }
        return push(trigger, trigger.getInfo().toJobRequest())
            .then(deleteTrigger(trigger));
    }

    private Mono<Void> fireRecurring(CronTrigger trigger, Claim claim, Instant now) {
        return push(trigger, trigger.getInfo().toJobRequest())
            .then(Mono.defer(() -> addToRedis(trigger, Instant.ofEpochSecond(claim.score), now)))
            .onErrorResume(UnknownWorkerException.class, e -> {
                log.warn("Trigger {} has no registered worker, removing it from scheduling", trigger);
                return unclaim(claim.member);
            });
    }

    private Mono<Void> push(Trigger trigger, JobRequest request) {
        return broker.pushJob(request)
            .doOnNext(job -> log.info("Trigger {}: pushed new job {} to {}",
                trigger, job.getId(), job.getWorkerType()))
            .then();
    }

    private Mono<Void> handleEvent(RealtimeEvent event) {
        if (event.getDomain() == null) {
            return Mono.empty();
        }
        return redisTemplate.<String, String>opsForHash()
            .entries(eventsKey(event.getDomain()))
            .filter(entry -> matches(entry, event))
            .concatMap(entry -> triggerStore.get(event.getDomain(), entry.getKey())
                .map(triggerFactory::create)
                .ofType(EventTrigger.class)
                .flatMap(trigger -> trigger.getDebounce() != null
                    ? openDebounceWindow(trigger, event)
                    : push(trigger, trigger.toJobRequest(event)))
                .onErrorResume(e -> {
                    log.warn("Could not fire @event trigger {}/{}: {}",
                        event.getDomain(), entry.getKey(), e.getMessage());
                    return Mono.empty();
                }))
            .onErrorResume(e -> {
                log.error("Could not fetch the event triggers of {}: {}", event.getDomain(), e.getMessage());
                return Mono.empty();
            })
            .then();
    }

    private boolean matches(Map.Entry<String, String> entry, RealtimeEvent event) {
        try {
            return EventRule.anyMatch(EventRule.parseAll(entry.getValue()), event);
        } catch (MalformedTriggerException e) {
            log.warn("Could not parse the rules of trigger {}/{}: {}",
                event.getDomain(), entry.getKey(), e.getMessage());
            return false;
        }
    }

    private Mono<Void> openDebounceWindow(EventTrigger trigger, RealtimeEvent event) {
        TriggerInfo info = trigger.getInfo();
        long fireAt = score(clock.instant().plus(trigger.getDebounce()));
        return redisTemplate.execute(DEBOUNCE_SCRIPT,
                List.of(TRIGGERS_KEY, payloadKey(info)),
                List.of(String.valueOf(fireAt), info.redisKey(), Message.of(event).toJson(),
                    String.valueOf(PAYLOAD_TTL.toSeconds())))
            .next()
            .doOnNext(added -> {
                if (added > 0) {
                    log.debug("Debounce window opened for trigger {} until {}", trigger, fireAt);
                }
            })
            .then();
    }

    @Override
    public Mono<Trigger> addTrigger(TriggerInfo info) {
        return Mono.fromCallable(() -> triggerFactory.create(info))
            .flatMap(validated -> triggerStore.add(info.copy()))
            .map(triggerFactory::create)
            .flatMap(trigger -> addToRedis(trigger, clock.instant(), clock.instant()).thenReturn(trigger));
    }

    @Override
    public Mono<Void> deleteTrigger(String domain, String id) {
        return getTrigger(domain, id).flatMap(this::deleteTrigger);
    }

    @Override
    public Mono<Trigger> getTrigger(String domain, String id) {
        return triggerStore.get(domain, id).map(triggerFactory::create);
    }

    @Override
    public Flux<Trigger> getAllTriggers(String domain) {
        return triggerStore.getAll(domain)
            .concatMap(info -> {
                try {
                    return Mono.just(triggerFactory.create(info));
                } catch (JobSystemException e) {
                    log.warn("Skipping malformed trigger {}/{}: {}", domain, info.getId(), e.getMessage());
                    return Mono.empty();
                }
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
                CronTrigger updated = (CronTrigger) triggerFactory.create(info);
                Instant next = updated.nextExecution(clock.instant());
                return triggerStore.update(info)
                    .then(removeFromSets(info.redisKey()))
                    .then(next != null
                        ? redisTemplate.opsForZSet().add(TRIGGERS_KEY, info.redisKey(), score(next)).then()
                        : Mono.empty())
                    .thenReturn((Trigger) updated);
            });
    }

    @Override
    public Mono<Void> cleanRedis() {
        return redisTemplate.delete(TRIGGERS_KEY, SCHEDULING_KEY).then();
    }

    @Override
    public Mono<Void> rebuildRedis(String domain) {
        return getAllTriggers(domain)
            .concatMap(trigger -> addToRedis(trigger, clock.instant(), clock.instant()))
            .then()
            .doOnError(e -> log.error("Error when rebuilding redis for domain {}: {}", domain, e.getMessage()));
    }

    /**
     * Index a trigger by its next fire time, or store its rules for an event
     * trigger
     *
     * @param previous fire time the next one is computed from
     */
    private Mono<Void> addToRedis(Trigger trigger, Instant previous, Instant now) {
        TriggerInfo info = trigger.getInfo();
        Instant next;
        if (trigger instanceof EventTrigger) {
            return redisTemplate.<String, String>opsForHash()
                .put(eventsKey(info.getDomain()), info.getId(), info.getArguments())
                .then();
        } else if (trigger instanceof AtTrigger) {
            next = ((AtTrigger) trigger).getAt();
        } else {
            CronTrigger cron = (CronTrigger) trigger;
            next = cron.nextExecution(previous);
            if (next != null && next.isBefore(now)) {
                next = cron.nextExecution(now);
            }
            if (next == null) {
                log.warn("Trigger {} will never fire again", trigger);
                return removeFromSets(info.redisKey());
            }
        }
        return redisTemplate.opsForZSet().add(TRIGGERS_KEY, info.redisKey(), score(next))
            .then(unclaim(info.redisKey()));
    }

    /**
     * Fire time as a score in whole seconds, rounded up so a trigger is never
     * claimed before it is due
     */
    static long score(Instant fireAt) {
        return fireAt.getEpochSecond() + (fireAt.getNano() > 0 ? 1 : 0);
    }

    private Mono<Void> deleteTrigger(Trigger trigger) {
        TriggerInfo info = trigger.getInfo();
        Mono<Void> cleanup = trigger instanceof EventTrigger
            ? redisTemplate.opsForHash().remove(eventsKey(info.getDomain()), info.getId()).then()
            : removeFromSets(info.redisKey());
        return triggerStore.delete(info)
            .onErrorResume(NotFoundException.class, e -> Mono.empty())
            .then(cleanup);
    }

    private Mono<Void> removeFromSets(String member) {
        return redisTemplate.opsForZSet().remove(TRIGGERS_KEY, member)
            .then(unclaim(member));
    }

    private Mono<Void> unclaim(String member) {
        return redisTemplate.opsForZSet().remove(SCHEDULING_KEY, member).then();
    }

    private static final class Claim {
        private final String member;
        private final long score;

        private Claim(String member, long score) {
            this.member = member;
            this.score = score;
        }

        static Claim parse(String result) {
            int space = result.lastIndexOf(' ');
            return new Claim(result.substring(0, space), (long) Double.parseDouble(result.substring(space + 1)));
        }
    }
}
