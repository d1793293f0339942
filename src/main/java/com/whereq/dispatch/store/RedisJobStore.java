package com.whereq.dispatch.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.model.Job;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;

/**
 * Job records stored in Redis as JSON strings, shared by every process of a
 * Redis deployment
 */
@Slf4j
public class RedisJobStore implements JobStore {

    private static final String JOB_KEY_PREFIX = "jobs/";
    private static final String TRIGGER_JOBS_KEY_PREFIX = "trigger-jobs/";
    private static final Duration TTL = Duration.ofDays(7); // Keep jobs for 7 days

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisJobStore(ReactiveRedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = StoredMessageMixin.storageMapper(objectMapper);
    }

    @Override
    public Mono<Job> get(String domain, String id) {
        return redisTemplate.opsForValue()
            .get(jobKey(domain, id))
            .map(this::read)
            .filter(job -> domain.equals(job.getDomain()))
            .switchIfEmpty(Mono.error(NotFoundException.job(domain, id)));
    }

    @Override
    public Mono<Job> create(Job job) {
        return Mono.fromCallable(() -> {
                Job created = job.copy();
                created.setId(Identifiers.newId());
                created.setRevision(Identifiers.nextRevision(null));
                return created;
            })
            .flatMap(created -> save(created)
                .then(indexByTrigger(created))
                .thenReturn(created));
    }

    @Override
    public Mono<Job> update(Job job) {
        String key = jobKey(job.getDomain(), job.getId());
        return redisTemplate.hasKey(key)
            .flatMap(exists -> {
                if (!exists) {
                    return Mono.error(NotFoundException.job(job.getDomain(), job.getId()));
                }
                Job updated = job.copy();
                updated.setRevision(Identifiers.nextRevision(job.getRevision()));
                return save(updated)
                    .doOnSuccess(v -> job.setRevision(updated.getRevision()))
                    .thenReturn(updated);
            });
    }

    @Override
    public Flux<Job> findByTrigger(String domain, String triggerId, int limit) {
        String indexKey = TRIGGER_JOBS_KEY_PREFIX + domain + "/" + triggerId;
        return redisTemplate.opsForZSet()
            .reverseRange(indexKey, Range.closed(0L, (long) limit - 1))
            .map(id -> jobKey(domain, id))
            .collectList()
            .filter(keys -> !keys.isEmpty())
            .flatMapMany(keys -> redisTemplate.opsForValue().multiGet(keys))
            .flatMapIterable(values -> values.stream().filter(Objects::nonNull).toList())
            .map(this::read);
    }

    private Mono<Void> save(Job job) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(job))
            .flatMap(json -> redisTemplate.opsForValue().set(jobKey(job.getDomain(), job.getId()), json, TTL))
            .doOnSuccess(ok -> log.debug("Job {} of {} saved with state {}", job.getId(), job.getDomain(), job.getState()))
            .then();
    }

    private Mono<Void> indexByTrigger(Job job) {
        if (job.getTriggerId() == null) {
            return Mono.empty();
        }
        String indexKey = TRIGGER_JOBS_KEY_PREFIX + job.getDomain() + "/" + job.getTriggerId();
        double score = job.getQueuedAt() != null ? job.getQueuedAt().toEpochMilli() : System.currentTimeMillis();
        return redisTemplate.opsForZSet().add(indexKey, job.getId(), score)
            .then(redisTemplate.expire(indexKey, TTL))
            .then();
    }

    private Job read(String json) {
        try {
            return objectMapper.readValue(json, Job.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted job record: " + e.getOriginalMessage(), e);
        }
    }

    private static String jobKey(String domain, String id) {
        return JOB_KEY_PREFIX + domain + "/" + id;
    }
}
