package com.whereq.dispatch.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.model.TriggerInfo;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Trigger configurations stored in one Redis hash per domain
 * ({@code trigger-infos-<domain>}: id → JSON)
 */
public class RedisTriggerStore implements TriggerStore {

    private static final String INFOS_KEY_PREFIX = "trigger-infos-";
    private static final String DOMAINS_KEY = "trigger-domains";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisTriggerStore(ReactiveRedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = StoredMessageMixin.storageMapper(objectMapper);
    }

    @Override
    public Mono<TriggerInfo> get(String domain, String id) {
        return redisTemplate.<String, String>opsForHash()
            .get(INFOS_KEY_PREFIX + domain, id)
            .map(this::read)
            .switchIfEmpty(Mono.error(NotFoundException.trigger(domain, id)));
    }

    @Override
    public Flux<TriggerInfo> getAll(String domain) {
        return redisTemplate.<String, String>opsForHash()
            .values(INFOS_KEY_PREFIX + domain)
            .map(this::read);
    }

    @Override
    public Flux<TriggerInfo> findAll() {
        return redisTemplate.opsForSet()
            .members(DOMAINS_KEY)
            .concatMap(this::getAll);
    }

    @Override
    public Mono<TriggerInfo> add(TriggerInfo info) {
        return Mono.fromCallable(() -> {
                if (info.getId() == null) {
                    info.setId(Identifiers.newId());
                }
                info.setRevision(Identifiers.nextRevision(null));
                return write(info);
            })
            .flatMap(json -> redisTemplate.opsForSet().add(DOMAINS_KEY, info.getDomain())
                .then(redisTemplate.<String, String>opsForHash().put(INFOS_KEY_PREFIX + info.getDomain(), info.getId(), json)))
            .thenReturn(info);
    }

    @Override
    public Mono<TriggerInfo> update(TriggerInfo info) {
        String key = INFOS_KEY_PREFIX + info.getDomain();
        return redisTemplate.<String, String>opsForHash()
            .hasKey(key, info.getId())
            .flatMap(exists -> {
                if (!exists) {
                    return Mono.error(NotFoundException.trigger(info.getDomain(), info.getId()));
                }
                info.setRevision(Identifiers.nextRevision(info.getRevision()));
                return Mono.fromCallable(() -> write(info))
                    .flatMap(json -> redisTemplate.<String, String>opsForHash().put(key, info.getId(), json))
                    .thenReturn(info);
            });
    }

    @Override
    public Mono<Void> delete(TriggerInfo info) {
        return redisTemplate.<String, String>opsForHash()
            .remove(INFOS_KEY_PREFIX + info.getDomain(), info.getId())
            .flatMap(removed -> removed > 0
                ? Mono.<Void>empty()
                : Mono.error(NotFoundException.trigger(info.getDomain(), info.getId())));
    }

    private String write(TriggerInfo info) throws JsonProcessingException {
        return objectMapper.writeValueAsString(info);
    }

    private TriggerInfo read(String json) {
        try {
            return objectMapper.readValue(json, TriggerInfo.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted trigger record: " + e.getOriginalMessage(), e);
        }
    }
}
