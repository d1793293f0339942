package com.whereq.dispatch.store;

import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.model.TriggerInfo;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Trigger store keeping deep copies of the records in memory
 */
public class MemoryTriggerStore implements TriggerStore {

    private final Map<String, TriggerInfo> triggers = new ConcurrentHashMap<>();

    @Override
    public Mono<TriggerInfo> get(String domain, String id) {
        return Mono.defer(() -> {
            TriggerInfo info = triggers.get(key(domain, id));
            if (info == null) {
                return Mono.error(NotFoundException.trigger(domain, id));
            }
            return Mono.just(info.copy());
        });
    }

    @Override
    public Flux<TriggerInfo> getAll(String domain) {
        return Flux.defer(() -> Flux.fromStream(triggers.values().stream()
            .filter(info -> domain.equals(info.getDomain()))
            .map(TriggerInfo::copy)));
    }

    @Override
    public Flux<TriggerInfo> findAll() {
        return Flux.defer(() -> Flux.fromStream(triggers.values().stream().map(TriggerInfo::copy)));
    }

    @Override
    public Mono<TriggerInfo> add(TriggerInfo info) {
        return Mono.fromCallable(() -> {
            if (info.getId() == null) {
                info.setId(Identifiers.newId());
            }
            info.setRevision(Identifiers.nextRevision(null));
            triggers.put(key(info.getDomain(), info.getId()), info.copy());
            return info;
        });
    }

    @Override
    public Mono<TriggerInfo> update(TriggerInfo info) {
        return Mono.defer(() -> {
            String revision = Identifiers.nextRevision(info.getRevision());
            TriggerInfo stored = info.toBuilder().revision(revision).build().copy();
            if (triggers.computeIfPresent(key(info.getDomain(), info.getId()), (k, previous) -> stored) == null) {
                return Mono.error(NotFoundException.trigger(info.getDomain(), info.getId()));
            }
            info.setRevision(revision);
            return Mono.just(info);
        });
    }

    @Override
    public Mono<Void> delete(TriggerInfo info) {
        return Mono.defer(() -> {
            if (triggers.remove(key(info.getDomain(), info.getId())) == null) {
                return Mono.error(NotFoundException.trigger(info.getDomain(), info.getId()));
            }
            return Mono.empty();
        });
    }

    private static String key(String domain, String id) {
        return domain + "/" + id;
    }
}
