package com.whereq.dispatch.store;

import com.whereq.dispatch.model.TriggerInfo;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable storage of trigger configurations
 */
public interface TriggerStore {

    /**
     * @return the trigger, or a {@link com.whereq.dispatch.exception.NotFoundException}
     *         error when it does not exist on this domain
     */
    Mono<TriggerInfo> get(String domain, String id);

    Flux<TriggerInfo> getAll(String domain);

    /**
     * Every persisted trigger of every domain, used when a scheduler starts
     */
    Flux<TriggerInfo> findAll();

    /**
     * Persist a new trigger, assigning its identifier and revision
     */
    Mono<TriggerInfo> add(TriggerInfo info);

    Mono<TriggerInfo> update(TriggerInfo info);

    /**
     * Remove a trigger. Removing a missing trigger is a {@code NotFoundException}.
     */
    Mono<Void> delete(TriggerInfo info);
}
