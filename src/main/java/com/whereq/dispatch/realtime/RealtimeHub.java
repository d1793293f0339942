package com.whereq.dispatch.realtime;

import reactor.core.publisher.Flux;

import java.util.Collection;

/**
 * Realtime publish / subscribe bus the event triggers listen to
 */
public interface RealtimeHub {

    /**
     * Publish an event to the subscribers of its domain and doctype
     *
     * @param event the event to publish
     */
    void publish(RealtimeEvent event);

    /**
     * Subscribe to the events of a domain for the given doctypes
     *
     * @param domain the domain to listen to
     * @param doctypes doctypes of interest
     * @return hot stream of events, never completing on its own
     */
    Flux<RealtimeEvent> subscribe(String domain, Collection<String> doctypes);

    /**
     * Subscribe to every event published in this process
     *
     * @return hot stream of events
     */
    Flux<RealtimeEvent> subscribeAll();
}
