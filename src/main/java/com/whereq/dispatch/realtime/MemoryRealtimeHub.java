package com.whereq.dispatch.realtime;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Collection;
import java.util.Set;

/**
 * In-process realtime hub backed by a multicast sink
 */
@Slf4j
public class MemoryRealtimeHub implements RealtimeHub {

    private final Sinks.Many<RealtimeEvent> sink = Sinks.many().multicast().directBestEffort();

    @Override
    public synchronized void publish(RealtimeEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Could not publish {} event on {} for domain {}: {}",
                event.getVerb(), event.getDoctype(), event.getDomain(), result);
        }
    }

    @Override
    public Flux<RealtimeEvent> subscribe(String domain, Collection<String> doctypes) {
        Set<String> types = Set.copyOf(doctypes);
        return subscribeAll()
            .filter(event -> domain.equals(event.getDomain()) && types.contains(event.getDoctype()));
    }

    @Override
    public Flux<RealtimeEvent> subscribeAll() {
        return sink.asFlux().onBackpressureBuffer();
    }
}
