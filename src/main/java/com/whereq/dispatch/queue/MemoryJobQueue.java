package com.whereq.dispatch.queue;

import com.whereq.dispatch.exception.BrokerClosedException;
import com.whereq.dispatch.model.Job;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Unbounded in-process queue. Jobs are lost on restart.
 */
@Slf4j
public class MemoryJobQueue implements JobQueue {

    private final String workerType;
    private final Queue<Job> buffer = new ConcurrentLinkedQueue<>();
    private final Sinks.Many<Job> sink = Sinks.many().unicast().onBackpressureBuffer(buffer);
    private final Sinks.Empty<Void> closed = Sinks.empty();

    public MemoryJobQueue(String workerType) {
        this.workerType = workerType;
    }

    @Override
    public String getWorkerType() {
        return workerType;
    }

    @Override
    public Mono<Void> enqueue(Job job) {
        return Mono.fromRunnable(() -> {
            Sinks.EmitResult result;
            synchronized (sink) {
                result = sink.tryEmitNext(job.copy());
            }
            if (result.isFailure()) {
                throw new BrokerClosedException("Queue " + workerType + " is closed");
            }
            log.debug("Enqueued job {}/{} on {}", job.getDomain(), job.getId(), workerType);
        });
    }

    @Override
    public Flux<Job> consumeAsFlux() {
        return sink.asFlux().takeUntilOther(closed.asMono());
    }

    @Override
    public Mono<Long> size() {
        return Mono.fromSupplier(() -> (long) buffer.size());
    }

    @Override
    public void close() {
        closed.tryEmitEmpty();
        synchronized (sink) {
            sink.tryEmitComplete();
        }
    }
}
