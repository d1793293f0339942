package com.whereq.dispatch.broker;

import com.whereq.dispatch.exception.BrokerClosedException;
import com.whereq.dispatch.exception.UnknownWorkerException;
import com.whereq.dispatch.executor.JobOutcome;
import com.whereq.dispatch.executor.WorkerConfig;
import com.whereq.dispatch.executor.WorkerPool;
import com.whereq.dispatch.executor.WorkerRegistry;
import com.whereq.dispatch.model.Job;
import com.whereq.dispatch.model.JobRequest;
import com.whereq.dispatch.queue.JobQueue;
import com.whereq.dispatch.store.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Broker logic shared by the in-memory and Redis variants. Subclasses only
 * decide where the queue of a worker type lives.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public abstract class AbstractJobBroker implements JobBroker {

    protected final JobStore jobStore;
    protected final MeterRegistry meterRegistry;
    protected final Clock clock;

    private final Map<String, WorkerPool> pools = new ConcurrentHashMap<>();
    private final Sinks.Many<JobOutcome> outcomes = Sinks.many().multicast().directBestEffort();
    private volatile WorkerRegistry registry;
    private volatile boolean running;

    protected AbstractJobBroker(JobStore jobStore, MeterRegistry meterRegistry, Clock clock) {
        this.jobStore = jobStore;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Queue of a worker type, created when the broker starts
     */
    protected abstract JobQueue createQueue(WorkerConfig config);

    @Override
    public Mono<Void> startWorkers(WorkerRegistry registry) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                if (running) {
                    throw new BrokerClosedException("Broker already started");
                }
                this.registry = registry;
                for (WorkerConfig config : registry.configs()) {
                    WorkerPool pool = new WorkerPool(
                        config, createQueue(config), jobStore, this::publishOutcome, meterRegistry, clock);
                    pools.put(config.getWorkerType(), pool);
                    pool.start();
                }
                running = true;
                log.info("Job broker started with worker types {}", registry.workerTypes());
            }
        });
    }

    @Override
    public Mono<Void> shutdownWorkers(Duration timeout) {
        synchronized (this) {
            if (!running) {
                return Mono.error(new BrokerClosedException("Broker is not running"));
            }
            running = false;
        }
        log.info("Shutting down job broker");
        return Flux.fromIterable(List.copyOf(pools.values()))
            .flatMap(pool -> pool.stop(timeout))
            .then()
            .doOnSuccess(unused -> log.info("Job broker stopped"))
            .doFinally(signal -> pools.clear());
    }

    @Override
    public Mono<Job> pushJob(JobRequest request) {
        return Mono.defer(() -> {
            if (!running) {
                return Mono.error(new BrokerClosedException("Broker is not running"));
            }
            if (!StringUtils.hasText(request.getDomain())) {
                return Mono.error(new IllegalArgumentException("Job request has no domain"));
            }
            WorkerPool pool = pools.get(request.getWorkerType());
            if (pool == null) {
                return Mono.error(new UnknownWorkerException(request.getWorkerType()));
            }
            return jobStore.create(Job.fromRequest(request, clock.instant()))
                .flatMap(job -> pool.getQueue().enqueue(job).thenReturn(job))
                .doOnNext(job -> log.debug("Pushed job {}/{} to {}",
                    job.getDomain(), job.getId(), job.getWorkerType()));
        });
    }

    @Override
    public Mono<JobOutcome> pushJobAndAwait(JobRequest request) {
        return Mono.defer(() -> {
            Mono<Job> pushed = pushJob(request).cache();
            return outcomes()
                .mergeWith(pushed.then(Mono.empty()))
                .filterWhen(outcome -> pushed.map(job -> job.getId().equals(outcome.getJob().getId())))
                .next();
        });
    }

    @Override
    public Mono<Long> queueLength(String workerType) {
        return Mono.defer(() -> {
            WorkerPool pool = pools.get(workerType);
            if (pool == null) {
                return Mono.error(new UnknownWorkerException(workerType));
            }
            return pool.getQueue().size();
        });
    }

    @Override
    public List<String> workerTypes() {
        WorkerRegistry current = registry;
        return current != null ? current.workerTypes() : List.of();
    }

    @Override
    public Flux<JobOutcome> outcomes() {
        return outcomes.asFlux().onBackpressureBuffer();
    }

    public boolean isRunning() {
        return running;
    }

    private void publishOutcome(JobOutcome outcome) {
        synchronized (outcomes) {
            outcomes.tryEmitNext(outcome);
        }
    }
}
