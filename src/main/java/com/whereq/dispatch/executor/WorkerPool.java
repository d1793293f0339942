package com.whereq.dispatch.executor;

import com.whereq.dispatch.exception.AbortJobException;
import com.whereq.dispatch.exception.JobSystemException;
import com.whereq.dispatch.exception.JobTimedOutException;
import com.whereq.dispatch.model.Job;
import com.whereq.dispatch.model.JobState;
import com.whereq.dispatch.queue.JobQueue;
import com.whereq.dispatch.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Background job processor that consumes the queue of one worker type and
 * runs up to {@code concurrency} jobs at once
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class WorkerPool {

    private final WorkerConfig config;
    private final JobQueue queue;
    private final JobStore jobStore;
    private final Consumer<JobOutcome> outcomeListener;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Queue<Integer> freeSlots = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private final Sinks.Empty<Void> drained = Sinks.empty();
    private volatile Disposable subscription;

    private final Counter timeoutCounter;
    private final DistributionSummary retriesSummary;

    public WorkerPool(WorkerConfig config, JobQueue queue, JobStore jobStore,
                      Consumer<JobOutcome> outcomeListener, MeterRegistry meterRegistry, Clock clock) {
        this.config = config;
        this.queue = queue;
        this.jobStore = jobStore;
        this.outcomeListener = outcomeListener;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        for (int slot = 0; slot < config.getConcurrency(); slot++) {
            freeSlots.add(slot);
        }

        timeoutCounter = Counter.builder("dispatch.jobs.timeouts")
            .description("Number of job attempts that exceeded their timeout")
            .tag("worker", config.getWorkerType())
            .register(meterRegistry);

        retriesSummary = DistributionSummary.builder("dispatch.jobs.retries")
            .description("Number of retries a job needed before reaching a final state")
            .tag("worker", config.getWorkerType())
            .register(meterRegistry);
    }

    public String getWorkerType() {
        return config.getWorkerType();
    }

    public JobQueue getQueue() {
        return queue;
    }

    /**
     * Start consuming the queue
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker pool " + config.getWorkerType() + " already started");
        }
        log.info("Starting worker pool {} with {} executors", config.getWorkerType(), config.getConcurrency());

        subscription = queue.consumeAsFlux()
            .flatMap(this::process, config.getConcurrency())
            .subscribe(
                unused -> { },
                e -> {
                    log.error("Fatal error in worker pool {}", config.getWorkerType(), e);
                    drained.tryEmitEmpty();
                },
                () -> {
                    log.info("Worker pool {} stopped", config.getWorkerType());
                    drained.tryEmitEmpty();
                });
    }

    /**
     * Close the queue and wait for the running jobs to finish
     *
     * @param timeout how long to wait for the running jobs
     * @return Mono that completes once drained, or fails when the timeout expires
     */
    public Mono<Void> stop(Duration timeout) {
        if (!started.get()) {
            return Mono.empty();
        }
        queue.close();
        return drained.asMono()
            .timeout(timeout)
            .onErrorMap(TimeoutException.class, e -> {
                subscription.dispose();
                return new JobSystemException(
                    "Worker pool " + config.getWorkerType() + " did not stop within " + timeout.toMillis() + "ms");
            });
    }

    private Mono<Void> process(Job dequeued) {
        RetryPolicy policy = RetryPolicy.of(config, dequeued.getOptions());
        Integer slot = freeSlots.poll();
        return markRunning(dequeued)
            .flatMap(running -> {
                Instant deadline = clock.instant().plus(policy.getTimeout());
                WorkerContext context = new WorkerContext(workerId(slot, running), running, deadline);
                return runAttempt(context, policy)
                    .flatMap(error -> error.isPresent()
                        ? handleFailure(running, context, policy, error.get())
                        : handleSuccess(running, "done"));
            })
            .onErrorResume(e -> {
                log.error("Error processing job {}/{} on {}: {}",
                    dequeued.getDomain(), dequeued.getId(), config.getWorkerType(), e.getMessage(), e);
                return Mono.empty();
            })
            .doFinally(signal -> {
                if (slot != null) {
                    freeSlots.add(slot);
                }
            });
    }

    private Mono<Job> markRunning(Job dequeued) {
        Job job = dequeued.copy();
        job.setState(JobState.RUNNING);
        job.setStartedAt(clock.instant());
        job.setFinishedAt(null);
        job.setError(null);
        job.setTryCount(job.getTryCount() + 1);
        log.debug("Consumed job {}/{} on {} (attempt {})",
            job.getDomain(), job.getId(), config.getWorkerType(), job.getTryCount());
        return jobStore.update(job);
    }

    /**
     * Execute a single attempt. When the timeout expires the handler thread is
     * interrupted and the attempt fails with {@link JobTimedOutException}, but
     * only once the handler call has returned: the slot is never handed to
     * another job while a handler still runs.
     *
     * @return the failure of the attempt, empty on success
     */
    private Mono<Optional<Throwable>> runAttempt(WorkerContext context, RetryPolicy policy) {
        Timer.Sample sample = Timer.start(meterRegistry);
        return Mono.defer(() -> {
                HandlerCall call = new HandlerCall();
                CompletableFuture<Optional<Throwable>> execution = Mono.fromCallable(() -> call.run(context))
                    .subscribeOn(Schedulers.boundedElastic())
                    .onErrorResume(error -> Mono.just(Optional.of(error)))
                    .toFuture();
                Mono<Optional<Throwable>> timedOut = Mono.defer(() -> {
                    log.warn("Job {} exceeded its timeout of {}ms", context.getId(), policy.getTimeout().toMillis());
                    call.interrupt();
                    return Mono.fromFuture(execution.thenApply(result -> result))
                        .thenReturn(Optional.<Throwable>of(new JobTimedOutException(policy.getTimeout())));
                });
                return Mono.fromFuture(execution.thenApply(result -> result))
                    .timeout(policy.getTimeout(), timedOut);
            })
            .doOnNext(error -> sample.stop(Timer.builder("dispatch.jobs.execution.time")
                .description("Job attempt execution time")
                .tag("worker", config.getWorkerType())
                .tag("result", error.isPresent() ? "errored" : "done")
                .register(meterRegistry)));
    }

    private Mono<Void> handleSuccess(Job running, String result) {
        Job job = running.copy();
        job.setState(JobState.DONE);
        job.setFinishedAt(clock.instant());
        job.setError(null);
        job.setEvent(null);
        return jobStore.update(job)
            .doOnNext(saved -> {
                log.info("Job {}/{} completed on {}", saved.getDomain(), saved.getId(), config.getWorkerType());
                recordFinal(saved, result);
                outcomeListener.accept(new JobOutcome(saved, null));
            })
            .then();
    }

    /**
     * Handle job failure with retry logic
     */
    private Mono<Void> handleFailure(Job running, WorkerContext context, RetryPolicy policy, Throwable error) {
        if (error instanceof AbortJobException) {
            log.info("Job {} aborted: {}", context.getId(), error.getMessage());
            return handleSuccess(running, "aborted");
        }
        if (error instanceof JobTimedOutException) {
            timeoutCounter.increment();
            log.warn("Job {} failed: {}", context.getId(), error.getMessage());
        } else {
            log.error("Job {} failed: {}", context.getId(), error.getMessage(), error);
        }

        Job failed = running.copy();
        failed.setState(JobState.ERRORED);
        failed.setFinishedAt(clock.instant());
        failed.setError(describe(error));

        boolean retry = !context.isNoRetry()
            && policy.shouldRetry(error, failed.getTryCount(), failed.getQueuedAt(), clock.instant());
        if (!retry) {
            return jobStore.update(failed)
                .doOnNext(saved -> {
                    log.warn("Job {}/{} failed permanently after {} attempt(s)",
                        saved.getDomain(), saved.getId(), saved.getTryCount());
                    recordFinal(saved, "errored");
                    outcomeListener.accept(new JobOutcome(saved, error));
                })
                .then();
        }

        Duration backoff = policy.calculateBackoff(failed.getTryCount());
        log.warn("Retrying job {}/{} in {}ms (attempt {}/{})", failed.getDomain(), failed.getId(),
            backoff.toMillis(), failed.getTryCount() + 1, policy.getMaxExecCount());
        return jobStore.update(failed)
            .delayElement(backoff)
            .flatMap(saved -> {
                saved.setState(JobState.QUEUED);
                saved.setError(null);
                saved.setFinishedAt(null);
                return jobStore.update(saved);
            })
            .flatMap(queue::enqueue);
    }

    private void recordFinal(Job job, String result) {
        Counter.builder("dispatch.jobs.executed")
            .description("Number of jobs that reached a final state")
            .tag("worker", config.getWorkerType())
            .tag("result", result)
            .register(meterRegistry)
            .increment();
        retriesSummary.record(Math.max(job.getTryCount() - 1, 0));
    }

    private String workerId(Integer slot, Job job) {
        return slot != null
            ? config.getWorkerType() + "/" + slot + "/" + job.getId()
            : config.getWorkerType() + "/" + job.getId();
    }

    /**
     * Handler invocation that can be interrupted from another thread while it runs
     */
    private class HandlerCall {
        private Thread runner;
        private boolean interrupted;

        Optional<Throwable> run(WorkerContext context) throws Exception {
            synchronized (this) {
                if (interrupted) {
                    // timed out before a thread picked it up
                    return Optional.empty();
                }
                runner = Thread.currentThread();
            }
            try {
                log.info("Starting execution of job {}", context.getId());
                config.getWorker().execute(context);
                return Optional.empty();
            } finally {
                synchronized (this) {
                    runner = null;
                    // clear an interrupt that arrived after the handler returned
                    Thread.interrupted();
                }
            }
        }

        synchronized void interrupt() {
            interrupted = true;
            if (runner != null) {
                runner.interrupt();
            }
        }
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
