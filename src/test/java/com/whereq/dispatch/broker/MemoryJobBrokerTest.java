package com.whereq.dispatch.broker;

import com.whereq.dispatch.exception.AbortJobException;
import com.whereq.dispatch.exception.BrokerClosedException;
import com.whereq.dispatch.exception.JobSystemException;
import com.whereq.dispatch.exception.JobTimedOutException;
import com.whereq.dispatch.exception.UnknownWorkerException;
import com.whereq.dispatch.executor.JobOutcome;
import com.whereq.dispatch.executor.JobWorker;
import com.whereq.dispatch.executor.WorkerConfig;
import com.whereq.dispatch.executor.WorkerRegistry;
import com.whereq.dispatch.model.Job;
import com.whereq.dispatch.model.JobOptions;
import com.whereq.dispatch.model.JobRequest;
import com.whereq.dispatch.model.JobState;
import com.whereq.dispatch.model.Message;
import com.whereq.dispatch.store.MemoryJobStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MemoryJobBrokerTest {

    private static final Duration WAIT = Duration.ofSeconds(10);
    private static final String DOMAIN = "alice.example.com";

    private final MemoryJobStore store = new MemoryJobStore();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final MemoryJobBroker broker = new MemoryJobBroker(store, meterRegistry, Clock.systemUTC());

    @AfterEach
    void shutdown() {
        if (broker.isRunning()) {
            broker.shutdownWorkers(WAIT).block(WAIT);
        }
    }

    private void start(WorkerConfig... configs) {
        WorkerRegistry.Builder builder = WorkerRegistry.builder();
        for (WorkerConfig config : configs) {
            builder.register(config);
        }
        broker.startWorkers(builder.build()).block(WAIT);
    }

    private static WorkerConfig.WorkerConfigBuilder worker(String type, JobWorker worker) {
        return WorkerConfig.builder()
            .workerType(type)
            .concurrency(1)
            .retryDelay(Duration.ofMillis(10))
            .worker(worker);
    }

    private static JobRequest request(String type, String message) {
        return JobRequest.builder()
            .domain(DOMAIN)
            .workerType(type)
            .message(message != null ? Message.of(message) : null)
            .build();
    }

    @Test
    void successfulJobIsDone() {
        start(worker("log", context -> { }).build());

        JobOutcome outcome = broker.pushJobAndAwait(request("log", "hello")).block(WAIT);

        assertThat(outcome.isSuccess()).isTrue();
        Job job = store.get(DOMAIN, outcome.getJob().getId()).block(WAIT);
        assertThat(job.getState()).isEqualTo(JobState.DONE);
        assertThat(job.getTryCount()).isEqualTo(1);
        assertThat(job.getStartedAt()).isNotNull();
        assertThat(job.getFinishedAt()).isNotNull();
        assertThat(job.getError()).isNull();
        assertThat(meterRegistry.counter("dispatch.jobs.executed", "worker", "log", "result", "done").count())
            .isEqualTo(1.0);
    }

    @Test
    void failingJobIsRetriedUpToTheBudget() {
        AtomicInteger calls = new AtomicInteger();
        start(worker("flaky", context -> {
            calls.incrementAndGet();
            throw new IllegalStateException("still broken");
        }).maxExecCount(3).build());

        JobOutcome outcome = broker.pushJobAndAwait(request("flaky", null)).block(WAIT);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(calls.get()).isEqualTo(3);
        Job job = store.get(DOMAIN, outcome.getJob().getId()).block(WAIT);
        assertThat(job.getState()).isEqualTo(JobState.ERRORED);
        assertThat(job.getError()).isEqualTo("still broken");
        assertThat(job.getTryCount()).isEqualTo(3);
    }

    @Test
    void jobSucceedingOnRetryIsDone() {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> attempts = new CopyOnWriteArrayList<>();
        start(worker("flaky", context -> {
            attempts.add(context.getAttempt());
            if (calls.incrementAndGet() < 2) {
                throw new IllegalStateException("first attempt fails");
            }
        }).maxExecCount(3).build());

        JobOutcome outcome = broker.pushJobAndAwait(request("flaky", null)).block(WAIT);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getJob().getState()).isEqualTo(JobState.DONE);
        assertThat(attempts).containsExactly(1, 2);
    }

    @Test
    void jobOptionsTightenTheRetryBudget() {
        AtomicInteger calls = new AtomicInteger();
        start(worker("flaky", context -> {
            calls.incrementAndGet();
            throw new IllegalStateException("broken");
        }).maxExecCount(5).build());

        JobRequest request = request("flaky", null);
        request.setOptions(JobOptions.builder().maxExecCount(2).build());
        broker.pushJobAndAwait(request).block(WAIT);

        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void timedOutAttemptIsRetried() {
        AtomicInteger calls = new AtomicInteger();
        start(worker("slow", context -> {
            calls.incrementAndGet();
            Thread.sleep(2_000);
        }).timeout(Duration.ofMillis(100)).maxExecCount(2).build());

        JobOutcome outcome = broker.pushJobAndAwait(request("slow", null)).block(WAIT);

        assertThat(outcome.getError()).isInstanceOf(JobTimedOutException.class);
        assertThat(calls.get()).isEqualTo(2);
        assertThat(outcome.getJob().getState()).isEqualTo(JobState.ERRORED);
        assertThat(meterRegistry.counter("dispatch.jobs.timeouts", "worker", "slow").count()).isEqualTo(2.0);
    }

    @Test
    void timedOutHandlerKeepsItsSlotUntilItReturns() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        start(worker("stubborn", context -> {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                // busy wait, ignoring interrupts
                long end = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(600);
                while (System.nanoTime() < end) {
                    Thread.onSpinWait();
                }
            } finally {
                running.decrementAndGet();
            }
        }).timeout(Duration.ofMillis(100)).maxExecCount(1).build());

        List<JobOutcome> outcomes = Flux.merge(
                broker.pushJobAndAwait(request("stubborn", "a")),
                broker.pushJobAndAwait(request("stubborn", "b")),
                broker.pushJobAndAwait(request("stubborn", "c")))
            .collectList()
            .block(WAIT);

        assertThat(outcomes).hasSize(3)
            .allSatisfy(outcome -> assertThat(outcome.getError()).isInstanceOf(JobTimedOutException.class));
        assertThat(maxRunning.get()).isEqualTo(1);
    }

    @Test
    void timeoutInterruptsTheHandler() {
        AtomicInteger interrupted = new AtomicInteger();
        start(worker("sleepy", context -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.incrementAndGet();
                throw e;
            }
        }).timeout(Duration.ofMillis(100)).maxExecCount(1).build());

        long start = System.nanoTime();
        JobOutcome outcome = broker.pushJobAndAwait(request("sleepy", null)).block(WAIT);

        assertThat(outcome.getError()).isInstanceOf(JobTimedOutException.class);
        assertThat(interrupted.get()).isEqualTo(1);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(3));
    }

    @Test
    void noRetryMakesTheFailureFinal() {
        AtomicInteger calls = new AtomicInteger();
        start(worker("strict", context -> {
            calls.incrementAndGet();
            context.setNoRetry();
            throw new IllegalArgumentException("invalid input");
        }).maxExecCount(5).build());

        JobOutcome outcome = broker.pushJobAndAwait(request("strict", null)).block(WAIT);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void abortedJobIsDone() {
        start(worker("abort", context -> {
            throw new AbortJobException("nothing to do");
        }).maxExecCount(3).build());

        JobOutcome outcome = broker.pushJobAndAwait(request("abort", null)).block(WAIT);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getJob().getState()).isEqualTo(JobState.DONE);
        assertThat(outcome.getJob().getTryCount()).isEqualTo(1);
    }

    @Test
    void crashingWorkerDoesNotKillThePool() {
        AtomicInteger calls = new AtomicInteger();
        start(worker("crash", context -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException();
            }
        }).build());

        JobOutcome crashed = broker.pushJobAndAwait(request("crash", null)).block(WAIT);
        JobOutcome next = broker.pushJobAndAwait(request("crash", null)).block(WAIT);

        assertThat(crashed.getJob().getState()).isEqualTo(JobState.ERRORED);
        assertThat(crashed.getJob().getError()).isEqualTo("IllegalStateException");
        assertThat(next.isSuccess()).isTrue();
    }

    @Test
    void singleExecutorRunsJobsInPushOrder() {
        List<String> seen = new CopyOnWriteArrayList<>();
        start(worker("ordered", context -> seen.add(context.unmarshalMessage(String.class))).build());

        broker.pushJob(request("ordered", "a")).block(WAIT);
        broker.pushJob(request("ordered", "b")).block(WAIT);
        broker.pushJobAndAwait(request("ordered", "c")).block(WAIT);

        assertThat(seen).containsExactly("a", "b", "c");
    }

    @Test
    void executorsRunInParallel() throws InterruptedException {
        CountDownLatch bothRunning = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        start(worker("parallel", context -> {
            bothRunning.countDown();
            release.await(5, TimeUnit.SECONDS);
        }).concurrency(2).build());

        broker.pushJob(request("parallel", null)).block(WAIT);
        broker.pushJob(request("parallel", null)).block(WAIT);

        assertThat(bothRunning.await(5, TimeUnit.SECONDS)).isTrue();
        release.countDown();
    }

    @Test
    void unknownWorkerTypeCreatesNoJob() {
        start(worker("log", context -> { }).build());

        StepVerifier.create(broker.pushJob(request("sendmail", null)))
            .expectError(UnknownWorkerException.class)
            .verify(WAIT);

        assertThat(store.size()).isZero();
    }

    @Test
    void queueLengthCountsWaitingJobs() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        start(worker("blocked", context -> release.await(5, TimeUnit.SECONDS)).build());

        broker.pushJob(request("blocked", null)).block(WAIT);
        broker.pushJob(request("blocked", null)).block(WAIT);
        broker.pushJob(request("blocked", null)).block(WAIT);
        Thread.sleep(200);

        assertThat(broker.queueLength("blocked").block(WAIT)).isEqualTo(2L);
        release.countDown();
        StepVerifier.create(broker.queueLength("sendmail"))
            .expectError(UnknownWorkerException.class)
            .verify(WAIT);
    }

    @Test
    void pushAfterShutdownIsRejected() {
        start(worker("log", context -> { }).build());
        broker.shutdownWorkers(WAIT).block(WAIT);

        StepVerifier.create(broker.pushJob(request("log", null)))
            .expectError(BrokerClosedException.class)
            .verify(WAIT);
        StepVerifier.create(broker.shutdownWorkers(WAIT))
            .expectError(BrokerClosedException.class)
            .verify(WAIT);
    }

    @Test
    void shutdownWaitsForTheRunningJob() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        AtomicInteger finished = new AtomicInteger();
        start(worker("slow", context -> {
            started.countDown();
            Thread.sleep(300);
            finished.incrementAndGet();
        }).build());

        broker.pushJob(request("slow", null)).block(WAIT);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        broker.shutdownWorkers(WAIT).block(WAIT);

        assertThat(finished.get()).isEqualTo(1);
    }

    @Test
    void shutdownReportsAnExpiredDeadline() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        start(worker("blocked", context -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
        }).build());

        try {
            broker.pushJob(request("blocked", null)).block(WAIT);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            StepVerifier.create(broker.shutdownWorkers(Duration.ofMillis(100)))
                .expectErrorSatisfies(e -> assertThat(e)
                    .isExactlyInstanceOf(JobSystemException.class)
                    .hasMessageContaining("did not stop"))
                .verify(WAIT);
        } finally {
            release.countDown();
        }
    }

    @Test
    void secondStartIsRejected() {
        start(worker("log", context -> { }).build());

        StepVerifier.create(broker.startWorkers(WorkerRegistry.builder().build()))
            .expectError(BrokerClosedException.class)
            .verify(WAIT);
    }
}
