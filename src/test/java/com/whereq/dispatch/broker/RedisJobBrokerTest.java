package com.whereq.dispatch.broker;

import com.whereq.dispatch.exception.UnknownWorkerException;
import com.whereq.dispatch.executor.JobOutcome;
import com.whereq.dispatch.executor.JobWorker;
import com.whereq.dispatch.executor.WorkerConfig;
import com.whereq.dispatch.executor.WorkerRegistry;
import com.whereq.dispatch.model.Job;
import com.whereq.dispatch.model.JobRequest;
import com.whereq.dispatch.model.JobState;
import com.whereq.dispatch.model.Message;
import com.whereq.dispatch.queue.RedisJobQueue;
import com.whereq.dispatch.store.RedisJobStore;
import com.whereq.dispatch.support.AbstractRedisTest;
import com.whereq.dispatch.support.Await;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RedisJobBrokerTest extends AbstractRedisTest {

    private static final Duration WAIT = Duration.ofSeconds(10);
    private static final String DOMAIN = "alice.example.com";

    private final List<RedisJobBroker> brokers = new ArrayList<>();
    private RedisJobStore jobStore;

    @BeforeEach
    void setUp() {
        jobStore = new RedisJobStore(redisTemplate, OBJECT_MAPPER);
    }

    @AfterEach
    void tearDown() {
        for (RedisJobBroker broker : brokers) {
            if (broker.isRunning()) {
                broker.shutdownWorkers(WAIT).block(WAIT);
            }
        }
    }

    private RedisJobBroker startBroker(String workerType, JobWorker worker) {
        RedisJobBroker broker = new RedisJobBroker(redisTemplate, jobStore, new SimpleMeterRegistry(),
            Clock.systemUTC(), Duration.ofSeconds(1));
        broker.startWorkers(WorkerRegistry.builder()
            .register(WorkerConfig.builder()
                .workerType(workerType)
                .concurrency(2)
                .maxExecCount(2)
                .retryDelay(Duration.ofMillis(10))
                .worker(worker)
                .build())
            .build()).block(WAIT);
        brokers.add(broker);
        return broker;
    }

    private static JobRequest request(String workerType, String message) {
        return JobRequest.builder()
            .domain(DOMAIN)
            .workerType(workerType)
            .message(Message.of(message))
            .build();
    }

    @Test
    void pushedJobIsRunAndStored() {
        RedisJobBroker broker = startBroker("log", context -> { });

        JobOutcome outcome = broker.pushJobAndAwait(request("log", "hello")).block(WAIT);

        assertThat(outcome.isSuccess()).isTrue();
        Job stored = jobStore.get(DOMAIN, outcome.getJob().getId()).block(WAIT);
        assertThat(stored.getState()).isEqualTo(JobState.DONE);
        assertThat(stored.getMessage().unmarshal(String.class)).isEqualTo("hello");
        assertThat(stored.getQueuedAt()).isNotNull();
    }

    @Test
    void failedJobIsRetriedThroughTheQueue() {
        AtomicInteger calls = new AtomicInteger();
        RedisJobBroker broker = startBroker("flaky", context -> {
            calls.incrementAndGet();
            throw new IllegalStateException("nope");
        });

        JobOutcome outcome = broker.pushJobAndAwait(request("flaky", "x")).block(WAIT);

        assertThat(calls.get()).isEqualTo(2);
        assertThat(outcome.getJob().getState()).isEqualTo(JobState.ERRORED);
        assertThat(jobStore.get(DOMAIN, outcome.getJob().getId()).block(WAIT).getError()).isEqualTo("nope");
    }

    @Test
    void jobsAreSharedBetweenProcesses() {
        Map<String, AtomicInteger> runs = new ConcurrentHashMap<>();
        JobWorker worker = context -> runs.computeIfAbsent(context.getJobId(), id -> new AtomicInteger()).incrementAndGet();
        RedisJobBroker first = startBroker("log", worker);
        startBroker("log", worker);

        for (int i = 0; i < 20; i++) {
            first.pushJob(request("log", "job " + i)).block(WAIT);
        }

        Await.until(WAIT, () -> runs.size() == 20);
        assertThat(runs.values()).allMatch(count -> count.get() == 1);
    }

    @Test
    void manualJobsGoToThePriorityQueue() {
        RedisJobQueue queue = new RedisJobQueue("sendmail", redisTemplate, jobStore, Duration.ofSeconds(1));

        Job manual = jobStore.create(Job.builder().domain(DOMAIN).workerType("sendmail").manual(true).build()).block(WAIT);
        Job scheduled = jobStore.create(Job.builder().domain(DOMAIN).workerType("sendmail").build()).block(WAIT);
        queue.enqueue(manual).block(WAIT);
        queue.enqueue(scheduled).block(WAIT);

        assertThat(redisTemplate.opsForList().size(RedisJobQueue.priorityQueueKey("sendmail")).block(WAIT)).isEqualTo(1L);
        assertThat(redisTemplate.opsForList().size(RedisJobQueue.queueKey("sendmail")).block(WAIT)).isEqualTo(1L);
        assertThat(queue.size().block(WAIT)).isEqualTo(2L);
    }

    @Test
    void unknownWorkerTypeIsRejected() {
        RedisJobBroker broker = startBroker("log", context -> { });

        StepVerifier.create(broker.pushJob(request("thumbnail", "x")))
            .expectError(UnknownWorkerException.class)
            .verify(WAIT);
    }
}
