package com.whereq.dispatch.queue;

import com.whereq.dispatch.model.Job;
import com.whereq.dispatch.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.ReactiveListCommands;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Redis list queue shared by every process of a deployment. The lists hold
 * {@code <domain>/<jobId>} references; the job itself is read back from the
 * job store once popped. Manually launched jobs go to a separate list that is
 * polled first most of the time.
 */
@Slf4j
public class RedisJobQueue implements JobQueue {

    private static final String QUEUE_KEY_PREFIX = "j/";
    private static final String PRIORITY_SUFFIX = "/p0";
    private static final Duration ERROR_PAUSE = Duration.ofMillis(100);

    private final String workerType;
    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final JobStore jobStore;
    private final Duration brpopTimeout;
    private final AtomicBoolean running = new AtomicBoolean(true);

    public RedisJobQueue(String workerType, ReactiveRedisTemplate<String, String> redisTemplate,
                         JobStore jobStore, Duration brpopTimeout) {
        this.workerType = workerType;
        this.redisTemplate = redisTemplate;
        this.jobStore = jobStore;
        this.brpopTimeout = brpopTimeout;
    }

    public static String queueKey(String workerType) {
        return QUEUE_KEY_PREFIX + workerType;
    }

    public static String priorityQueueKey(String workerType) {
        return QUEUE_KEY_PREFIX + workerType + PRIORITY_SUFFIX;
    }

    @Override
    public String getWorkerType() {
        return workerType;
    }

    @Override
    public Mono<Void> enqueue(Job job) {
        String key = job.isManual() ? priorityQueueKey(workerType) : queueKey(workerType);
        return redisTemplate.opsForList()
            .leftPush(key, job.queueReference())
            .doOnSuccess(size -> log.debug("Enqueued job {} on {}, queue size: {}",
                job.queueReference(), key, size))
            .then();
    }

    @Override
    public Flux<Job> consumeAsFlux() {
        return Mono.defer(this::pop)
            .flatMap(this::resolve)
            .onErrorResume(e -> {
                log.error("Error polling queue {}: {}", workerType, e.getMessage());
                return Mono.delay(ERROR_PAUSE).then(Mono.empty());
            })
            .repeat(running::get);
    }

    @Override
    public Mono<Long> size() {
        return Flux.just(priorityQueueKey(workerType), queueKey(workerType))
            .flatMap(key -> redisTemplate.opsForList().size(key).defaultIfEmpty(0L))
            .reduce(0L, Long::sum);
    }

    @Override
    public void close() {
        running.set(false);
    }

    private Mono<String> pop() {
        if (!running.get()) {
            return Mono.empty();
        }
        List<ByteBuffer> keys = ThreadLocalRandom.current().nextInt(3) == 0
            ? List.of(encode(queueKey(workerType)), encode(priorityQueueKey(workerType)))
            : List.of(encode(priorityQueueKey(workerType)), encode(queueKey(workerType)));
        return redisTemplate
            .execute(connection -> connection.listCommands().brPop(keys, brpopTimeout))
            .next()
            .map(ReactiveListCommands.PopResult::getValue)
            .map(RedisJobQueue::decode);
    }

    private Mono<Job> resolve(String reference) {
        int slash = reference.lastIndexOf('/');
        if (slash <= 0 || slash == reference.length() - 1) {
            log.warn("Invalid queue entry {} on {}", reference, workerType);
            return Mono.empty();
        }
        String domain = reference.substring(0, slash);
        String jobId = reference.substring(slash + 1);
        return jobStore.get(domain, jobId)
            .onErrorResume(e -> {
                log.warn("Cannot find job {} popped from {}: {}", reference, workerType, e.getMessage());
                return Mono.empty();
            });
    }

    private static ByteBuffer encode(String value) {
        return ByteBuffer.wrap(value.getBytes(StandardCharsets.UTF_8));
    }

    private static String decode(ByteBuffer buffer) {
        return StandardCharsets.UTF_8.decode(buffer.duplicate()).toString();
    }
}
