package com.whereq.dispatch.broker;

import com.whereq.dispatch.executor.WorkerConfig;
import com.whereq.dispatch.queue.JobQueue;
import com.whereq.dispatch.queue.RedisJobQueue;
import com.whereq.dispatch.store.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Multi-process broker: the queues are Redis lists shared by every process
 * running the worker type, each entry popped by exactly one of them
 *
 * @author WhereQ Inc.
 */
public class RedisJobBroker extends AbstractJobBroker {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final Duration brpopTimeout;

    public RedisJobBroker(ReactiveRedisTemplate<String, String> redisTemplate, JobStore jobStore,
                          MeterRegistry meterRegistry, Clock clock, Duration brpopTimeout) {
        super(jobStore, meterRegistry, clock);
        this.redisTemplate = redisTemplate;
        this.brpopTimeout = brpopTimeout;
    }

    @Override
    protected JobQueue createQueue(WorkerConfig config) {
        return new RedisJobQueue(config.getWorkerType(), redisTemplate, jobStore, brpopTimeout);
    }
}
