package com.whereq.dispatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.dispatch.broker.JobBroker;
import com.whereq.dispatch.broker.MemoryJobBroker;
import com.whereq.dispatch.broker.RedisJobBroker;
import com.whereq.dispatch.executor.JobWorker;
import com.whereq.dispatch.executor.WorkerConfig;
import com.whereq.dispatch.executor.WorkerRegistry;
import com.whereq.dispatch.realtime.MemoryRealtimeHub;
import com.whereq.dispatch.realtime.RealtimeHub;
import com.whereq.dispatch.scheduler.MemoryTriggerScheduler;
import com.whereq.dispatch.scheduler.RedisTriggerScheduler;
import com.whereq.dispatch.scheduler.TriggerScheduler;
import com.whereq.dispatch.service.JobSystem;
import com.whereq.dispatch.store.JobStore;
import com.whereq.dispatch.store.MemoryJobStore;
import com.whereq.dispatch.store.MemoryTriggerStore;
import com.whereq.dispatch.store.RedisJobStore;
import com.whereq.dispatch.store.RedisTriggerStore;
import com.whereq.dispatch.store.TriggerStore;
import com.whereq.dispatch.trigger.TriggerFactory;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

import java.time.Clock;
import java.util.Map;

/**
 * Wires the job system for the configured mode
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Configuration
public class JobSystemConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RealtimeHub realtimeHub() {
        return new MemoryRealtimeHub();
    }

    /**
     * One worker type per {@link JobWorker} bean, named after the bean, with
     * its limits taken from {@code dispatch.workers.<name>}
     */
    @Bean
    public WorkerRegistry workerRegistry(Map<String, JobWorker> workers, DispatchProperties properties) {
        WorkerRegistry.Builder builder = WorkerRegistry.builder();
        workers.forEach((workerType, worker) -> {
            DispatchProperties.WorkerProperties limits = properties.getWorkers()
                .getOrDefault(workerType, new DispatchProperties.WorkerProperties());
            builder.register(WorkerConfig.builder()
                .workerType(workerType)
                .worker(worker)
                .concurrency(limits.getConcurrency())
                .maxExecCount(limits.getMaxExecCount())
                .timeout(limits.getTimeout())
                .retryDelay(limits.getRetryDelay())
                .maxExecTime(limits.getMaxExecTime())
                .build());
        });
        properties.getWorkers().keySet().stream()
            .filter(workerType -> !workers.containsKey(workerType))
            .forEach(workerType -> log.warn("No worker registered for configured worker type {}", workerType));
        return builder.build();
    }

    @Bean
    public TriggerFactory triggerFactory(RealtimeHub realtimeHub, Clock clock, DispatchProperties properties) {
        return new TriggerFactory(realtimeHub, clock, properties.getScheduler().getAtMaxPast());
    }

    @Bean
    public JobSystem jobSystem(JobBroker jobBroker, TriggerScheduler triggerScheduler,
                               WorkerRegistry workerRegistry, DispatchProperties properties) {
        log.info("Creating job system in {} mode", properties.getMode());
        return new JobSystem(jobBroker, triggerScheduler, workerRegistry, properties.getShutdownTimeout());
    }

    @Configuration
    @ConditionalOnProperty(prefix = "dispatch", name = "mode", havingValue = "memory", matchIfMissing = true)
    static class MemoryModeConfig {

        @Bean
        public JobStore jobStore() {
            return new MemoryJobStore();
        }

        @Bean
        public TriggerStore triggerStore() {
            return new MemoryTriggerStore();
        }

        @Bean
        public JobBroker jobBroker(JobStore jobStore, MeterRegistry meterRegistry, Clock clock) {
            return new MemoryJobBroker(jobStore, meterRegistry, clock);
        }

        @Bean
        public TriggerScheduler triggerScheduler(TriggerStore triggerStore, TriggerFactory triggerFactory) {
            return new MemoryTriggerScheduler(triggerStore, triggerFactory);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "dispatch", name = "mode", havingValue = "redis")
    static class RedisModeConfig {

        @Bean
        public JobStore jobStore(ReactiveRedisTemplate<String, String> reactiveRedisTemplate,
                                 ObjectMapper objectMapper) {
            return new RedisJobStore(reactiveRedisTemplate, objectMapper);
        }

        @Bean
        public TriggerStore triggerStore(ReactiveRedisTemplate<String, String> reactiveRedisTemplate,
                                         ObjectMapper objectMapper) {
            return new RedisTriggerStore(reactiveRedisTemplate, objectMapper);
        }

        @Bean
        public JobBroker jobBroker(ReactiveRedisTemplate<String, String> reactiveRedisTemplate, JobStore jobStore,
                                   MeterRegistry meterRegistry, Clock clock, DispatchProperties properties) {
            return new RedisJobBroker(reactiveRedisTemplate, jobStore, meterRegistry, clock,
                properties.getRedis().getBrpopTimeout());
        }

        @Bean
        public TriggerScheduler triggerScheduler(ReactiveRedisTemplate<String, String> reactiveRedisTemplate,
                                                 TriggerStore triggerStore, TriggerFactory triggerFactory,
                                                 RealtimeHub realtimeHub, DispatchProperties properties) {
            DispatchProperties.SchedulerProperties scheduler = properties.getScheduler();
            return new RedisTriggerScheduler(reactiveRedisTemplate, triggerStore, triggerFactory, realtimeHub,
                scheduler.getPollInterval(), scheduler.getClaimStaleness(), scheduler.getEventLoopSize());
        }
    }
}
