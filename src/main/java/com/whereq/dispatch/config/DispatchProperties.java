package com.whereq.dispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for WhereQ Dispatch.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "dispatch")
@Data
public class DispatchProperties {

    /**
     * Broker, scheduler and storage implementation.
     */
    private Mode mode = Mode.MEMORY;

    /**
     * Deadline given to the running jobs and triggers on shutdown.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /**
     * Limits per worker type, keyed by worker type. Unset values fall back to
     * the worker defaults.
     */
    private Map<String, WorkerProperties> workers = new LinkedHashMap<>();

    private SchedulerProperties scheduler = new SchedulerProperties();

    private RedisProperties redis = new RedisProperties();

    @Data
    public static class WorkerProperties {
        /**
         * Number of parallel executors, 0 for the number of CPUs.
         */
        private int concurrency;

        /**
         * Maximum number of attempts per job.
         */
        private int maxExecCount;

        /**
         * Ceiling of one attempt.
         */
        private Duration timeout;

        /**
         * Delay before the first retry, doubled for each following one.
         */
        private Duration retryDelay;

        /**
         * Wall-clock ceiling across all attempts, 0 for none.
         */
        private Duration maxExecTime;
    }

    @Data
    public static class SchedulerProperties {
        /**
         * Interval between two polls of the Redis trigger index.
         */
        private Duration pollInterval = Duration.ofSeconds(1);

        /**
         * Number of realtime events matched in parallel by the Redis scheduler.
         */
        private int eventLoopSize = 50;

        /**
         * An @at trigger older than this never fires.
         */
        private Duration atMaxPast = Duration.ofHours(24);

        /**
         * A claimed trigger not released after this long is claimed again.
         */
        private Duration claimStaleness = Duration.ofSeconds(10);
    }

    @Data
    public static class RedisProperties {
        /**
         * Blocking pop timeout, bounds how long a stopping worker pool waits.
         */
        private Duration brpopTimeout = Duration.ofSeconds(10);
    }

    public enum Mode {
        /**
         * Single process, nothing survives a restart but the stores.
         */
        MEMORY,

        /**
         * Queues and trigger index shared through Redis by every process.
         */
        REDIS
    }
}
