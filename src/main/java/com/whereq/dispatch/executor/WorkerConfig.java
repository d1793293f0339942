package com.whereq.dispatch.executor;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;

/**
 * Static registration of a worker type. Set once at startup and shared, read
 * only, by every executor of the type.
 */
@Value
@Builder(toBuilder = true)
public class WorkerConfig {

    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(60);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_EXEC_COUNT = 1;

    @NonNull
    String workerType;

    /**
     * Number of parallel executors, 0 for the number of CPUs
     */
    int concurrency;

    /**
     * Retry budget, 0 for a single attempt
     */
    int maxExecCount;

    /**
     * Wall-clock ceiling across all attempts, null or zero for no ceiling
     */
    Duration maxExecTime;

    Duration timeout;

    Duration retryDelay;

    @NonNull
    JobWorker worker;

    /**
     * Copy with every unset limit replaced by its default
     */
    public WorkerConfig withDefaults() {
        return toBuilder()
            .concurrency(concurrency > 0 ? concurrency : Runtime.getRuntime().availableProcessors())
            .maxExecCount(maxExecCount > 0 ? maxExecCount : DEFAULT_MAX_EXEC_COUNT)
            .timeout(isPositive(timeout) ? timeout : DEFAULT_TIMEOUT)
            .retryDelay(retryDelay != null && !retryDelay.isNegative() ? retryDelay : DEFAULT_RETRY_DELAY)
            .maxExecTime(isPositive(maxExecTime) ? maxExecTime : Duration.ZERO)
            .build();
    }

    static boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }
}
