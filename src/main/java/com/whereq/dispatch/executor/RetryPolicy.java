package com.whereq.dispatch.executor;

import com.whereq.dispatch.exception.BadTriggerException;
import com.whereq.dispatch.exception.MessageUnmarshalException;
import com.whereq.dispatch.model.JobOptions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Effective execution limits of one job: the worker type limits, tightened by
 * the job options
 */
@Data
@Builder
@AllArgsConstructor
public class RetryPolicy {

    /**
     * Maximum number of attempts
     */
    private int maxExecCount;

    /**
     * Wall-clock ceiling since the job was queued, zero for none
     */
    private Duration maxExecTime;

    /**
     * Ceiling of one attempt
     */
    private Duration timeout;

    /**
     * Delay before the first retry, doubled for each following one
     */
    private Duration retryDelay;

    /**
     * Resolve the policy of a job
     *
     * @param config worker type configuration, defaults already applied
     * @param options job options, may be null
     * @return the effective policy
     */
    public static RetryPolicy of(WorkerConfig config, JobOptions options) {
        RetryPolicy policy = new RetryPolicy(
            config.getMaxExecCount(), config.getMaxExecTime(), config.getTimeout(), config.getRetryDelay());
        if (options == null) {
            return policy;
        }
        if (options.getMaxExecCount() > 0 && options.getMaxExecCount() < policy.maxExecCount) {
            policy.maxExecCount = options.getMaxExecCount();
        }
        if (WorkerConfig.isPositive(options.getTimeout()) && options.getTimeout().compareTo(policy.timeout) < 0) {
            policy.timeout = options.getTimeout();
        }
        if (WorkerConfig.isPositive(options.getMaxExecTime())
            && (policy.maxExecTime.isZero() || options.getMaxExecTime().compareTo(policy.maxExecTime) < 0)) {
            policy.maxExecTime = options.getMaxExecTime();
        }
        return policy;
    }

    /**
     * Decide whether a failed job gets another attempt
     *
     * @param error failure of the last attempt
     * @param attempts attempts made so far
     * @param queuedAt first queue time of the job
     * @param now current time
     * @return true to re-queue the job
     */
    public boolean shouldRetry(Throwable error, int attempts, Instant queuedAt, Instant now) {
        if (error instanceof BadTriggerException || error instanceof MessageUnmarshalException) {
            return false;
        }
        if (attempts >= maxExecCount) {
            return false;
        }
        if (!maxExecTime.isZero() && queuedAt != null) {
            return Duration.between(queuedAt, now).compareTo(maxExecTime) < 0;
        }
        return true;
    }

    /**
     * Exponential backoff with a ±10% fuzz
     *
     * @param attempts attempts made so far, at least 1
     * @return delay before the next attempt
     */
    public Duration calculateBackoff(int attempts) {
        long base = retryDelay.toMillis();
        if (base <= 0) {
            return Duration.ZERO;
        }
        long backoff = base << Math.min(Math.max(attempts - 1, 0), 20);
        long fuzz = backoff / 10;
        if (fuzz > 0) {
            backoff += ThreadLocalRandom.current().nextLong(-fuzz, fuzz + 1);
        }
        return Duration.ofMillis(backoff);
    }
}
