package com.whereq.dispatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Per-job execution limits. They can only tighten the limits of the worker
 * type the job is pushed to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobOptions {

    /**
     * Maximum number of attempts, 0 for the worker default
     */
    private int maxExecCount;

    /**
     * Wall-clock ceiling across all attempts, counted from the queue time
     */
    private Duration maxExecTime;

    /**
     * Ceiling of a single attempt
     */
    private Duration timeout;

    public JobOptions copy() {
        return new JobOptions(maxExecCount, maxExecTime, timeout);
    }
}
