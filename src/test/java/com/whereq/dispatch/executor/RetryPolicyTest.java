package com.whereq.dispatch.executor;

import com.whereq.dispatch.exception.BadTriggerException;
import com.whereq.dispatch.exception.JobTimedOutException;
import com.whereq.dispatch.exception.MessageUnmarshalException;
import com.whereq.dispatch.model.JobOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    private static final JobWorker NOOP = context -> { };

    private static WorkerConfig config() {
        return WorkerConfig.builder()
            .workerType("thumbnail")
            .maxExecCount(5)
            .timeout(Duration.ofSeconds(30))
            .maxExecTime(Duration.ofMinutes(10))
            .retryDelay(Duration.ofMillis(100))
            .worker(NOOP)
            .build()
            .withDefaults();
    }

    @Test
    void workerDefaultsApplyWithoutOptions() {
        RetryPolicy policy = RetryPolicy.of(config(), null);

        assertThat(policy.getMaxExecCount()).isEqualTo(5);
        assertThat(policy.getTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.getMaxExecTime()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void optionsCanOnlyTightenTheLimits() {
        JobOptions tighter = JobOptions.builder()
            .maxExecCount(2)
            .timeout(Duration.ofSeconds(5))
            .maxExecTime(Duration.ofMinutes(1))
            .build();
        JobOptions looser = JobOptions.builder()
            .maxExecCount(50)
            .timeout(Duration.ofHours(1))
            .maxExecTime(Duration.ofHours(1))
            .build();

        RetryPolicy tightened = RetryPolicy.of(config(), tighter);
        RetryPolicy unchanged = RetryPolicy.of(config(), looser);

        assertThat(tightened.getMaxExecCount()).isEqualTo(2);
        assertThat(tightened.getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(tightened.getMaxExecTime()).isEqualTo(Duration.ofMinutes(1));
        assertThat(unchanged.getMaxExecCount()).isEqualTo(5);
        assertThat(unchanged.getTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(unchanged.getMaxExecTime()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void defaultsGiveASingleAttempt() {
        WorkerConfig config = WorkerConfig.builder().workerType("log").worker(NOOP).build().withDefaults();

        assertThat(config.getMaxExecCount()).isEqualTo(WorkerConfig.DEFAULT_MAX_EXEC_COUNT);
        assertThat(config.getTimeout()).isEqualTo(WorkerConfig.DEFAULT_TIMEOUT);
        assertThat(config.getRetryDelay()).isEqualTo(WorkerConfig.DEFAULT_RETRY_DELAY);
        assertThat(config.getConcurrency()).isPositive();
    }

    @Test
    void retriesStopAtTheAttemptBudget() {
        RetryPolicy policy = RetryPolicy.of(config(), null);
        Instant now = Instant.now();
        RuntimeException error = new IllegalStateException("boom");

        assertThat(policy.shouldRetry(error, 1, now, now)).isTrue();
        assertThat(policy.shouldRetry(error, 4, now, now)).isTrue();
        assertThat(policy.shouldRetry(error, 5, now, now)).isFalse();
    }

    @Test
    void retriesStopPastTheExecutionWindow() {
        RetryPolicy policy = RetryPolicy.of(config(), null);
        Instant queuedAt = Instant.parse("2024-03-01T10:00:00Z");

        assertThat(policy.shouldRetry(new JobTimedOutException(Duration.ofSeconds(30)), 1,
            queuedAt, queuedAt.plus(Duration.ofMinutes(5)))).isTrue();
        assertThat(policy.shouldRetry(new JobTimedOutException(Duration.ofSeconds(30)), 1,
            queuedAt, queuedAt.plus(Duration.ofMinutes(11)))).isFalse();
    }

    @Test
    void permanentErrorsAreNotRetried() {
        RetryPolicy policy = RetryPolicy.of(config(), null);
        Instant now = Instant.now();

        assertThat(policy.shouldRetry(new BadTriggerException("gone"), 1, now, now)).isFalse();
        assertThat(policy.shouldRetry(new MessageUnmarshalException("bad"), 1, now, now)).isFalse();
    }

    @Test
    void backoffDoublesWithFuzz() {
        RetryPolicy policy = RetryPolicy.of(config(), null);

        for (int i = 0; i < 20; i++) {
            assertThat(policy.calculateBackoff(1).toMillis()).isBetween(90L, 110L);
            assertThat(policy.calculateBackoff(3).toMillis()).isBetween(360L, 440L);
        }
    }
}
