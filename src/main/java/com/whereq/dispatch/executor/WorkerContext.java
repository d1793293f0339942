package com.whereq.dispatch.executor;

import com.whereq.dispatch.exception.MessageUnmarshalException;
import com.whereq.dispatch.model.Job;
import com.whereq.dispatch.model.JobOptions;
import com.whereq.dispatch.model.Message;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * What a worker sees of the job it runs
 */
public class WorkerContext {

    private final String workerId;
    private final Job job;
    private final Instant deadline;
    private volatile boolean noRetry;

    public WorkerContext(String workerId, Job job, Instant deadline) {
        this.workerId = workerId;
        this.job = job.copy();
        this.deadline = deadline;
    }

    /**
     * Identifier of this attempt, {@code <workerType>/<slot>/<jobId>}
     */
    public String getId() {
        return workerId;
    }

    public String getDomain() {
        return job.getDomain();
    }

    public String getJobId() {
        return job.getId();
    }

    public String getWorkerType() {
        return job.getWorkerType();
    }

    public Optional<String> getTriggerId() {
        return Optional.ofNullable(job.getTriggerId());
    }

    public boolean isManual() {
        return job.isManual();
    }

    public boolean isDebounced() {
        return job.isDebounced();
    }

    /**
     * Attempt number, starting at 1
     */
    public int getAttempt() {
        return job.getTryCount();
    }

    public JobOptions getOptions() {
        return job.getOptions() != null ? job.getOptions().copy() : null;
    }

    public Instant getDeadline() {
        return deadline;
    }

    /**
     * Time left before the attempt times out
     */
    public Duration remaining() {
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Cooperative cancellation check for long running workers
     */
    public boolean isTimedOut() {
        return !Instant.now().isBefore(deadline);
    }

    /**
     * Raw message of the job, null when it has none
     */
    public Message getMessage() {
        return job.getMessage() != null ? job.getMessage().copy() : null;
    }

    public <T> T unmarshalMessage(Class<T> type) {
        return unmarshal(job.getMessage(), type, "message");
    }

    /**
     * Decode the realtime event that fired the job
     *
     * @throws MessageUnmarshalException if the job was not fired by an event
     */
    public <T> T unmarshalEvent(Class<T> type) {
        return unmarshal(job.getEvent(), type, "event");
    }

    /**
     * Make the current failure final, whatever the retry budget left
     */
    public void setNoRetry() {
        this.noRetry = true;
    }

    public boolean isNoRetry() {
        return noRetry;
    }

    private static <T> T unmarshal(Message message, Class<T> type, String what) {
        if (message == null) {
            throw new MessageUnmarshalException("Job has no " + what);
        }
        return message.unmarshal(type);
    }
}
