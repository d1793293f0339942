package com.whereq.dispatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One unit of work and its lifecycle state
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {

    /**
     * Storage identifier, assigned on create
     */
    private String id;

    /**
     * Storage revision, bumped on every update
     */
    private String revision;

    /**
     * Tenant owning the job
     */
    private String domain;

    private String workerType;

    /**
     * Trigger that produced the job, if any
     */
    private String triggerId;

    private Message message;

    /**
     * Realtime event that fired the job, only set for event triggers
     */
    private Message event;

    /**
     * Launched by hand rather than by a trigger
     */
    private boolean manual;

    private boolean debounced;

    private JobOptions options;

    private JobState state;

    private Instant queuedAt;

    private Instant startedAt;

    private Instant finishedAt;

    /**
     * Error of the last attempt, set only in ERRORED
     */
    private String error;

    /**
     * Number of attempts already made
     */
    private int tryCount;

    /**
     * Build a queued job from a request
     */
    public static Job fromRequest(JobRequest request, Instant now) {
        return Job.builder()
            .domain(request.getDomain())
            .workerType(request.getWorkerType())
            .triggerId(request.getTriggerId())
            .message(request.getMessage() != null ? request.getMessage().copy() : null)
            .event(request.getEvent() != null ? request.getEvent().copy() : null)
            .manual(request.isManual())
            .debounced(request.isDebounced())
            .options(request.getOptions() != null ? request.getOptions().copy() : null)
            .state(JobState.QUEUED)
            .queuedAt(now)
            .build();
    }

    /**
     * Deep copy, payloads included
     */
    public Job copy() {
        return toBuilder()
            .message(message != null ? message.copy() : null)
            .event(event != null ? event.copy() : null)
            .options(options != null ? options.copy() : null)
            .build();
    }

    /**
     * Reference pushed into the Redis queues
     */
    public String queueReference() {
        return domain + "/" + id;
    }
}
