package com.whereq.dispatch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.dispatch.model.Job;
import com.whereq.dispatch.model.JobState;
import com.whereq.dispatch.model.Message;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Job as returned by the REST API
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobResponse {
    private String jobId;

    private String domain;

    private String workerType;

    /**
     * Trigger that launched the job, if any
     */
    private String triggerId;

    private JobState state;

    private Message message;

    private Message event;

    private boolean manual;

    private Instant queuedAt;

    private Instant startedAt;

    private Instant finishedAt;

    /**
     * Number of attempts made
     */
    private int tryCount;

    /**
     * Error of the last attempt (if errored)
     */
    private String error;

    /**
     * Error message (if the request failed)
     */
    private String errorMessage;

    public static JobResponse from(Job job) {
        return JobResponse.builder()
            .jobId(job.getId())
            .domain(job.getDomain())
            .workerType(job.getWorkerType())
            .triggerId(job.getTriggerId())
            .state(job.getState())
            .message(job.getMessage())
            .event(job.getEvent())
            .manual(job.isManual())
            .queuedAt(job.getQueuedAt())
            .startedAt(job.getStartedAt())
            .finishedAt(job.getFinishedAt())
            .tryCount(job.getTryCount())
            .error(job.getError())
            .build();
    }

    /**
     * Create error response
     */
    public static JobResponse error(String message) {
        return JobResponse.builder()
            .errorMessage(message)
            .build();
    }
}
