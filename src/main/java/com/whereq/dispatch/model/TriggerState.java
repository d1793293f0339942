package com.whereq.dispatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Summary of the recent executions of a trigger, computed from its last jobs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerState {

    private String triggerId;

    /**
     * State of the most recent job, DONE when the trigger never ran
     */
    private JobState status;

    private Instant lastSuccess;

    private String lastSuccessfulJobId;

    private Instant lastExecution;

    private String lastExecutedJobId;

    private Instant lastFailure;

    private String lastFailedJobId;

    private String lastError;

    private Instant lastManualExecution;

    private String lastManualJobId;
}
