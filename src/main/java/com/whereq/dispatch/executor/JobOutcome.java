package com.whereq.dispatch.executor;

import com.whereq.dispatch.model.Job;
import lombok.Value;

/**
 * Terminal result of a job: done, or errored with no retry left
 */
@Value
public class JobOutcome {

    Job job;

    /**
     * Failure of the last attempt, null when the job is done
     */
    Throwable error;

    public boolean isSuccess() {
        return error == null;
    }
}
