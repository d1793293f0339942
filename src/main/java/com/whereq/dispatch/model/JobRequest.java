package com.whereq.dispatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input of a job push. Consumed to build a {@link Job}, never persisted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobRequest {

    private String domain;

    private String workerType;

    private String triggerId;

    private Message message;

    private Message event;

    private boolean manual;

    /**
     * The request already went through a debounce window
     */
    private boolean debounced;

    private JobOptions options;
}
