package com.whereq.dispatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Number of jobs waiting for a worker type
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueLengthResponse {
    private String workerType;

    private long length;

    private String errorMessage;
}
