package com.whereq.dispatch.dto;

import com.whereq.dispatch.model.JobOptions;
import com.whereq.dispatch.model.Message;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body of a manual job push
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Job to push to a worker queue")
public class JobPushRequest {
    /**
     * Payload handed to the worker
     */
    @Schema(description = "Free form JSON payload handed to the worker")
    private Message message;

    /**
     * Limits tightening the ones of the worker type
     */
    private JobOptions options;
}
