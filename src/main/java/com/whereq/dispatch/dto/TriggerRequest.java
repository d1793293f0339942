package com.whereq.dispatch.dto;

import com.whereq.dispatch.model.JobOptions;
import com.whereq.dispatch.model.Message;
import com.whereq.dispatch.model.TriggerInfo;
import com.whereq.dispatch.model.TriggerType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body of a trigger creation
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerRequest {
    /**
     * One of @at, @in, @cron, @every, @event
     */
    @NotBlank
    @Schema(description = "Trigger type", example = "@every")
    private String type;

    @NotBlank
    @Schema(description = "Worker type of the produced jobs", example = "log")
    private String workerType;

    @Schema(description = "Type specific arguments", example = "1h")
    private String arguments;

    /**
     * Debounce duration, @event only
     */
    private String debounce;

    private JobOptions options;

    private Message message;

    public TriggerInfo toTriggerInfo() {
        return TriggerInfo.builder()
            .type(TriggerType.fromTag(type))
            .workerType(workerType)
            .arguments(arguments)
            .debounce(debounce)
            .options(options)
            .message(message)
            .build();
    }
}
