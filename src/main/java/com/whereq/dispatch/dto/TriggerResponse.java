package com.whereq.dispatch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.dispatch.model.JobOptions;
import com.whereq.dispatch.model.Message;
import com.whereq.dispatch.model.TriggerInfo;
import com.whereq.dispatch.trigger.Trigger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Trigger as returned by the REST API
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TriggerResponse {
    private String triggerId;

    private String domain;

    private String type;

    private String workerType;

    private String arguments;

    private String debounce;

    private JobOptions options;

    private Message message;

    private String errorMessage;

    public static TriggerResponse from(Trigger trigger) {
        TriggerInfo info = trigger.getInfo();
        return TriggerResponse.builder()
            .triggerId(info.getId())
            .domain(info.getDomain())
            .type(info.getType().getTag())
            .workerType(info.getWorkerType())
            .arguments(info.getArguments())
            .debounce(info.getDebounce())
            .options(info.getOptions())
            .message(info.getMessage())
            .build();
    }

    /**
     * Create error response
     */
    public static TriggerResponse error(String message) {
        return TriggerResponse.builder()
            .errorMessage(message)
            .build();
    }
}
