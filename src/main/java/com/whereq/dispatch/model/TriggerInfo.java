package com.whereq.dispatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted configuration of a trigger. {@code domain} and {@code type} never
 * change after creation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TriggerInfo {

    private String id;

    private String revision;

    private String domain;

    private TriggerType type;

    private String workerType;

    /**
     * Type specific: RFC 3339 time for @at, duration for @in and @every, cron
     * expression for @cron, space separated rules for @event
     */
    private String arguments;

    /**
     * Debounce duration, @event only
     */
    private String debounce;

    private JobOptions options;

    private Message message;

    /**
     * Request template sent to the broker each time the trigger fires
     */
    public JobRequest toJobRequest() {
        return JobRequest.builder()
            .domain(domain)
            .workerType(workerType)
            .triggerId(id)
            .message(message)
            .options(options != null ? options.copy() : null)
            .build();
    }

    public JobRequest toJobRequest(Message event) {
        JobRequest request = toJobRequest();
        request.setEvent(event);
        return request;
    }

    public TriggerInfo copy() {
        return toBuilder()
            .message(message != null ? message.copy() : null)
            .options(options != null ? options.copy() : null)
            .build();
    }

    /**
     * Member used in the Redis sorted sets
     */
    public String redisKey() {
        return domain + "/" + id;
    }
}
