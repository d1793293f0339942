package com.whereq.dispatch.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.dispatch.executor.JobWorker;
import com.whereq.dispatch.executor.WorkerContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Worker writing the message of its jobs to the log
 */
@Slf4j
@Component(LogWorker.WORKER_TYPE)
public class LogWorker implements JobWorker {

    public static final String WORKER_TYPE = "log";

    @Override
    public void execute(WorkerContext context) {
        if (context.getMessage() == null) {
            log.info("[{}] {}: (no message)", context.getDomain(), context.getId());
            return;
        }
        JsonNode message = context.unmarshalMessage(JsonNode.class);
        log.info("[{}] {}: {}", context.getDomain(), context.getId(), message);
    }
}
