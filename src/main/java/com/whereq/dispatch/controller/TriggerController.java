package com.whereq.dispatch.controller;

import com.whereq.dispatch.dto.CronUpdateRequest;
import com.whereq.dispatch.dto.JobResponse;
import com.whereq.dispatch.dto.TriggerRequest;
import com.whereq.dispatch.dto.TriggerResponse;
import com.whereq.dispatch.exception.MalformedTriggerException;
import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.exception.UnknownTriggerException;
import com.whereq.dispatch.model.TriggerState;
import com.whereq.dispatch.service.JobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * Controller for the triggers of a domain
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs/{domain}/triggers")
@Tag(name = "Triggers", description = "Schedule jobs on a clock or on realtime events")
public class TriggerController {

    @Autowired
    private JobService jobService;

    @PostMapping
    @Operation(summary = "Create a trigger")
    public Mono<ResponseEntity<TriggerResponse>> addTrigger(
            @PathVariable String domain,
            @Valid @RequestBody TriggerRequest request) {

        log.info("Received {} trigger for {} on {}", request.getType(), request.getWorkerType(), domain);

        return Mono.fromCallable(request::toTriggerInfo)
            .flatMap(info -> jobService.addTrigger(domain, info))
            .map(trigger -> ResponseEntity
                .created(URI.create("/api/v1/jobs/" + domain + "/triggers/" + trigger.getId()))
                .body(TriggerResponse.from(trigger)))
            .onErrorResume(e -> e instanceof MalformedTriggerException
                    || e instanceof UnknownTriggerException
                    || e instanceof IllegalArgumentException,
                e -> {
                    log.error("Invalid trigger: {}", e.getMessage());
                    return Mono.just(ResponseEntity
                        .badRequest()
                        .body(TriggerResponse.error(e.getMessage())));
                })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during trigger creation", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(TriggerResponse.error("Internal server error: " + e.getMessage())));
            });
    }

    @GetMapping
    @Operation(summary = "List the triggers of a domain")
    public Mono<ResponseEntity<List<TriggerResponse>>> getAllTriggers(@PathVariable String domain) {
        return jobService.getAllTriggers(domain)
            .map(TriggerResponse::from)
            .collectList()
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{triggerId}")
    @Operation(summary = "Get a trigger")
    public Mono<ResponseEntity<TriggerResponse>> getTrigger(
            @PathVariable String domain,
            @PathVariable String triggerId) {
        return jobService.getTrigger(domain, triggerId)
            .map(trigger -> ResponseEntity.ok(TriggerResponse.from(trigger)))
            .onErrorResume(NotFoundException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(TriggerResponse.error(e.getMessage()))));
    }

    @DeleteMapping("/{triggerId}")
    @Operation(summary = "Delete a trigger", description = "Unschedule the trigger and remove it")
    public Mono<ResponseEntity<Void>> deleteTrigger(
            @PathVariable String domain,
            @PathVariable String triggerId) {
        return jobService.deleteTrigger(domain, triggerId)
            .then(Mono.just(ResponseEntity.noContent().<Void>build()))
            .onErrorResume(NotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()));
    }

    /**
     * Change the schedule of a @cron trigger
     */
    @PatchMapping("/{triggerId}")
    @Operation(summary = "Update a cron trigger", description = "Reschedule a @cron trigger with a new expression")
    public Mono<ResponseEntity<TriggerResponse>> updateCron(
            @PathVariable String domain,
            @PathVariable String triggerId,
            @Valid @RequestBody CronUpdateRequest request) {
        return jobService.updateCron(domain, triggerId, request.getArguments())
            .map(trigger -> ResponseEntity.ok(TriggerResponse.from(trigger)))
            .onErrorResume(NotFoundException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(TriggerResponse.error(e.getMessage()))))
            .onErrorResume(MalformedTriggerException.class, e -> Mono.just(ResponseEntity
                .badRequest()
                .body(TriggerResponse.error(e.getMessage()))));
    }

    @GetMapping("/{triggerId}/jobs")
    @Operation(summary = "Jobs of a trigger", description = "Most recent jobs launched by the trigger, newest first")
    public Mono<ResponseEntity<List<JobResponse>>> getJobs(
            @PathVariable String domain,
            @PathVariable String triggerId,
            @RequestParam(defaultValue = "50") int limit) {
        return jobService.getJobsForTrigger(domain, triggerId, limit)
            .map(JobResponse::from)
            .collectList()
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{triggerId}/state")
    @Operation(summary = "State of a trigger", description = "Last success, failure and execution of the trigger")
    public Mono<ResponseEntity<TriggerState>> getState(
            @PathVariable String domain,
            @PathVariable String triggerId) {
        return jobService.getTrigger(domain, triggerId)
            .then(jobService.getTriggerState(domain, triggerId))
            .map(ResponseEntity::ok)
            .onErrorResume(NotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()));
    }
}
