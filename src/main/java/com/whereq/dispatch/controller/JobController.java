package com.whereq.dispatch.controller;

import com.whereq.dispatch.dto.JobPushRequest;
import com.whereq.dispatch.dto.JobResponse;
import com.whereq.dispatch.dto.QueueLengthResponse;
import com.whereq.dispatch.exception.BrokerClosedException;
import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.exception.UnknownWorkerException;
import com.whereq.dispatch.model.JobRequest;
import com.whereq.dispatch.service.JobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Controller for manual job pushes and job lookups
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@Tag(name = "Jobs", description = "Push jobs and follow their state")
public class JobController {

    @Autowired
    private JobService jobService;

    /**
     * Push a job to the queue of a worker type
     *
     * @param domain owning domain
     * @param workerType worker type
     * @param request message and options of the job
     * @return Mono with 202 Accepted response
     */
    @PostMapping("/{domain}/queue/{workerType}")
    @Operation(summary = "Push a job", description = "Queue a job for the given worker type")
    public Mono<ResponseEntity<JobResponse>> pushJob(
            @PathVariable String domain,
            @PathVariable String workerType,
            @Valid @RequestBody(required = false) JobPushRequest request) {

        log.info("Received manual job for {} on {}", workerType, domain);

        JobRequest jobRequest = JobRequest.builder()
            .workerType(workerType)
            .message(request != null ? request.getMessage() : null)
            .options(request != null ? request.getOptions() : null)
            .manual(true)
            .build();

        return jobService.pushJob(domain, jobRequest)
            .map(job -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/jobs/" + domain + "/" + job.getId()))
                .body(JobResponse.from(job)))
            .onErrorResume(UnknownWorkerException.class, e -> {
                log.error("Unknown worker: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(JobResponse.error(e.getMessage())));
            })
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(JobResponse.error(e.getMessage())));
            })
            .onErrorResume(BrokerClosedException.class, e -> {
                log.error("Broker unavailable: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(JobResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job push", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobResponse.error("Internal server error: " + e.getMessage())));
            });
    }

    /**
     * Get a job
     *
     * @param domain owning domain
     * @param jobId job identifier
     * @return Mono with the job
     */
    @GetMapping("/{domain}/{jobId}")
    @Operation(summary = "Get a job", description = "State and history of a job")
    public Mono<ResponseEntity<JobResponse>> getJob(@PathVariable String domain, @PathVariable String jobId) {
        return jobService.getJobInfos(domain, jobId)
            .map(job -> ResponseEntity.ok(JobResponse.from(job)))
            .onErrorResume(NotFoundException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(JobResponse.error(e.getMessage()))))
            .onErrorResume(Exception.class, e -> {
                log.error("Error fetching job {}/{}", domain, jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobResponse.error("Internal server error: " + e.getMessage())));
            });
    }

    /**
     * Get the number of jobs waiting for a worker type
     */
    @GetMapping("/queue/{workerType}")
    @Operation(summary = "Queue length", description = "Number of jobs waiting for a worker type")
    public Mono<ResponseEntity<QueueLengthResponse>> queueLength(@PathVariable String workerType) {
        return jobService.queueLength(workerType)
            .map(length -> ResponseEntity.ok(QueueLengthResponse.builder()
                .workerType(workerType)
                .length(length)
                .build()))
            .onErrorResume(UnknownWorkerException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(QueueLengthResponse.builder().workerType(workerType).errorMessage(e.getMessage()).build())))
            .onErrorResume(Exception.class, e -> {
                log.error("Error reading queue length of {}", workerType, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(QueueLengthResponse.builder().workerType(workerType).errorMessage(e.getMessage()).build()));
            });
    }
}
