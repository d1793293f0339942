package com.whereq.dispatch.service;

import com.whereq.dispatch.broker.JobBroker;
import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.executor.JobOutcome;
import com.whereq.dispatch.model.Job;
import com.whereq.dispatch.model.JobRequest;
import com.whereq.dispatch.model.JobState;
import com.whereq.dispatch.model.TriggerInfo;
import com.whereq.dispatch.model.TriggerState;
import com.whereq.dispatch.scheduler.TriggerScheduler;
import com.whereq.dispatch.store.JobStore;
import com.whereq.dispatch.trigger.Trigger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Domain scoped entry point to jobs and triggers
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class JobService {

    public static final int MAX_TRIGGER_JOBS = 50;

    private final JobBroker broker;
    private final TriggerScheduler scheduler;
    private final JobStore jobStore;

    public JobService(JobSystem jobSystem, JobStore jobStore) {
        this.broker = jobSystem.getBroker();
        this.scheduler = jobSystem.getScheduler();
        this.jobStore = jobStore;
    }

    /**
     * Push a job on behalf of a domain
     *
     * @param domain calling domain, overrides the one of the request
     * @param request job request
     * @return the queued job
     */
    public Mono<Job> pushJob(String domain, JobRequest request) {
        JobRequest scoped = request.toBuilder().domain(domain).build();
        log.info("Pushing {} job for {}", scoped.getWorkerType(), domain);
        return broker.pushJob(scoped);
    }

    /**
     * Push a job and wait for it to finish
     */
    public Mono<JobOutcome> pushJobAndAwait(String domain, JobRequest request) {
        return broker.pushJobAndAwait(request.toBuilder().domain(domain).build());
    }

    public Mono<Long> queueLength(String workerType) {
        return broker.queueLength(workerType);
    }

    public List<String> workerTypes() {
        return broker.workerTypes();
    }

    /**
     * Fetch a job. A job of another domain is reported as not found.
     */
    public Mono<Job> getJobInfos(String domain, String id) {
        return jobStore.get(domain, id)
            .filter(job -> domain.equals(job.getDomain()))
            .switchIfEmpty(Mono.error(NotFoundException.job(domain, id)));
    }

    public Mono<Trigger> addTrigger(String domain, TriggerInfo info) {
        TriggerInfo scoped = info.toBuilder().id(null).revision(null).domain(domain).build();
        return scheduler.addTrigger(scoped)
            .doOnNext(trigger -> log.info("Added trigger {}", trigger));
    }

    public Mono<Trigger> getTrigger(String domain, String id) {
        return scheduler.getTrigger(domain, id);
    }

    public Flux<Trigger> getAllTriggers(String domain) {
        return scheduler.getAllTriggers(domain);
    }

    public Mono<Void> deleteTrigger(String domain, String id) {
        return scheduler.deleteTrigger(domain, id)
            .doOnSuccess(unused -> log.info("Deleted trigger {}/{}", domain, id));
    }

    public Mono<Trigger> updateCron(String domain, String id, String arguments) {
        return scheduler.updateCron(domain, id, arguments);
    }

    /**
     * Jobs launched by a trigger, newest first
     *
     * @param limit clamped to 1..50, 50 when out of range
     */
    public Flux<Job> getJobsForTrigger(String domain, String triggerId, int limit) {
        int clamped = limit <= 0 || limit > MAX_TRIGGER_JOBS ? MAX_TRIGGER_JOBS : limit;
        return jobStore.findByTrigger(domain, triggerId, clamped);
    }

    /**
     * Summarise the last jobs of a trigger
     */
    public Mono<TriggerState> getTriggerState(String domain, String triggerId) {
        return getJobsForTrigger(domain, triggerId, MAX_TRIGGER_JOBS)
            .collectList()
            .map(jobs -> {
                TriggerState state = TriggerState.builder()
                    .triggerId(triggerId)
                    .status(JobState.DONE)
                    .build();
                // jobs come newest first, replay them oldest first
                for (int i = jobs.size() - 1; i >= 0; i--) {
                    Job job = jobs.get(i);
                    state.setStatus(job.getState());
                    state.setLastExecution(job.getStartedAt());
                    state.setLastExecutedJobId(job.getId());
                    if (job.isManual()) {
                        state.setLastManualExecution(job.getStartedAt());
                        state.setLastManualJobId(job.getId());
                    }
                    if (job.getState() == JobState.ERRORED) {
                        state.setLastFailure(job.getStartedAt());
                        state.setLastFailedJobId(job.getId());
                        state.setLastError(job.getError());
                    } else if (job.getState() == JobState.DONE) {
                        state.setLastSuccess(job.getStartedAt());
                        state.setLastSuccessfulJobId(job.getId());
                    }
                }
                return state;
            });
    }
}
