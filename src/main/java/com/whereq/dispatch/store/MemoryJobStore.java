package com.whereq.dispatch.store;

import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.model.Job;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job store keeping deep copies of the records in memory
 */
public class MemoryJobStore implements JobStore {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public Mono<Job> get(String domain, String id) {
        return Mono.defer(() -> {
            Job job = jobs.get(key(domain, id));
            if (job == null) {
                return Mono.error(NotFoundException.job(domain, id));
            }
            return Mono.just(job.copy());
        });
    }

    @Override
    public Mono<Job> create(Job job) {
        return Mono.fromCallable(() -> {
            Job created = job.copy();
            created.setId(Identifiers.newId());
            created.setRevision(Identifiers.nextRevision(null));
            jobs.put(key(created.getDomain(), created.getId()), created);
            return created.copy();
        });
    }

    @Override
    public Mono<Job> update(Job job) {
        return Mono.defer(() -> {
            String key = key(job.getDomain(), job.getId());
            Job updated = job.copy();
            updated.setRevision(Identifiers.nextRevision(job.getRevision()));
            if (jobs.computeIfPresent(key, (k, previous) -> updated) == null) {
                return Mono.error(NotFoundException.job(job.getDomain(), job.getId()));
            }
            job.setRevision(updated.getRevision());
            return Mono.just(updated.copy());
        });
    }

    @Override
    public Flux<Job> findByTrigger(String domain, String triggerId, int limit) {
        return Flux.defer(() -> Flux.fromStream(jobs.values().stream()
            .filter(job -> domain.equals(job.getDomain()) && triggerId.equals(job.getTriggerId()))
            .sorted(Comparator.comparing(Job::getQueuedAt).reversed())
            .limit(limit)
            .map(Job::copy)));
    }

    /**
     * Number of stored jobs, all domains included
     */
    public int size() {
        return jobs.size();
    }

    private static String key(String domain, String id) {
        return domain + "/" + id;
    }
}
