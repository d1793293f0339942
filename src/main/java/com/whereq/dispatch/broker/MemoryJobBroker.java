package com.whereq.dispatch.broker;

import com.whereq.dispatch.executor.WorkerConfig;
import com.whereq.dispatch.queue.JobQueue;
import com.whereq.dispatch.queue.MemoryJobQueue;
import com.whereq.dispatch.store.JobStore;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Clock;

/**
 * Single process broker: one in-memory FIFO per worker type. Queued jobs do
 * not survive a restart.
 *
 * @author WhereQ Inc.
 */
public class MemoryJobBroker extends AbstractJobBroker {

    public MemoryJobBroker(JobStore jobStore, MeterRegistry meterRegistry, Clock clock) {
        super(jobStore, meterRegistry, clock);
    }

    @Override
    protected JobQueue createQueue(WorkerConfig config) {
        return new MemoryJobQueue(config.getWorkerType());
    }
}
