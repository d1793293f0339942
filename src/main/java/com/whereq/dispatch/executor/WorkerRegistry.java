package com.whereq.dispatch.executor;

import com.whereq.dispatch.exception.UnknownWorkerException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of worker types known to a broker
 */
public final class WorkerRegistry {

    private final Map<String, WorkerConfig> configs;

    private WorkerRegistry(Map<String, WorkerConfig> configs) {
        this.configs = Collections.unmodifiableMap(configs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<WorkerConfig> find(String workerType) {
        return Optional.ofNullable(configs.get(workerType));
    }

    /**
     * @throws UnknownWorkerException if the type is not registered
     */
    public WorkerConfig get(String workerType) {
        WorkerConfig config = configs.get(workerType);
        if (config == null) {
            throw new UnknownWorkerException(workerType);
        }
        return config;
    }

    public List<String> workerTypes() {
        return List.copyOf(configs.keySet());
    }

    public Collection<WorkerConfig> configs() {
        return configs.values();
    }

    public static final class Builder {

        private final Map<String, WorkerConfig> configs = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Register a worker type, defaults applied. A later registration of
         * the same type replaces the earlier one.
         */
        public Builder register(WorkerConfig config) {
            configs.put(config.getWorkerType(), config.withDefaults());
            return this;
        }

        public WorkerRegistry build() {
            return new WorkerRegistry(new LinkedHashMap<>(configs));
        }
    }
}
