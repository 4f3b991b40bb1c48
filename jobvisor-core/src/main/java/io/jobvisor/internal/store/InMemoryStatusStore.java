package io.jobvisor.internal.store;

import io.jobvisor.core.JobStatus;
import io.jobvisor.core.StatusStore;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable store; statuses are lost with the scheduler process.
 */
public class InMemoryStatusStore implements StatusStore {
    private final ConcurrentHashMap<String, JobStatus> statuses = new ConcurrentHashMap<>();

    @Override
    public void write(JobStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        statuses.put(status.name(), status);
    }

    @Override
    public Optional<JobStatus> read(String name) {
        return Optional.ofNullable(statuses.get(name));
    }

    @Override
    public Map<String, JobStatus> readAll() {
        return Map.copyOf(statuses);
    }

    @Override
    public void delete(String name) {
        statuses.remove(name);
    }
}
