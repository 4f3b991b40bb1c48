package io.jobvisor.core;

import java.util.Map;
import java.util.Optional;

/**
 * Durable record of every job's latest {@link JobStatus}.
 *
 * <p>Implementations must make {@link #write} atomic from the point of view of concurrent readers:
 * a reader sees either the previous snapshot or the new one, never a mix.
 */
public interface StatusStore {

    void write(JobStatus status);

    Optional<JobStatus> read(String name);

    /**
     * Point-in-time copy of every stored status, keyed by job name.
     */
    Map<String, JobStatus> readAll();

    void delete(String name);
}
