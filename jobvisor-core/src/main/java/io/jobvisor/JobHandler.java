package io.jobvisor;

import io.jobvisor.core.JobSpec;
import io.jobvisor.core.LaunchException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Uniform start/stop/health contract shared by programs and tasks.
 *
 * <p>Handlers are registered by {@link #name()} and selected per job through the schedule's
 * {@code handler} field.
 */
public interface JobHandler {
    String name();

    JobProcess start(JobSpec spec) throws LaunchException;

    /**
     * Liveness probe. The default only checks that the process is still running; handlers may add a
     * richer check (a port, an HTTP endpoint). Slow probes are bounded by the supervisor's probe timeout.
     */
    default boolean isAlive(JobSpec spec, JobProcess process) throws Exception {
        return process.isAlive();
    }

    default void stop(JobSpec spec, JobProcess process, Duration grace) {
        process.destroy(grace);
    }

    /**
     * Re-adopt a process recorded before the scheduler restarted, if it is still running.
     * Pids are reused, so an implementation must reject a live pid whose process did not start at
     * {@code startedAt}.
     *
     * @param startedAt when the scheduler launched the process; {@code null} if unknown
     */
    default Optional<JobProcess> attach(JobSpec spec, long pid, Instant startedAt) {
        return Optional.empty();
    }

    /**
     * Handler-specific configuration problems, reported as a {@code ConfigException} at load time.
     */
    default List<String> validate(JobSpec spec) {
        return List.of();
    }
}
