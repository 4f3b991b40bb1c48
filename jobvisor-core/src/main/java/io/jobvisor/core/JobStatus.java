package io.jobvisor.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time snapshot of a job's runtime record.
 *
 * <p>A new instance is produced on every transition and handed to the {@link StatusStore}; readers
 * never see a partially updated record.
 */
public record JobStatus(
        String name,
        JobKind kind,
        JobState state,
        Long pid,
        Instant lastStartTime,
        Instant lastEndTime,
        Integer lastExitCode,
        int consecutiveFailures,
        Instant nextDueTime,
        Instant lastCheckTime,
        boolean restartDisabled,
        Trigger lastTrigger,
        FailureReason failureReason,
        String lastError,
        Instant updatedAt
) {
    public JobStatus {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }

    public static JobStatus idle(String name, JobKind kind, Instant at) {
        return new JobStatus(name, kind, JobState.IDLE, null, null, null, null, 0,
                null, null, false, null, null, null, at);
    }
}
