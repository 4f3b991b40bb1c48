package io.jobvisor.core;

/**
 * What caused the most recent failure recorded on a {@link JobStatus}.
 */
public enum FailureReason {
    LAUNCH_ERROR,
    NON_ZERO_EXIT,
    PROCESS_EXITED,
    LIVENESS_CHECK,
    RETRY_BUDGET_EXHAUSTED,
    TIMEOUT,
    // in flight when the scheduler process went away
    ABANDONED
}
