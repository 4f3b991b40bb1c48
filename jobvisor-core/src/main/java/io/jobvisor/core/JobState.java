package io.jobvisor.core;

/**
 * Lifecycle state recorded in {@link JobStatus}.
 *
 * <p>Programs move {@code IDLE -> RUNNING -> (RESTARTING -> RUNNING)* -> FAILED | STOPPED}.
 * Tasks move {@code IDLE -> RUNNING -> SUCCEEDED | FAILED} and back to {@code RUNNING} on the next trigger.
 */
public enum JobState {
    IDLE,
    RUNNING,
    RESTARTING,
    STOPPED,
    SUCCEEDED,
    FAILED;

    /**
     * True while a child process is (or is being) kept for the job.
     */
    public boolean isActive() {
        return this == RUNNING || this == RESTARTING;
    }
}
