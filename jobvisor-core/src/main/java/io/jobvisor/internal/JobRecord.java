package io.jobvisor.internal;

import io.jobvisor.JobProcess;
import io.jobvisor.core.FailureReason;
import io.jobvisor.core.JobSpec;
import io.jobvisor.core.JobState;
import io.jobvisor.core.JobStatus;
import io.jobvisor.core.Trigger;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable runtime record of one job. Every transition happens under the record's monitor and returns
 * the resulting {@link JobStatus} snapshot, ready to be persisted.
 */
final class JobRecord {
    private volatile JobSpec spec;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private volatile boolean retired;

    private JobState state = JobState.IDLE;
    private JobProcess process;
    private Instant lastStartTime;
    private Instant lastEndTime;
    private Integer lastExitCode;
    private int consecutiveFailures;
    private Instant nextDueTime;
    private Instant lastCheckTime;
    private boolean restartDisabled;
    private Trigger lastTrigger;
    private FailureReason failureReason;
    private String lastError;
    private JobStatus current;

    JobRecord(JobSpec spec) {
        this.spec = Objects.requireNonNull(spec, "spec must not be null");
    }

    JobSpec spec() {
        return spec;
    }

    String name() {
        return spec.name();
    }

    void updateSpec(JobSpec spec) {
        this.spec = Objects.requireNonNull(spec, "spec must not be null");
    }

    /**
     * At most one run per task at a time.
     */
    boolean tryBeginRun() {
        return inFlight.compareAndSet(false, true);
    }

    void endRun() {
        inFlight.set(false);
    }

    /**
     * Marks a record whose job left the schedule; late completions must not write its status back.
     */
    void retire() {
        retired = true;
    }

    boolean isRetired() {
        return retired;
    }

    synchronized JobState state() {
        return state;
    }

    synchronized JobProcess process() {
        return process;
    }

    synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    synchronized boolean isRestartDisabled() {
        return restartDisabled;
    }

    synchronized Instant nextDueTime() {
        return nextDueTime;
    }

    synchronized void nextDueTime(Instant nextDueTime) {
        this.nextDueTime = nextDueTime;
    }

    synchronized Instant lastStartTime() {
        return lastStartTime;
    }

    synchronized Instant lastCheckTime() {
        return lastCheckTime;
    }

    synchronized void restore(JobStatus status) {
        state = status.state();
        lastStartTime = status.lastStartTime();
        lastEndTime = status.lastEndTime();
        lastExitCode = status.lastExitCode();
        consecutiveFailures = status.consecutiveFailures();
        lastCheckTime = status.lastCheckTime();
        restartDisabled = status.restartDisabled();
        lastTrigger = status.lastTrigger();
        failureReason = status.failureReason();
        lastError = status.lastError();
    }

    synchronized JobStatus started(JobProcess process, Trigger trigger, Instant now) {
        this.state = JobState.RUNNING;
        this.process = process;
        this.lastStartTime = now;
        this.lastTrigger = trigger;
        this.failureReason = null;
        this.lastError = null;
        if (spec.isProgram()) {
            this.lastCheckTime = now;
        }
        return snapshot(now);
    }

    synchronized JobStatus attached(JobProcess process, Instant now) {
        this.state = JobState.RUNNING;
        this.process = process;
        this.lastCheckTime = now;
        return snapshot(now);
    }

    synchronized JobStatus healthy(Instant now) {
        this.state = JobState.RUNNING;
        this.consecutiveFailures = 0;
        this.failureReason = null;
        this.lastError = null;
        this.lastCheckTime = now;
        return snapshot(now);
    }

    /**
     * @return the failure count including this one
     */
    synchronized int recordFailure(FailureReason reason, String error, Instant now) {
        this.consecutiveFailures++;
        this.failureReason = reason;
        this.lastError = error;
        this.lastCheckTime = now;
        return consecutiveFailures;
    }

    synchronized void exited(Integer exitCode, Instant now) {
        this.lastExitCode = exitCode;
        this.lastEndTime = now;
    }

    synchronized JobStatus restarting(Instant now) {
        this.state = JobState.RESTARTING;
        this.process = null;
        return snapshot(now);
    }

    synchronized JobStatus failed(FailureReason reason, String error, Instant now) {
        this.state = JobState.FAILED;
        this.process = null;
        this.failureReason = reason;
        this.lastError = error;
        this.lastEndTime = now;
        return snapshot(now);
    }

    synchronized JobStatus stopped(boolean disableRestart, Instant now) {
        this.state = JobState.STOPPED;
        this.process = null;
        this.lastEndTime = now;
        this.restartDisabled = restartDisabled || disableRestart;
        return snapshot(now);
    }

    synchronized void enable() {
        this.restartDisabled = false;
        this.consecutiveFailures = 0;
        this.failureReason = null;
        this.lastError = null;
    }

    /**
     * Terminal transition of a task run. Also ends the run, so a reader that sees the terminal state can
     * trigger the task again.
     */
    synchronized JobStatus finished(boolean success, Integer exitCode, FailureReason reason, String error, Instant now) {
        inFlight.set(false);
        this.state = success ? JobState.SUCCEEDED : JobState.FAILED;
        this.process = null;
        this.lastExitCode = exitCode;
        this.lastEndTime = now;
        this.failureReason = success ? null : reason;
        this.lastError = success ? null : error;
        this.consecutiveFailures = success ? 0 : consecutiveFailures + 1;
        return snapshot(now);
    }

    synchronized JobStatus snapshot(Instant now) {
        JobSpec s = spec;
        current = new JobStatus(
                s.name(),
                s.kind(),
                state,
                process == null ? null : process.pid(),
                lastStartTime,
                lastEndTime,
                lastExitCode,
                consecutiveFailures,
                nextDueTime,
                lastCheckTime,
                restartDisabled,
                lastTrigger,
                failureReason,
                lastError,
                now
        );
        return current;
    }

    /**
     * The most recent snapshot, or {@code null} before the first one.
     */
    synchronized JobStatus current() {
        return current;
    }
}
