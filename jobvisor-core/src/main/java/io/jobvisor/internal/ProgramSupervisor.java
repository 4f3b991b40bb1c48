package io.jobvisor.internal;

import io.jobvisor.JobHandler;
import io.jobvisor.JobNotifier;
import io.jobvisor.JobProcess;
import io.jobvisor.core.FailureReason;
import io.jobvisor.core.JobHandlerRegistry;
import io.jobvisor.core.JobSpec;
import io.jobvisor.core.JobState;
import io.jobvisor.core.LaunchException;
import io.jobvisor.core.LivenessCheckException;
import io.jobvisor.core.Trigger;
import io.jobvisor.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Keeps programs alive.
 *
 * <p>On every tick a program is started when it should be running and is not, probed once its check
 * interval has elapsed, and restarted after a failed probe until {@code maxRetries} consecutive failures
 * exhaust its budget. A manual stop disables restarts until the next manual start.
 */
final class ProgramSupervisor {
    private static final Logger log = LoggerFactory.getLogger(ProgramSupervisor.class);

    private final JobHandlerRegistry handlers;
    private final StatusWriter statusWriter;
    private final JobNotifier notifier;
    private final Supplier<ExecutorService> probeExecutor;
    private final Duration probeTimeout;
    private final Duration stopGracePeriod;
    private final Clock clock;

    ProgramSupervisor(JobHandlerRegistry handlers,
                      StatusWriter statusWriter,
                      JobNotifier notifier,
                      Supplier<ExecutorService> probeExecutor,
                      Duration probeTimeout,
                      Duration stopGracePeriod,
                      Clock clock) {
        this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
        this.statusWriter = Objects.requireNonNull(statusWriter, "statusWriter must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.probeExecutor = Objects.requireNonNull(probeExecutor, "probeExecutor must not be null");
        this.probeTimeout = Objects.requireNonNull(probeTimeout, "probeTimeout must not be null");
        this.stopGracePeriod = Objects.requireNonNull(stopGracePeriod, "stopGracePeriod must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    void supervise(JobRecord record, Instant now) {
        JobSpec spec = record.spec();
        JobState state = record.state();

        if (!IntervalParser.withinWindow(spec, now)) {
            record.nextDueTime(IntervalParser.nextOccurrence(spec, now, true));
            if (state.isActive()) {
                log.info("jobvisor program outside its window, stopping name={}", spec.name());
                terminate(record);
                record.stopped(false, now);
                statusWriter.write(record);
            }
            return;
        }
        Instant opening = record.nextDueTime();
        record.nextDueTime(null);

        if (record.isRestartDisabled() || state == JobState.FAILED) {
            return;
        }

        if (!state.isActive() || record.process() == null) {
            // without run_on_start an idle program waits for its window to open
            if (state == JobState.IDLE && !spec.runOnStart() && (opening == null || now.isBefore(opening))) {
                return;
            }
            launch(record, Trigger.SUPERVISOR, true);
            return;
        }

        Instant lastCheck = record.lastCheckTime();
        if (lastCheck != null && now.isBefore(lastCheck.plus(spec.checkInterval()))) {
            return;
        }
        checkLiveness(record, now);
    }

    void checkLiveness(JobRecord record, Instant now) {
        JobSpec spec = record.spec();
        JobProcess process = record.process();

        FailureReason reason;
        String detail;
        if (process == null) {
            reason = FailureReason.LAUNCH_ERROR;
            detail = "no running process";
        } else {
            try {
                if (probe(spec, process)) {
                    boolean recovered = record.consecutiveFailures() > 0;
                    record.healthy(now);
                    statusWriter.write(record);
                    if (recovered) {
                        log.info("jobvisor program recovered name={} pid={}", spec.name(), process.pid());
                        notifier.notifyUp(spec.name(), "liveness check passed");
                    }
                    return;
                }
                reason = process.isAlive() ? FailureReason.LIVENESS_CHECK : FailureReason.PROCESS_EXITED;
                detail = process.isAlive() ? "liveness check failed" : "process exited";
            } catch (LivenessCheckException e) {
                reason = FailureReason.LIVENESS_CHECK;
                detail = e.getMessage();
            }
            if (!process.isAlive()) {
                record.exited(process.onExit().getNow(null), now);
            }
        }

        int failures = record.recordFailure(reason, detail, now);
        log.warn("jobvisor program down name={} reason={} failures={} maxRetries={} detail={}",
                spec.name(), reason, failures, spec.maxRetries(), detail);

        if (!spec.keepAlive()) {
            terminate(record);
            record.failed(reason, detail, now);
            statusWriter.write(record);
            notifier.notifyFailure(spec.name(), failures, detail);
            return;
        }

        if (failures > spec.maxRetries()) {
            terminate(record);
            record.failed(FailureReason.RETRY_BUDGET_EXHAUSTED, detail, now);
            statusWriter.write(record);
            log.error("jobvisor program gave up name={} failures={} maxRetries={}", spec.name(), failures, spec.maxRetries());
            notifier.notifyFailure(spec.name(), failures, detail);
            return;
        }

        notifier.notifyDown(spec.name(), detail);
        terminate(record);
        record.restarting(now);
        statusWriter.write(record);
        launch(record, Trigger.SUPERVISOR, false);
    }

    /**
     * @param countFailure whether a launch error adds to the failure count; false when the failure that
     *                     caused this restart was already counted
     */
    void launch(JobRecord record, Trigger trigger, boolean countFailure) {
        JobSpec spec = record.spec();
        JobHandler handler = handlers.getRequired(spec.handler());
        try {
            JobProcess process = handler.start(spec);
            record.started(process, trigger, clock.instant());
            statusWriter.write(record);
            log.info("jobvisor program started name={} pid={} trigger={}", spec.name(), process.pid(), trigger);
        } catch (LaunchException e) {
            Instant at = clock.instant();
            int failures = countFailure
                    ? record.recordFailure(FailureReason.LAUNCH_ERROR, e.getMessage(), at)
                    : record.consecutiveFailures();
            log.warn("jobvisor program launch failed name={} failures={} msg={}", spec.name(), failures, e.getMessage());
            if (!spec.keepAlive() || failures > spec.maxRetries()) {
                record.failed(FailureReason.LAUNCH_ERROR, e.getMessage(), at);
                statusWriter.write(record);
                notifier.notifyFailure(spec.name(), failures, e.getMessage());
            } else {
                record.restarting(at);
                statusWriter.write(record);
            }
        }
    }

    /**
     * Operator start: clears a manual stop and the failure budget, then launches unless already running.
     */
    void manualStart(JobRecord record) {
        record.enable();
        JobProcess process = record.process();
        if (record.state() == JobState.RUNNING && process != null && process.isAlive()) {
            record.snapshot(clock.instant());
            statusWriter.write(record);
            log.info("jobvisor program already running name={} pid={}", record.name(), process.pid());
            return;
        }
        terminate(record);
        launch(record, Trigger.MANUAL, true);
    }

    /**
     * @param manual operator stop; suppresses keep-alive until the next manual start
     */
    void stop(JobRecord record, boolean manual) {
        terminate(record);
        record.stopped(manual, clock.instant());
        statusWriter.write(record);
        log.info("jobvisor program stopped name={} manual={}", record.name(), manual);
    }

    /**
     * Re-adopt a program that was running before the scheduler restarted. When the process is gone, or
     * the pid now belongs to a process started at another time, the program is left stopped and the next
     * tick relaunches it.
     */
    void reattach(JobRecord record, Long pid) {
        JobSpec spec = record.spec();
        Instant now = clock.instant();
        if (pid != null) {
            var attached = handlers.getRequired(spec.handler()).attach(spec, pid, record.lastStartTime());
            if (attached.isPresent()) {
                record.attached(attached.get(), now);
                statusWriter.write(record);
                log.info("jobvisor program re-attached name={} pid={}", spec.name(), pid);
                return;
            }
        }
        log.info("jobvisor program not running after restart name={} pid={}", spec.name(), pid);
        record.stopped(false, now);
        statusWriter.write(record);
    }

    /**
     * Stop the process without recording a transition.
     */
    void terminate(JobRecord record) {
        JobProcess process = record.process();
        if (process == null) {
            return;
        }
        try {
            handlers.getRequired(record.spec().handler()).stop(record.spec(), process, stopGracePeriod);
        } catch (RuntimeException e) {
            log.error("jobvisor program stop failed name={} pid={} msg={}", record.name(), process.pid(), e.getMessage(), e);
        }
    }

    private boolean probe(JobSpec spec, JobProcess process) throws LivenessCheckException {
        JobHandler handler = handlers.getRequired(spec.handler());
        Future<Boolean> result = probeExecutor.get().submit(() -> handler.isAlive(spec, process));
        try {
            return result.get(probeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            result.cancel(true);
            throw new LivenessCheckException("liveness check timed out after " + probeTimeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new LivenessCheckException("liveness check failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.cancel(true);
            throw new LivenessCheckException("liveness check interrupted", e);
        }
    }
}
