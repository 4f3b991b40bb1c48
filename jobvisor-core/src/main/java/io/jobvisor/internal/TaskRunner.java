package io.jobvisor.internal;

import io.jobvisor.JobHandler;
import io.jobvisor.JobNotifier;
import io.jobvisor.JobProcess;
import io.jobvisor.core.FailureReason;
import io.jobvisor.core.JobHandlerRegistry;
import io.jobvisor.core.JobSpec;
import io.jobvisor.core.JobStatus;
import io.jobvisor.core.LaunchException;
import io.jobvisor.core.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Launches task runs and records their outcome. The launching thread never waits for the run: the exit
 * is observed asynchronously and a successful exit is handed to the cascade sink.
 */
final class TaskRunner {
    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final JobHandlerRegistry handlers;
    private final StatusWriter statusWriter;
    private final JobNotifier notifier;
    private final Executor workers;
    private final Duration stopGracePeriod;
    private final Clock clock;
    private final Consumer<CascadeEvent> cascades;

    TaskRunner(JobHandlerRegistry handlers,
               StatusWriter statusWriter,
               JobNotifier notifier,
               Executor workers,
               Duration stopGracePeriod,
               Clock clock,
               Consumer<CascadeEvent> cascades) {
        this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
        this.statusWriter = Objects.requireNonNull(statusWriter, "statusWriter must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
        this.stopGracePeriod = Objects.requireNonNull(stopGracePeriod, "stopGracePeriod must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.cascades = Objects.requireNonNull(cascades, "cascades must not be null");
    }

    /**
     * @return false when the task was already in flight and this trigger was dropped
     */
    boolean execute(JobRecord record, Trigger trigger) {
        if (!record.tryBeginRun()) {
            log.info("jobvisor task already running, trigger dropped name={} trigger={}", record.name(), trigger);
            return false;
        }

        JobSpec spec = record.spec();
        JobProcess process;
        try {
            JobHandler handler = handlers.getRequired(spec.handler());
            process = handler.start(spec);
        } catch (LaunchException | RuntimeException e) {
            log.error("jobvisor task launch failed name={} trigger={} msg={}", spec.name(), trigger, e.getMessage(), e);
            JobStatus status = record.finished(false, null, FailureReason.LAUNCH_ERROR, e.getMessage(), clock.instant());
            statusWriter.write(record);
            notifier.notifyFailure(spec.name(), status.consecutiveFailures(), e.getMessage());
            return true;
        }

        record.started(process, trigger, clock.instant());
        statusWriter.write(record);
        log.info("jobvisor task started name={} pid={} trigger={}", spec.name(), process.pid(), trigger);

        CompletableFuture<Integer> exit = process.onExit().copy();
        if (spec.timeout() != null) {
            exit = exit.orTimeout(spec.timeout().toMillis(), TimeUnit.MILLISECONDS);
        }
        exit.whenCompleteAsync((code, error) -> complete(record, spec, process, code, error), workers);
        return true;
    }

    private void complete(JobRecord record, JobSpec spec, JobProcess process, Integer code, Throwable error) {
        JobStatus status = null;
        try {
            Instant at = clock.instant();
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                if (cause instanceof TimeoutException) {
                    stopQuietly(spec, process);
                    String detail = "timed out after " + spec.timeout();
                    status = record.finished(false, null, FailureReason.TIMEOUT, detail, at);
                } else {
                    status = record.finished(false, null, FailureReason.PROCESS_EXITED, cause.getMessage(), at);
                }
            } else if (code != null && code == 0) {
                status = record.finished(true, code, null, null, at);
            } else {
                status = record.finished(false, code, FailureReason.NON_ZERO_EXIT, "exit code " + code, at);
            }

            if (record.isRetired()) {
                log.debug("jobvisor task finished after leaving the schedule name={} state={}", spec.name(), status.state());
                return;
            }
            statusWriter.write(record);

            if (status.failureReason() == null) {
                log.info("jobvisor task succeeded name={} pid={}", spec.name(), process.pid());
                if (!spec.runOnComplete().isEmpty()) {
                    cascades.accept(new CascadeEvent(spec.name(), spec.runOnComplete()));
                }
            } else {
                log.warn("jobvisor task failed name={} reason={} exitCode={} failures={}",
                        spec.name(), status.failureReason(), status.lastExitCode(), status.consecutiveFailures());
                notifier.notifyFailure(spec.name(), status.consecutiveFailures(), status.lastError());
            }
        } catch (RuntimeException e) {
            log.error("jobvisor task completion failed name={} msg={}", spec.name(), e.getMessage(), e);
            if (status == null) {
                record.endRun();
            }
        }
    }

    private void stopQuietly(JobSpec spec, JobProcess process) {
        try {
            handlers.getRequired(spec.handler()).stop(spec, process, stopGracePeriod);
        } catch (RuntimeException e) {
            log.error("jobvisor task stop failed name={} pid={} msg={}", spec.name(), process.pid(), e.getMessage(), e);
        }
    }
}
