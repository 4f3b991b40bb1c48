package io.jobvisor.internal;

import io.jobvisor.JobNotifier;
import io.jobvisor.Scheduler;
import io.jobvisor.config.SchedulerProperties;
import io.jobvisor.core.ConfigException;
import io.jobvisor.core.InvalidForKindException;
import io.jobvisor.core.JobHandlerRegistry;
import io.jobvisor.core.JobKind;
import io.jobvisor.core.JobNotFoundException;
import io.jobvisor.core.JobSpec;
import io.jobvisor.core.JobState;
import io.jobvisor.core.JobStatus;
import io.jobvisor.core.FailureReason;
import io.jobvisor.core.ScheduleGraph;
import io.jobvisor.core.ScheduleSource;
import io.jobvisor.core.StatusStore;
import io.jobvisor.core.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-host scheduler that keeps programs alive and runs clock- and cascade-triggered tasks.
 *
 * <p>One tick thread drives everything: each pass supervises programs, fires due tasks and drains the
 * cascade queue. Task runs complete on worker threads and wake the tick thread when they enqueue a
 * cascade, so dependents start without waiting for the next tick.
 *
 * <p>Typical usage:
 * <pre>{@code
 * Scheduler scheduler = new DefaultScheduler(props, new ScheduleLoader(props, registry),
 *         new JsonFileStatusStore(props.getStatusDir()), registry, new LoggingJobNotifier());
 * scheduler.start();
 * }</pre>
 */
public class DefaultScheduler implements Scheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultScheduler.class);

    private final SchedulerProperties props;
    private final ScheduleSource source;
    private final StatusStore store;
    private final Clock clock;
    private final ExecutorService sharedWorkers;
    private ExecutorService workerPool;

    private final StatusWriter statusWriter;
    private final TriggerEvaluator triggers = new TriggerEvaluator();
    private final ProgramSupervisor supervisor;
    private final TaskRunner runner;

    private final AtomicReference<ScheduleGraph> graph = new AtomicReference<>(ScheduleGraph.empty());
    private final ConcurrentHashMap<String, JobRecord> records = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<CascadeEvent> cascades = new ConcurrentLinkedQueue<>();
    private final Semaphore wakeup = new Semaphore(0);
    private final ReentrantLock coordinator = new ReentrantLock();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean initialized;
    private Thread tickThread;
    private int systemErrorCount = 0;

    public DefaultScheduler(SchedulerProperties props,
                            ScheduleSource source,
                            StatusStore store,
                            JobHandlerRegistry handlers,
                            JobNotifier notifier) {
        this(props, source, store, handlers, notifier, Clock.systemUTC(), null);
    }

    /**
     * @param workers runs probes and task completions; {@code null} creates a pool owned by this scheduler
     */
    public DefaultScheduler(SchedulerProperties props,
                            ScheduleSource source,
                            StatusStore store,
                            JobHandlerRegistry handlers,
                            JobNotifier notifier,
                            Clock clock,
                            ExecutorService workers) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(handlers, "handlers must not be null");
        Objects.requireNonNull(notifier, "notifier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        requirePositive(props.getTickInterval(), "jobvisor.tick-interval");
        requirePositive(props.getProbeTimeout(), "jobvisor.probe-timeout");
        Objects.requireNonNull(props.getStopGracePeriod(), "jobvisor.stop-grace-period must not be null");

        this.sharedWorkers = workers;

        this.statusWriter = new StatusWriter(store);
        this.supervisor = new ProgramSupervisor(handlers, statusWriter, notifier, this::workers,
                props.getProbeTimeout(), props.getStopGracePeriod(), clock);
        this.runner = new TaskRunner(handlers, statusWriter, notifier, this::dispatch,
                props.getStopGracePeriod(), clock, this::enqueueCascade);
    }

    /**
     * Load the schedule, replay persisted statuses and arm clock triggers. Called by {@link #start()};
     * idempotent. Tests call it directly to drive {@link #tick()} by hand.
     *
     * @throws ConfigException if the schedule is invalid
     */
    public void initialize() {
        coordinator.lock();
        try {
            if (initialized) {
                return;
            }
            ScheduleGraph loaded = source.load();
            Instant now = nowInstant();
            Map<String, JobStatus> persisted = store.readAll();

            for (JobSpec spec : loaded.jobs()) {
                JobRecord record = new JobRecord(spec);
                records.put(spec.name(), record);
                JobStatus prior = persisted.get(spec.name());

                if (prior != null && prior.kind() == spec.kind()) {
                    record.restore(prior);
                    triggers.arm(record, now);
                    if (spec.isProgram() && prior.state().isActive()) {
                        supervisor.reattach(record, prior.pid());
                        continue;
                    }
                    if (spec.isTask() && prior.state() == JobState.RUNNING) {
                        log.warn("jobvisor task was running when the scheduler went down name={} pid={}", spec.name(), prior.pid());
                        record.finished(false, null, FailureReason.ABANDONED,
                                "scheduler restarted during run", now);
                        statusWriter.write(record);
                        continue;
                    }
                } else {
                    triggers.arm(record, now);
                }
                record.snapshot(now);
                statusWriter.write(record);
            }

            for (String name : persisted.keySet()) {
                if (!loaded.contains(name)) {
                    log.info("jobvisor dropping status of job no longer scheduled name={}", name);
                    statusWriter.delete(name);
                }
            }

            graph.set(loaded);
            initialized = true;
            log.info("jobvisor schedule loaded programs={} tasks={} digest={}",
                    loaded.programs().size(), loaded.tasks().size(), loaded.digest());
        } finally {
            coordinator.unlock();
        }
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            initialize();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        log.info("jobvisor starting with tickInterval={}, probeTimeout={}, stopGracePeriod={}, statusStore={}",
                props.getTickInterval(), props.getProbeTimeout(), props.getStopGracePeriod(), props.getStatusStore());

        workers();

        if (tickThread == null) {
            tickThread = new Thread(this::tickLoop);
            tickThread.setName("jobvisor.tick");
            tickThread.setDaemon(true);
            tickThread.start();
        }
        log.info("jobvisor started successfully.");
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("jobvisor stopping...");

        if (tickThread != null) {
            tickThread.interrupt();
            try {
                tickThread.join(props.getTickInterval().toMillis() + 1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            tickThread = null;
        }

        if (props.isStopProgramsOnShutdown()) {
            coordinator.lock();
            try {
                for (JobSpec spec : graph.get().programs()) {
                    JobRecord record = records.get(spec.name());
                    if (record != null && record.state().isActive()) {
                        supervisor.stop(record, false);
                    }
                }
            } finally {
                coordinator.unlock();
            }
        }

        ExecutorService pool;
        synchronized (this) {
            pool = workerPool;
            workerPool = null;
        }
        if (pool != null) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(props.getStopGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.shutdownNow();
            }
        }

        cascades.clear();
        wakeup.drainPermits();
        log.info("jobvisor stopped successfully.");
    }

    @Override
    public void tick() {
        coordinator.lock();
        try {
            Instant now = nowInstant();
            ScheduleGraph current = graph.get();

            for (JobSpec spec : current.programs()) {
                JobRecord record = records.get(spec.name());
                try {
                    supervisor.supervise(record, now);
                } catch (RuntimeException e) {
                    log.error("jobvisor supervise failed name={} msg={}", spec.name(), e.getMessage(), e);
                }
            }

            for (JobSpec spec : current.tasks()) {
                JobRecord record = records.get(spec.name());
                try {
                    if (triggers.fireIfDue(record, now) && !runner.execute(record, Trigger.CLOCK)) {
                        record.snapshot(now);
                        statusWriter.write(record);
                    }
                } catch (RuntimeException e) {
                    log.error("jobvisor trigger failed name={} msg={}", spec.name(), e.getMessage(), e);
                }
            }

            drainCascades();
        } finally {
            coordinator.unlock();
        }
    }

    private void drainCascades() {
        CascadeEvent event;
        while ((event = cascades.poll()) != null) {
            ScheduleGraph current = graph.get();
            for (String dependent : event.dependents()) {
                JobRecord record = records.get(dependent);
                if (record == null || !current.contains(dependent) || !record.spec().isTask()) {
                    log.warn("jobvisor cascade target no longer scheduled source={} target={}", event.source(), dependent);
                    continue;
                }
                try {
                    log.debug("jobvisor cascade source={} target={}", event.source(), dependent);
                    runner.execute(record, Trigger.CASCADE);
                } catch (RuntimeException e) {
                    log.error("jobvisor cascade failed source={} target={} msg={}", event.source(), dependent, e.getMessage(), e);
                }
            }
        }
    }

    private void enqueueCascade(CascadeEvent event) {
        cascades.add(event);
        wakeup.release();
    }

    @Override
    public List<JobStatus> list() {
        Instant now = nowInstant();
        List<JobStatus> statuses = new ArrayList<>();
        for (JobSpec spec : graph.get().jobs()) {
            JobRecord record = records.get(spec.name());
            if (record != null) {
                statuses.add(record.snapshot(now));
            }
        }
        return List.copyOf(statuses);
    }

    @Override
    public Optional<JobStatus> status(String name) {
        if (name == null || !graph.get().contains(name)) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(name)).map(r -> r.snapshot(nowInstant()));
    }

    @Override
    public void start(String name) {
        coordinator.lock();
        try {
            JobRecord record = requireKind(name, JobKind.PROGRAM, "start");
            supervisor.manualStart(record);
        } finally {
            coordinator.unlock();
        }
    }

    @Override
    public void stop(String name) {
        coordinator.lock();
        try {
            JobRecord record = requireKind(name, JobKind.PROGRAM, "stop");
            supervisor.stop(record, true);
        } finally {
            coordinator.unlock();
        }
    }

    @Override
    public boolean run(String name) {
        coordinator.lock();
        try {
            JobRecord record = requireKind(name, JobKind.TASK, "run");
            return runner.execute(record, Trigger.MANUAL);
        } finally {
            coordinator.unlock();
        }
    }

    @Override
    public ScheduleGraph reload() {
        coordinator.lock();
        try {
            ScheduleGraph next;
            try {
                next = source.load();
            } catch (ConfigException e) {
                log.warn("jobvisor reload rejected, keeping current schedule problems={}", e.problems());
                throw e;
            }

            ScheduleGraph previous = graph.get();
            Instant now = nowInstant();

            for (JobSpec old : previous.jobs()) {
                Optional<JobSpec> replacement = next.find(old.name());
                if (replacement.isPresent() && replacement.get().kind() == old.kind()) {
                    continue;
                }
                JobRecord record = records.remove(old.name());
                if (record == null) {
                    continue;
                }
                record.retire();
                if (old.isProgram()) {
                    supervisor.terminate(record);
                }
                if (replacement.isEmpty()) {
                    statusWriter.delete(old.name());
                }
                log.info("jobvisor job removed by reload name={} kind={}", old.name(), old.kind());
            }

            for (JobSpec spec : next.jobs()) {
                JobRecord record = records.get(spec.name());
                if (record == null) {
                    record = new JobRecord(spec);
                    records.put(spec.name(), record);
                    triggers.arm(record, now);
                    record.snapshot(now);
                    statusWriter.write(record);
                    log.info("jobvisor job added by reload name={} kind={}", spec.name(), spec.kind());
                    continue;
                }
                JobSpec old = record.spec();
                record.updateSpec(spec);
                if (old.triggerChanged(spec)) {
                    triggers.arm(record, now);
                    record.snapshot(now);
                    statusWriter.write(record);
                }
                if (spec.isProgram() && launchChanged(old, spec) && record.state().isActive()) {
                    log.info("jobvisor program definition changed, restarting name={}", spec.name());
                    supervisor.stop(record, false);
                }
            }

            graph.set(next);
            initialized = true;
            log.info("jobvisor schedule reloaded programs={} tasks={} digest={}",
                    next.programs().size(), next.tasks().size(), next.digest());
            return next;
        } finally {
            coordinator.unlock();
        }
    }

    @Override
    public boolean isScheduleCurrent() {
        try {
            return Objects.equals(source.load().digest(), graph.get().digest());
        } catch (ConfigException e) {
            log.debug("jobvisor schedule source invalid problems={}", e.problems());
            return false;
        }
    }

    @Override
    public ScheduleGraph graph() {
        return graph.get();
    }

    /**
     * The injected executor, or the owned pool. The owned pool is created on first use and dropped by
     * {@link #stop()}, so a stopped scheduler can be started again.
     */
    private synchronized ExecutorService workers() {
        if (sharedWorkers != null) {
            return sharedWorkers;
        }
        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(Math.max(2, props.getWorkerThreads()), r -> {
                Thread t = new Thread(r);
                t.setName("jobvisor.worker");
                t.setDaemon(true);
                return t;
            });
        }
        return workerPool;
    }

    // a pool shut down by stop() after handing out a reference rejects; the retry lands on a fresh one
    private void dispatch(Runnable command) {
        try {
            workers().execute(command);
        } catch (RejectedExecutionException e) {
            log.debug("jobvisor worker pool rejected a completion, retrying on the current pool");
            workers().execute(command);
        }
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return clock.instant();
    }

    private JobRecord requireKind(String name, JobKind kind, String operation) {
        JobSpec spec = graph.get().find(name).orElseThrow(() -> new JobNotFoundException(name));
        if (spec.kind() != kind) {
            throw new InvalidForKindException(name, spec.kind(), operation);
        }
        JobRecord record = records.get(name);
        if (record == null) {
            throw new JobNotFoundException(name);
        }
        return record;
    }

    private static boolean launchChanged(JobSpec old, JobSpec next) {
        return !Objects.equals(old.handler(), next.handler())
                || !Objects.equals(old.command(), next.command())
                || !Objects.equals(old.options(), next.options())
                || !Objects.equals(old.logFile(), next.logFile());
    }

    private static void requirePositive(Duration d, String property) {
        Objects.requireNonNull(d, property + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(property + " must be a positive duration");
        }
    }

    private void tickLoop() {
        while (started.get()) {
            try {
                tick();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("jobvisor tick failed failures={} msg={}", systemErrorCount, e.getMessage(), e);
                try {
                    Duration sleep = (systemErrorCount >= 10)
                            ? Duration.ofSeconds(60)
                            : backoff(systemErrorCount);
                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                if (wakeup.tryAcquire(props.getTickInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                    wakeup.drainPermits();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated tick failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }
}
