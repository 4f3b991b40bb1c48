package io.jobvisor.config;

import io.jobvisor.Scheduler;
import io.jobvisor.core.ScheduleGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Starts the scheduler once the context is refreshed and stops it first on shutdown.
 * A schedule that fails to load aborts the context start.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLifecycle.class);

    private final Scheduler scheduler;
    private volatile boolean running = false;

    public SchedulerLifecycle(Scheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    @Override
    public void start() {
        scheduler.start();
        running = true;
        ScheduleGraph graph = scheduler.graph();
        log.info("jobvisor lifecycle started programs={} tasks={}", graph.programs().size(), graph.tasks().size());
    }

    @Override
    public void stop() {
        try {
            scheduler.stop();
        } finally {
            running = false;
        }
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // last to start, first to stop
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
