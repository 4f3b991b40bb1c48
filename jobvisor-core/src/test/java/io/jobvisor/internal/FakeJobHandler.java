package io.jobvisor.internal;

import io.jobvisor.JobHandler;
import io.jobvisor.JobProcess;
import io.jobvisor.core.JobSpec;
import io.jobvisor.core.LaunchException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Records every launch and lets tests script launch failures, probe results and re-attachable pids.
 */
class FakeJobHandler implements JobHandler {
    private final AtomicLong pids = new AtomicLong(1000);
    private final Map<String, List<FakeJobProcess>> started = new ConcurrentHashMap<>();
    private final Map<Long, FakeJobProcess> attachable = new ConcurrentHashMap<>();
    private final AtomicInteger failingLaunches = new AtomicInteger();
    private volatile boolean healthy = true;

    @Override
    public String name() {
        return JobSpec.DEFAULT_HANDLER;
    }

    @Override
    public JobProcess start(JobSpec spec) throws LaunchException {
        if (failingLaunches.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new LaunchException("cannot exec " + spec.command());
        }
        FakeJobProcess process = new FakeJobProcess(pids.incrementAndGet());
        started.computeIfAbsent(spec.name(), k -> new CopyOnWriteArrayList<>()).add(process);
        return process;
    }

    @Override
    public boolean isAlive(JobSpec spec, JobProcess process) {
        return process.isAlive() && healthy;
    }

    @Override
    public Optional<JobProcess> attach(JobSpec spec, long pid, Instant startedAt) {
        return Optional.ofNullable(attachable.get(pid));
    }

    void failNextLaunches(int n) {
        failingLaunches.set(n);
    }

    void healthy(boolean healthy) {
        this.healthy = healthy;
    }

    FakeJobProcess attachable(long pid) {
        FakeJobProcess process = new FakeJobProcess(pid);
        attachable.put(pid, process);
        return process;
    }

    int launches(String name) {
        return started.getOrDefault(name, List.of()).size();
    }

    FakeJobProcess last(String name) {
        List<FakeJobProcess> processes = new ArrayList<>(started.getOrDefault(name, List.of()));
        if (processes.isEmpty()) {
            throw new AssertionError("no process started for " + name);
        }
        return processes.get(processes.size() - 1);
    }
}
