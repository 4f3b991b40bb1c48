package io.jobvisor.internal;

import io.jobvisor.JobProcess;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory process whose exit is driven by the test.
 */
class FakeJobProcess implements JobProcess {
    private final long pid;
    private final CompletableFuture<Integer> exit = new CompletableFuture<>();
    private volatile boolean destroyed;

    FakeJobProcess(long pid) {
        this.pid = pid;
    }

    @Override
    public long pid() {
        return pid;
    }

    @Override
    public boolean isAlive() {
        return !exit.isDone();
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return exit;
    }

    @Override
    public void destroy(Duration grace) {
        destroyed = true;
        exit.complete(143);
    }

    void exit(int code) {
        exit.complete(code);
    }

    boolean destroyed() {
        return destroyed;
    }
}
