package io.jobvisor.internal.process;

import io.jobvisor.JobProcess;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A process started by an earlier scheduler instance and re-adopted by pid. Its exit code is not
 * observable, so {@link #onExit()} completes with {@code null}.
 */
final class AttachedJobProcess implements JobProcess {
    private final ProcessHandle handle;

    AttachedJobProcess(ProcessHandle handle) {
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
    }

    @Override
    public long pid() {
        return handle.pid();
    }

    @Override
    public boolean isAlive() {
        return handle.isAlive();
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return handle.onExit().thenApply(h -> null);
    }

    @Override
    public void destroy(Duration grace) {
        if (!handle.isAlive()) {
            return;
        }
        handle.descendants().forEach(ProcessHandle::destroy);
        handle.destroy();
        try {
            handle.onExit().get(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | ExecutionException e) {
            handle.descendants().forEach(ProcessHandle::destroyForcibly);
            handle.destroyForcibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.destroyForcibly();
        }
    }
}
