package io.jobvisor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Handle to a running job process, returned by {@link JobHandler#start}.
 */
public interface JobProcess {

    long pid();

    boolean isAlive();

    /**
     * Completes with the exit code once the process ends. The value is {@code null} when the exit code
     * cannot be known (a process re-attached after a scheduler restart).
     */
    CompletableFuture<Integer> onExit();

    /**
     * Request termination, then force it once {@code grace} has elapsed.
     */
    void destroy(Duration grace);
}
