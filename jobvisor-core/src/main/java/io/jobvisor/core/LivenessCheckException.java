package io.jobvisor.core;

/**
 * A liveness probe timed out or threw. Counted exactly like a dead process.
 */
public class LivenessCheckException extends Exception {

    public LivenessCheckException(String message) {
        super(message);
    }

    public LivenessCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
