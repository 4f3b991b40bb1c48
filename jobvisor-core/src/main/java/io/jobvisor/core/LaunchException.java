package io.jobvisor.core;

/**
 * A job's process could not be started (missing executable, permission denied, bad working directory).
 */
public class LaunchException extends Exception {

    public LaunchException(String message) {
        super(message);
    }

    public LaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
