package io.jobvisor.core;

/**
 * A control operation was rejected. No state was changed.
 */
public abstract class ControlException extends IllegalArgumentException {

    private final String jobName;

    protected ControlException(String jobName, String message) {
        super(message);
        this.jobName = jobName;
    }

    public String jobName() {
        return jobName;
    }
}
