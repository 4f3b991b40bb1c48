package io.jobvisor.core;

/**
 * Raised when an operation is applied to the wrong kind of job, e.g. {@code stop} on a task.
 */
public class InvalidForKindException extends ControlException {

    private final JobKind kind;

    public InvalidForKindException(String jobName, JobKind kind, String operation) {
        super(jobName, "Operation '" + operation + "' is not valid for " + kind.name().toLowerCase() + " '" + jobName + "'");
        this.kind = kind;
    }

    public JobKind kind() {
        return kind;
    }
}
