package io.jobvisor.core;

public class JobNotFoundException extends ControlException {

    public JobNotFoundException(String jobName) {
        super(jobName, "No job named '" + jobName + "' in the active schedule");
    }
}
