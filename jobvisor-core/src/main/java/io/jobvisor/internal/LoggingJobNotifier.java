package io.jobvisor.internal;

import io.jobvisor.JobNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default notifier: writes supervision events to the log.
 */
public class LoggingJobNotifier implements JobNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingJobNotifier.class);

    @Override
    public void notifyDown(String name, String detail) {
        log.warn("jobvisor notify down name={} detail={}", name, detail);
    }

    @Override
    public void notifyUp(String name, String detail) {
        log.info("jobvisor notify up name={} detail={}", name, detail);
    }

    @Override
    public void notifyFailure(String name, int failures, String detail) {
        log.error("jobvisor notify failure name={} failures={} detail={}", name, failures, detail);
    }
}
