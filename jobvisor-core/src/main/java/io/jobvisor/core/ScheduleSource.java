package io.jobvisor.core;

/**
 * Produces a validated {@link ScheduleGraph}; called once at startup and again on every reload.
 */
@FunctionalInterface
public interface ScheduleSource {

    ScheduleGraph load() throws ConfigException;
}
