package io.jobvisor;

import io.jobvisor.core.ConfigException;
import io.jobvisor.core.InvalidForKindException;
import io.jobvisor.core.JobNotFoundException;
import io.jobvisor.core.JobStatus;
import io.jobvisor.core.ScheduleGraph;

import java.util.List;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>Supervises two kinds of jobs:
 * <ul>
 *   <li>Programs: long-running processes kept alive with a bounded restart budget</li>
 *   <li>Tasks: finite runs triggered by time of day, a recurring frequency, or completion of another task</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 *
 * scheduler.run("update-fx-data");
 * scheduler.stop("tws");
 * scheduler.list().forEach(System.out::println);
 *
 * scheduler.stop();
 * }</pre>
 */
public interface Scheduler {

    /**
     * Load the schedule, replay persisted statuses and start ticking. Idempotent.
     *
     * @throws ConfigException if the schedule is invalid; the scheduler does not start
     */
    void start();

    /**
     * Stop ticking. Idempotent.
     */
    void stop();

    /**
     * Run one scheduling pass: clock triggers, program supervision, due tasks, pending cascades.
     */
    void tick();

    /**
     * Latest status of every job in the active schedule, in schedule order.
     */
    List<JobStatus> list();

    Optional<JobStatus> status(String name);

    /**
     * Manually start a program and re-enable its keep-alive.
     *
     * @throws JobNotFoundException    if no job has that name
     * @throws InvalidForKindException if the job is a task
     */
    void start(String name);

    /**
     * Stop a program and suppress keep-alive restarts until the next manual {@link #start(String)}.
     *
     * @throws JobNotFoundException    if no job has that name
     * @throws InvalidForKindException if the job is a task
     */
    void stop(String name);

    /**
     * Run a task now, bypassing its clock trigger.
     *
     * @return false if the task was already in flight and the request was dropped
     * @throws JobNotFoundException    if no job has that name
     * @throws InvalidForKindException if the job is a program
     */
    boolean run(String name);

    /**
     * Re-read the schedule and swap it in atomically.
     *
     * @return the graph now active
     * @throws ConfigException if the new schedule is invalid; the previous graph stays active
     */
    ScheduleGraph reload();

    /**
     * Whether the active graph still matches the schedule source.
     */
    boolean isScheduleCurrent();

    ScheduleGraph graph();
}
