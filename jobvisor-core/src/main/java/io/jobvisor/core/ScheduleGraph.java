package io.jobvisor.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The validated set of {@link JobSpec}s plus the derived "triggered-by" edges.
 *
 * <p>Instances are read-only; a reload builds a new graph and swaps it in whole.
 * Construction fails with {@link ConfigException} when a name is duplicated, a {@code runOnComplete}
 * entry does not resolve to a task, or the dependency edges form a cycle.
 */
public final class ScheduleGraph {

    private static final ScheduleGraph EMPTY = new ScheduleGraph(new LinkedHashMap<>(), Map.of(), "");

    private final Map<String, JobSpec> jobs;
    private final Map<String, List<String>> triggeredBy;
    private final String digest;

    private ScheduleGraph(LinkedHashMap<String, JobSpec> jobs, Map<String, List<String>> triggeredBy, String digest) {
        this.jobs = Collections.unmodifiableMap(jobs);
        this.triggeredBy = triggeredBy;
        this.digest = digest;
    }

    public static ScheduleGraph empty() {
        return EMPTY;
    }

    public static ScheduleGraph of(List<JobSpec> specs) {
        return of(specs, "");
    }

    /**
     * @param specs  job specs in schedule order
     * @param digest fingerprint of the schedule source the specs were parsed from
     */
    public static ScheduleGraph of(List<JobSpec> specs, String digest) {
        List<String> problems = new ArrayList<>();
        LinkedHashMap<String, JobSpec> byName = new LinkedHashMap<>();
        for (JobSpec spec : specs) {
            if (byName.putIfAbsent(spec.name(), spec) != null) {
                problems.add("duplicate job name '" + spec.name() + "'");
            }
        }

        Map<String, List<String>> inverted = new HashMap<>();
        for (JobSpec spec : byName.values()) {
            if (spec.isProgram() && !spec.runOnComplete().isEmpty()) {
                problems.add("program '" + spec.name() + "' declares run_on_complete; only tasks trigger dependents");
            }
            for (String dependent : spec.runOnComplete()) {
                JobSpec target = byName.get(dependent);
                if (target == null) {
                    problems.add("job '" + spec.name() + "' triggers unknown job '" + dependent + "'");
                } else if (!target.isTask()) {
                    problems.add("job '" + spec.name() + "' triggers program '" + dependent + "'; dependents must be tasks");
                } else {
                    inverted.computeIfAbsent(dependent, k -> new ArrayList<>()).add(spec.name());
                }
            }
        }

        if (problems.isEmpty()) {
            List<String> cycle = findCycle(byName);
            if (!cycle.isEmpty()) {
                problems.add("dependency cycle " + String.join(" -> ", cycle));
            }
        }

        if (!problems.isEmpty()) {
            throw new ConfigException(problems);
        }

        Map<String, List<String>> frozen = new HashMap<>();
        inverted.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return new ScheduleGraph(byName, Collections.unmodifiableMap(frozen), digest == null ? "" : digest);
    }

    // Depth-first search with white/grey/black marking; returns the first cycle found as a closed path.
    private static List<String> findCycle(Map<String, JobSpec> byName) {
        Map<String, Integer> color = new HashMap<>();
        for (String root : byName.keySet()) {
            if (color.getOrDefault(root, 0) != 0) {
                continue;
            }
            List<String> path = new ArrayList<>();
            List<Integer> cursor = new ArrayList<>();
            path.add(root);
            cursor.add(0);
            color.put(root, 1);

            while (!path.isEmpty()) {
                int top = path.size() - 1;
                String current = path.get(top);
                List<String> next = byName.get(current).runOnComplete();
                int i = cursor.get(top);
                if (i >= next.size()) {
                    color.put(current, 2);
                    path.remove(top);
                    cursor.remove(top);
                    continue;
                }
                cursor.set(top, i + 1);
                String child = next.get(i);
                int c = color.getOrDefault(child, 0);
                if (c == 1) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(child), path.size()));
                    cycle.add(child);
                    return cycle;
                }
                if (c == 0) {
                    color.put(child, 1);
                    path.add(child);
                    cursor.add(0);
                }
            }
        }
        return List.of();
    }

    public Optional<JobSpec> find(String name) {
        return Optional.ofNullable(jobs.get(name));
    }

    public boolean contains(String name) {
        return jobs.containsKey(name);
    }

    public Collection<JobSpec> jobs() {
        return jobs.values();
    }

    public List<JobSpec> programs() {
        return jobs.values().stream().filter(JobSpec::isProgram).toList();
    }

    public List<JobSpec> tasks() {
        return jobs.values().stream().filter(JobSpec::isTask).toList();
    }

    /**
     * Names of the tasks whose successful completion starts {@code name}.
     */
    public List<String> triggeredBy(String name) {
        return triggeredBy.getOrDefault(name, List.of());
    }

    public int size() {
        return jobs.size();
    }

    /**
     * SHA-256 of the canonical schedule source; empty for graphs built in code.
     */
    public String digest() {
        return digest;
    }
}
