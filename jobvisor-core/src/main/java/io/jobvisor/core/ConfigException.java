package io.jobvisor.core;

import java.util.List;

/**
 * The schedule definition is malformed or inconsistent (duplicate name, unresolved dependency, cycle,
 * unknown handler, unparsable time or frequency).
 *
 * <p>Fatal on the initial load; on reload the previous graph stays active.
 */
public class ConfigException extends IllegalArgumentException {

    private final List<String> problems;

    public ConfigException(String problem) {
        this(List.of(problem));
    }

    public ConfigException(List<String> problems) {
        super(format(problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigException(String problem, Throwable cause) {
        super(problem, cause);
        this.problems = List.of(problem);
    }

    public List<String> problems() {
        return problems;
    }

    private static String format(List<String> problems) {
        if (problems.size() == 1) {
            return "Invalid schedule: " + problems.get(0);
        }
        return "Invalid schedule (" + problems.size() + " problems): " + String.join("; ", problems);
    }
}
