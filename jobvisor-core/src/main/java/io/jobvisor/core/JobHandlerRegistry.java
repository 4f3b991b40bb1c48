package io.jobvisor.core;

import io.jobvisor.JobHandler;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Static mapping from handler name to {@link JobHandler}, populated once at startup.
 */
public class JobHandlerRegistry {

    private final Map<String, JobHandler> handlersByName;

    public JobHandlerRegistry(List<? extends JobHandler> handlers) {
        Objects.requireNonNull(handlers, "handlers must not be null");
        this.handlersByName = handlers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        JobHandler::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate JobHandler name: " + a.name());
                        }
                ));
    }

    public boolean contains(String name) {
        return handlersByName.containsKey(name);
    }

    /**
     * Registered names in alphabetical order, for problem messages.
     */
    public Set<String> names() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(handlersByName.keySet()));
    }

    public JobHandler getRequired(String name) {
        JobHandler handler = handlersByName.get(name);
        if (handler == null) {
            throw new IllegalStateException("No JobHandler registered for name: " + name + "; registered " + names());
        }
        return handler;
    }
}
