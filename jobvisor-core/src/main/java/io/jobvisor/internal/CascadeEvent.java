package io.jobvisor.internal;

import java.util.List;

/**
 * Successful completion of {@code source}; each dependent gets one run.
 */
record CascadeEvent(String source, List<String> dependents) {
    CascadeEvent {
        dependents = List.copyOf(dependents);
    }
}
