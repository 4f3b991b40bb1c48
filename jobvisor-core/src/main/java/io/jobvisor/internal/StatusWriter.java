package io.jobvisor.internal;

import io.jobvisor.core.JobStatus;
import io.jobvisor.core.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Persists status snapshots. A failing store is logged and never takes the scheduler down; the next
 * transition writes a fresh snapshot anyway.
 */
final class StatusWriter {
    private static final Logger log = LoggerFactory.getLogger(StatusWriter.class);

    private final StatusStore store;

    StatusWriter(StatusStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Persist the record's latest snapshot. Runs under the record's monitor, so a slow write from one
     * thread can never land after the write of a later transition made by another.
     */
    void write(JobRecord record) {
        synchronized (record) {
            JobStatus status = record.current();
            if (status == null) {
                return;
            }
            try {
                store.write(status);
            } catch (RuntimeException e) {
                log.error("jobvisor status write failed name={} state={} msg={}", status.name(), status.state(), e.getMessage(), e);
            }
        }
    }

    void delete(String name) {
        try {
            store.delete(name);
        } catch (RuntimeException e) {
            log.error("jobvisor status delete failed name={} msg={}", name, e.getMessage(), e);
        }
    }
}
