package io.jobvisor.core;

import java.util.Locale;

/**
 * The two variants of scheduled work. Both share {@link JobSpec}/{@link JobStatus}; the kind decides
 * which component drives the job and which control operations apply to it.
 */
public enum JobKind {
    PROGRAM {
        @Override
        public boolean keepsRunning() {
            return true;
        }
    },
    TASK {
        @Override
        public boolean keepsRunning() {
            return false;
        }
    };

    public abstract boolean keepsRunning();

    /**
     * Resolve the {@code type} field of a schedule record ("program" / "task").
     */
    public static JobKind fromType(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        return switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "program" -> PROGRAM;
            case "task" -> TASK;
            default -> throw new IllegalArgumentException("Unsupported job type: " + type);
        };
    }
}
