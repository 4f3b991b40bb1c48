package io.jobvisor.core;

import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable job definition loaded from the schedule.
 * This is a pure data object; {@link ScheduleGraph} owns cross-job validation.
 */
public record JobSpec(

        // identity
        String name,
        JobKind kind,
        String handler,

        // execution
        List<String> command,
        Map<String, String> options,
        Path logFile,
        Duration timeout,

        // supervision (programs)
        boolean keepAlive,
        Duration checkInterval,
        int maxRetries,
        boolean runOnStart,

        // triggers
        TimeOfDay startTime,
        TimeOfDay stopTime,
        Duration frequency,
        Set<DayOfWeek> days,

        // workflow (tasks)
        List<String> runOnComplete
) {
    public static final String DEFAULT_HANDLER = "command";
    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofMinutes(1);

    public JobSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        handler = (handler == null || handler.isBlank()) ? DEFAULT_HANDLER : handler;
        command = command == null ? List.of() : List.copyOf(command);
        options = options == null ? Map.of() : Map.copyOf(options);
        checkInterval = checkInterval == null ? DEFAULT_CHECK_INTERVAL : checkInterval;
        days = (days == null || days.isEmpty()) ? Set.of() : Set.copyOf(days);
        runOnComplete = runOnComplete == null ? List.of() : List.copyOf(runOnComplete);
    }

    public boolean isProgram() {
        return kind == JobKind.PROGRAM;
    }

    public boolean isTask() {
        return kind == JobKind.TASK;
    }

    /**
     * Jobs without a start time are never due from the clock (pure cascade targets, or programs
     * without a run window).
     */
    public boolean hasClockTrigger() {
        return startTime != null;
    }

    public boolean hasWindow() {
        return startTime != null || stopTime != null;
    }

    public boolean allowsDay(DayOfWeek day) {
        return days.isEmpty() || days.contains(day);
    }

    /**
     * True when the trigger-related fields differ, meaning the clock has to be re-armed.
     */
    public boolean triggerChanged(JobSpec other) {
        return !Objects.equals(startTime, other.startTime)
                || !Objects.equals(stopTime, other.stopTime)
                || !Objects.equals(frequency, other.frequency)
                || !Objects.equals(days, other.days);
    }

    public static Builder program(String name) {
        return new Builder(name, JobKind.PROGRAM);
    }

    public static Builder task(String name) {
        return new Builder(name, JobKind.TASK);
    }

    public static final class Builder {
        private final String name;
        private final JobKind kind;
        private String handler = DEFAULT_HANDLER;
        private final List<String> command = new ArrayList<>();
        private final Map<String, String> options = new LinkedHashMap<>();
        private Path logFile;
        private Duration timeout;
        private boolean keepAlive;
        private Duration checkInterval = DEFAULT_CHECK_INTERVAL;
        private int maxRetries;
        private boolean runOnStart = true;
        private TimeOfDay startTime;
        private TimeOfDay stopTime;
        private Duration frequency;
        private final Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        private final List<String> runOnComplete = new ArrayList<>();

        private Builder(String name, JobKind kind) {
            this.name = name;
            this.kind = kind;
        }

        public Builder handler(String handler) {
            this.handler = handler;
            return this;
        }

        public Builder command(List<String> command) {
            this.command.clear();
            if (command != null) {
                this.command.addAll(command);
            }
            return this;
        }

        public Builder command(String... argv) {
            return command(List.of(argv));
        }

        public Builder option(String key, String value) {
            this.options.put(key, value);
            return this;
        }

        public Builder options(Map<String, String> options) {
            this.options.clear();
            if (options != null) {
                this.options.putAll(options);
            }
            return this;
        }

        public Builder logFile(Path logFile) {
            this.logFile = logFile;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder keepAlive(boolean keepAlive) {
            this.keepAlive = keepAlive;
            return this;
        }

        public Builder checkInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder runOnStart(boolean runOnStart) {
            this.runOnStart = runOnStart;
            return this;
        }

        public Builder startTime(TimeOfDay startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder stopTime(TimeOfDay stopTime) {
            this.stopTime = stopTime;
            return this;
        }

        public Builder frequency(Duration frequency) {
            this.frequency = frequency;
            return this;
        }

        public Builder days(Set<DayOfWeek> days) {
            this.days.clear();
            if (days != null) {
                this.days.addAll(days);
            }
            return this;
        }

        public Builder runOnComplete(List<String> names) {
            this.runOnComplete.clear();
            if (names != null) {
                this.runOnComplete.addAll(names);
            }
            return this;
        }

        public Builder runOnComplete(String... names) {
            return runOnComplete(List.of(names));
        }

        public JobSpec build() {
            return new JobSpec(name, kind, handler, command, options, logFile, timeout,
                    keepAlive, checkInterval, maxRetries, runOnStart,
                    startTime, stopTime, frequency, days, runOnComplete);
        }
    }
}
