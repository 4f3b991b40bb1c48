package io.jobvisor.internal.process;

import io.jobvisor.JobHandler;
import io.jobvisor.JobProcess;
import io.jobvisor.core.JobSpec;
import io.jobvisor.core.LaunchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the job's argv as a local child process with stdout and stderr appended to its log file.
 *
 * <p>Options: {@code cwd} sets the working directory, {@code env.NAME} adds an environment variable.
 */
public class CommandJobHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(CommandJobHandler.class);

    public static final String NAME = "command";
    static final String OPTION_CWD = "cwd";
    static final String OPTION_ENV_PREFIX = "env.";
    static final Duration START_TOLERANCE = Duration.ofSeconds(5);

    private final Path logDir;

    public CommandJobHandler(Path logDir) {
        this.logDir = Objects.requireNonNull(logDir, "logDir must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JobProcess start(JobSpec spec) throws LaunchException {
        if (spec.command().isEmpty()) {
            throw new LaunchException("job '" + spec.name() + "' has no command");
        }
        Path logFile = logFileFor(spec);
        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ProcessBuilder builder = new ProcessBuilder(spec.command())
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
            String cwd = spec.options().get(OPTION_CWD);
            if (cwd != null) {
                builder.directory(Path.of(cwd).toFile());
            }
            for (Map.Entry<String, String> e : spec.options().entrySet()) {
                if (e.getKey().startsWith(OPTION_ENV_PREFIX)) {
                    builder.environment().put(e.getKey().substring(OPTION_ENV_PREFIX.length()), e.getValue());
                }
            }
            Process process = builder.start();
            log.debug("jobvisor process launched name={} pid={} logFile={}", spec.name(), process.pid(), logFile);
            return new LocalJobProcess(process);
        } catch (IOException | RuntimeException e) {
            throw new LaunchException("failed to launch '" + spec.name() + "': " + e.getMessage(), e);
        }
    }

    /**
     * Adopts {@code pid} only while it is alive and the OS reports it started within
     * {@link #START_TOLERANCE} of {@code startedAt}.
     */
    @Override
    public Optional<JobProcess> attach(JobSpec spec, long pid, Instant startedAt) {
        if (startedAt == null) {
            return Optional.empty();
        }
        return ProcessHandle.of(pid)
                .filter(ProcessHandle::isAlive)
                .filter(handle -> startedNear(spec, handle, startedAt))
                .map(AttachedJobProcess::new);
    }

    private static boolean startedNear(JobSpec spec, ProcessHandle handle, Instant startedAt) {
        Optional<Instant> actual = handle.info().startInstant();
        if (actual.isEmpty()) {
            log.warn("jobvisor cannot read start time, not re-attaching name={} pid={}", spec.name(), handle.pid());
            return false;
        }
        if (Duration.between(actual.get(), startedAt).abs().compareTo(START_TOLERANCE) > 0) {
            log.warn("jobvisor pid reused by another process, not re-attaching name={} pid={} startedAt={} processStart={}",
                    spec.name(), handle.pid(), startedAt, actual.get());
            return false;
        }
        return true;
    }

    @Override
    public List<String> validate(JobSpec spec) {
        List<String> problems = new ArrayList<>();
        if (spec.command().isEmpty()) {
            problems.add("job '" + spec.name() + "' has no command or main_path");
        }
        return problems;
    }

    Path logFileFor(JobSpec spec) {
        return spec.logFile() != null ? spec.logFile() : logDir.resolve(spec.name() + ".log");
    }
}
