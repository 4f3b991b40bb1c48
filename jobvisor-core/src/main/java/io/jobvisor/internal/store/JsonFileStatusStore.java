package io.jobvisor.internal.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.jobvisor.core.JobStatus;
import io.jobvisor.core.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One {@code <dir>/<name>.json} file per job. Each write goes to a temp file that is then moved over
 * the target, so a reader sees either the old or the new snapshot.
 */
public class JsonFileStatusStore implements StatusStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileStatusStore.class);
    private static final String SUFFIX = ".json";

    private final Path dir;
    private final ObjectMapper objectMapper;

    public JsonFileStatusStore(Path dir) {
        this(dir, new ObjectMapper());
    }

    public JsonFileStatusStore(Path dir, ObjectMapper objectMapper) {
        this.dir = Objects.requireNonNull(dir, "dir must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null").copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void write(JobStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        Path target = fileFor(status.name());
        try {
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, "." + status.name() + "-", ".tmp");
            try {
                objectMapper.writeValue(tmp.toFile(), status);
                try {
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write status of '" + status.name() + "' to " + target, e);
        }
    }

    @Override
    public Optional<JobStatus> read(String name) {
        Path file = fileFor(name);
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), JobStatus.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            throw new UncheckedIOException("failed to read status file " + file, e);
        }
    }

    /**
     * Unreadable files are logged and skipped.
     */
    @Override
    public Map<String, JobStatus> readAll() {
        Map<String, JobStatus> statuses = new HashMap<>();
        if (!Files.isDirectory(dir)) {
            return statuses;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path file : files) {
                try {
                    JobStatus status = objectMapper.readValue(file.toFile(), JobStatus.class);
                    statuses.put(status.name(), status);
                } catch (IOException | RuntimeException e) {
                    log.warn("jobvisor skipping unreadable status file path={} msg={}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to list status directory " + dir, e);
        }
        return statuses;
    }

    @Override
    public void delete(String name) {
        try {
            Files.deleteIfExists(fileFor(name));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to delete status of '" + name + "'", e);
        }
    }

    private Path fileFor(String name) {
        return dir.resolve(name + SUFFIX);
    }
}
