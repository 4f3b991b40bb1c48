package io.jobvisor.internal.store;

import io.jobvisor.core.FailureReason;
import io.jobvisor.core.JobKind;
import io.jobvisor.core.JobState;
import io.jobvisor.core.JobStatus;
import io.jobvisor.core.Trigger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileStatusStoreTest {

    private static final Instant AT = Instant.parse("2026-03-02T09:15:00Z");

    @TempDir
    Path dir;

    @Test
    void writeShouldReplaceTheSnapshotInPlace() {
        JsonFileStatusStore store = new JsonFileStatusStore(dir.resolve("status"));

        store.write(JobStatus.idle("feed", JobKind.PROGRAM, AT));
        JobStatus running = new JobStatus("feed", JobKind.PROGRAM, JobState.RUNNING, 321L, AT, null, 1, 2,
                null, AT, false, Trigger.SUPERVISOR, FailureReason.LIVENESS_CHECK, "liveness check failed", AT);
        store.write(running);

        assertThat(store.read("feed")).contains(running);
        assertThat(dir.resolve("status").toFile().list()).containsExactly("feed.json");
    }

    @Test
    void datesShouldBeWrittenAsIsoStrings() throws Exception {
        JsonFileStatusStore store = new JsonFileStatusStore(dir);
        store.write(JobStatus.idle("report", JobKind.TASK, AT));

        assertThat(Files.readString(dir.resolve("report.json"))).contains("\"2026-03-02T09:15:00Z\"");
    }

    @Test
    void missingStatusShouldReadAsEmpty() {
        JsonFileStatusStore store = new JsonFileStatusStore(dir.resolve("never-created"));

        assertThat(store.read("ghost")).isEmpty();
        assertThat(store.readAll()).isEmpty();
    }

    @Test
    void readAllShouldSkipUnreadableFiles() throws Exception {
        JsonFileStatusStore store = new JsonFileStatusStore(dir);
        store.write(JobStatus.idle("a", JobKind.TASK, AT));
        store.write(JobStatus.idle("b", JobKind.PROGRAM, AT));
        Files.writeString(dir.resolve("broken.json"), "{ not json");
        Files.writeString(dir.resolve("notes.txt"), "ignored");

        Map<String, JobStatus> all = store.readAll();

        assertThat(all).containsOnlyKeys("a", "b");
        assertThat(all.get("b").kind()).isEqualTo(JobKind.PROGRAM);
    }

    @Test
    void deleteShouldRemoveTheFileAndIgnoreMissingOnes() {
        JsonFileStatusStore store = new JsonFileStatusStore(dir);
        store.write(JobStatus.idle("a", JobKind.TASK, AT));

        store.delete("a");
        store.delete("a");

        assertThat(store.read("a")).isEmpty();
        assertThat(Files.exists(dir.resolve("a.json"))).isFalse();
    }
}
