package io.jobvisor.internal;

import io.jobvisor.core.ConfigException;
import io.jobvisor.core.JobHandlerRegistry;
import io.jobvisor.core.JobKind;
import io.jobvisor.core.JobSpec;
import io.jobvisor.core.ScheduleGraph;
import io.jobvisor.internal.process.BuiltInHandlers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleLoaderTest {

    @TempDir
    Path dir;

    private Path scheduleFile;
    private ScheduleLoader loader;

    @BeforeEach
    void setUp() {
        scheduleFile = dir.resolve("schedule.json");
        loader = new ScheduleLoader(scheduleFile, ZoneOffset.UTC,
                new JobHandlerRegistry(BuiltInHandlers.create(dir.resolve("logs"))));
    }

    @Test
    void shouldParseProgramsTasksAndAliases() throws IOException {
        write("""
                { "schedules": [
                  { "type": "program", "name": "mongo", "command": ["mongod", "--dbpath", "/data"],
                    "keep_alive": true, "check_alive_freq": "30 s", "max_retries": 3,
                    "handler": "tcp-probe", "options": {"host": "localhost", "port": 27017},
                    "start_time": "06:00 am pst", "end": "11:00 pm pst" },
                  { "type": "task", "name": "update-prices", "main_path": "/opt/jobs/update.py",
                    "interpreter": "python3", "start": "12:45 am", "freq": "1 h", "stop": "03:00 am",
                    "days": ["Mon", "Fri"], "timeout": "30 m", "run_on_complete": ["update-fx"] },
                  { "type": "task", "name": "update-fx", "command": "python3 /opt/jobs/fx.py --all" }
                ]}
                """);

        ScheduleGraph graph = loader.load();

        JobSpec mongo = graph.find("mongo").orElseThrow();
        assertThat(mongo.kind()).isEqualTo(JobKind.PROGRAM);
        assertThat(mongo.command()).containsExactly("mongod", "--dbpath", "/data");
        assertThat(mongo.keepAlive()).isTrue();
        assertThat(mongo.checkInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(mongo.maxRetries()).isEqualTo(3);
        assertThat(mongo.handler()).isEqualTo("tcp-probe");
        assertThat(mongo.options()).containsEntry("port", "27017");
        assertThat(mongo.startTime().zone()).isEqualTo(ZoneId.of("America/Los_Angeles"));
        assertThat(mongo.stopTime().time()).isEqualTo(LocalTime.of(23, 0));

        JobSpec prices = graph.find("update-prices").orElseThrow();
        assertThat(prices.command()).containsExactly("python3", "/opt/jobs/update.py");
        assertThat(prices.startTime().time()).isEqualTo(LocalTime.of(0, 45));
        assertThat(prices.startTime().zone()).isEqualTo(ZoneOffset.UTC);
        assertThat(prices.frequency()).isEqualTo(Duration.ofHours(1));
        assertThat(prices.days()).containsExactlyInAnyOrder(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);
        assertThat(prices.timeout()).isEqualTo(Duration.ofMinutes(30));
        assertThat(prices.runOnStart()).isTrue();

        assertThat(graph.find("update-fx").orElseThrow().command())
                .containsExactly("python3", "/opt/jobs/fx.py", "--all");
        assertThat(graph.triggeredBy("update-fx")).containsExactly("update-prices");
        assertThat(graph.digest()).hasSize(64);
    }

    @Test
    void shouldCollectEveryProblemInOneException() throws IOException {
        write("""
                { "schedules": [
                  { "type": "task", "name": "a", "command": "true", "freq": "5 m" },
                  { "type": "task", "name": "b", "start": "26:00" },
                  { "type": "cron", "name": "c", "command": "true" },
                  { "type": "task", "name": "d", "command": "true", "handler": "carrier-pigeon" },
                  { "type": "program", "name": "e", "command": "true", "max_retries": -1 },
                  { "type": "task", "name": "bad name", "command": "true" },
                  { "type": "program", "name": "f", "command": "true", "handler": "tcp-probe" }
                ]}
                """);

        assertThatThrownBy(loader::load)
                .isInstanceOfSatisfying(ConfigException.class, e -> assertThat(e.problems())
                        .anyMatch(p -> p.contains("job 'a'") && p.contains("freq requires a start time"))
                        .anyMatch(p -> p.contains("job 'b'") && p.contains("Hour must be 0-23"))
                        .anyMatch(p -> p.contains("job 'c'") && p.contains("Unsupported job type"))
                        .anyMatch(p -> p.contains("job 'd'") && p.contains("unknown handler 'carrier-pigeon'"))
                        .anyMatch(p -> p.contains("job 'e'") && p.contains("max_retries"))
                        .anyMatch(p -> p.contains("job 'bad name'") && p.contains("invalid name"))
                        .anyMatch(p -> p.contains("job 'f'") && p.contains("options.port")));
    }

    @Test
    void shouldReportGraphProblemsAlongsideFieldProblems() throws IOException {
        write("""
                { "schedules": [
                  { "type": "task", "name": "a", "command": "true", "run_on_complete": ["b"] },
                  { "type": "task", "name": "b", "command": "true", "run_on_complete": ["a"] },
                  { "type": "task", "name": "c", "command": "true", "timeout": "forever" }
                ]}
                """);

        assertThatThrownBy(loader::load)
                .isInstanceOfSatisfying(ConfigException.class, e -> assertThat(e.problems())
                        .anyMatch(p -> p.contains("job 'c'"))
                        .anyMatch(p -> p.contains("dependency cycle a -> b -> a")));
    }

    @Test
    void shouldRejectUnreadableOrMalformedFile() throws IOException {
        assertThatThrownBy(loader::load).isInstanceOf(ConfigException.class).hasMessageContaining("cannot read");

        write("{ \"jobs\": [] }");
        assertThatThrownBy(loader::load).isInstanceOf(ConfigException.class).hasMessageContaining("'schedules' array");
    }

    @Test
    void digestShouldIgnoreKeyOrderButNotContent() throws IOException {
        write("{ \"schedules\": [ { \"type\": \"task\", \"name\": \"a\", \"command\": \"true\" } ] }");
        String first = loader.load().digest();

        write("{ \"schedules\": [ { \"command\": \"true\", \"name\": \"a\", \"type\": \"task\" } ] }");
        assertThat(loader.load().digest()).isEqualTo(first);

        write("{ \"schedules\": [ { \"type\": \"task\", \"name\": \"a\", \"command\": \"false\" } ] }");
        assertThat(loader.load().digest()).isNotEqualTo(first);
    }

    private void write(String json) throws IOException {
        Files.writeString(scheduleFile, json);
    }
}
