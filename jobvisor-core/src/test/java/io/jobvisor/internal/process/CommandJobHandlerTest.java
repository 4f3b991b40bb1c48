package io.jobvisor.internal.process;

import io.jobvisor.JobProcess;
import io.jobvisor.config.SchedulerProperties;
import io.jobvisor.core.JobHandlerRegistry;
import io.jobvisor.core.JobKind;
import io.jobvisor.core.JobSpec;
import io.jobvisor.core.JobState;
import io.jobvisor.core.JobStatus;
import io.jobvisor.core.LaunchException;
import io.jobvisor.core.ScheduleGraph;
import io.jobvisor.core.Trigger;
import io.jobvisor.internal.DefaultScheduler;
import io.jobvisor.internal.LoggingJobNotifier;
import io.jobvisor.internal.store.InMemoryStatusStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class CommandJobHandlerTest {

    @TempDir
    Path dir;

    @Test
    void exitCodeShouldBeReported() throws Exception {
        CommandJobHandler handler = new CommandJobHandler(dir);
        JobProcess process = handler.start(JobSpec.task("fail").command("sh", "-c", "exit 3").build());

        assertThat(process.onExit().get(10, TimeUnit.SECONDS)).isEqualTo(3);
        assertThat(process.isAlive()).isFalse();
    }

    @Test
    void outputShouldBeAppendedToTheLogFile() throws Exception {
        CommandJobHandler handler = new CommandJobHandler(dir.resolve("logs"));
        JobSpec spec = JobSpec.task("echo").command("sh", "-c", "echo out-$GREETING; echo err 1>&2")
                .option("env.GREETING", "hello").build();

        handler.start(spec).onExit().get(10, TimeUnit.SECONDS);
        handler.start(spec).onExit().get(10, TimeUnit.SECONDS);

        String log = Files.readString(dir.resolve("logs").resolve("echo.log"));
        assertThat(log.split("\n")).containsExactly("out-hello", "err", "out-hello", "err");
    }

    @Test
    void workingDirectoryOptionShouldApply() throws Exception {
        Path work = Files.createDirectory(dir.resolve("work"));
        Path logFile = dir.resolve("pwd.log");
        CommandJobHandler handler = new CommandJobHandler(dir);
        JobSpec spec = JobSpec.task("pwd").command("sh", "-c", "touch marker")
                .option("cwd", work.toString()).logFile(logFile).build();

        assertThat(handler.start(spec).onExit().get(10, TimeUnit.SECONDS)).isZero();
        assertThat(Files.exists(work.resolve("marker"))).isTrue();
        assertThat(Files.exists(logFile)).isTrue();
    }

    @Test
    void missingExecutableShouldFailTheLaunch() {
        CommandJobHandler handler = new CommandJobHandler(dir);

        assertThatThrownBy(() -> handler.start(JobSpec.task("nope").command("/nonexistent/jobvisor-binary").build()))
                .isInstanceOf(LaunchException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void stopShouldTerminateAndAttachShouldAdoptLiveProcesses() throws Exception {
        CommandJobHandler handler = new CommandJobHandler(dir);
        JobSpec spec = JobSpec.program("sleeper").command("sleep", "30").build();
        JobProcess process = handler.start(spec);

        JobProcess attached = handler.attach(spec, process.pid(), Instant.now()).orElseThrow();
        assertThat(attached.pid()).isEqualTo(process.pid());
        assertThat(handler.isAlive(spec, attached)).isTrue();

        handler.stop(spec, process, Duration.ofSeconds(2));

        process.onExit().get(10, TimeUnit.SECONDS);
        assertThat(process.isAlive()).isFalse();
        assertThat(handler.attach(spec, process.pid(), Instant.now())).isEmpty();
    }

    @Test
    void attachShouldRejectAPidWhoseProcessStartedAtAnotherTime() throws Exception {
        CommandJobHandler handler = new CommandJobHandler(dir);
        JobSpec spec = JobSpec.program("sleeper").command("sleep", "30").build();
        JobProcess process = handler.start(spec);
        try {
            assertThat(handler.attach(spec, process.pid(), Instant.parse("2020-01-01T00:00:00Z"))).isEmpty();
            assertThat(handler.attach(spec, process.pid(), null)).isEmpty();
            assertThat(handler.attach(spec, process.pid(), Instant.now())).isPresent();
        } finally {
            handler.stop(spec, process, Duration.ofSeconds(2));
        }
    }

    @Test
    void restartShouldNotAdoptOrStopAnUnrelatedProcessHoldingARecordedPid() throws Exception {
        Process unrelated = new ProcessBuilder("sleep", "30").start();
        InMemoryStatusStore store = new InMemoryStatusStore();
        Instant longAgo = Instant.parse("2020-01-01T00:00:00Z");
        store.write(new JobStatus("svc", JobKind.PROGRAM, JobState.RUNNING, unrelated.pid(), longAgo, null, null, 0,
                null, longAgo, false, Trigger.SUPERVISOR, null, null, longAgo));
        JobSpec spec = JobSpec.program("svc").command("sleep", "30").keepAlive(true).build();
        DefaultScheduler scheduler = new DefaultScheduler(new SchedulerProperties(),
                () -> ScheduleGraph.of(List.of(spec)), store,
                new JobHandlerRegistry(List.of(new CommandJobHandler(dir))), new LoggingJobNotifier(),
                Clock.systemUTC(), null);
        try {
            scheduler.initialize();
            assertThat(scheduler.status("svc").orElseThrow().pid()).isNotEqualTo(unrelated.pid());

            scheduler.stop("svc");

            assertThat(scheduler.status("svc").orElseThrow().state()).isEqualTo(JobState.STOPPED);
            assertThat(unrelated.isAlive()).isTrue();
        } finally {
            unrelated.destroy();
            scheduler.stop();
        }
    }

    @Test
    void tcpProbeShouldRequireAnOpenPort() throws Exception {
        TcpProbeJobHandler handler = new TcpProbeJobHandler(dir);
        try (ServerSocket server = new ServerSocket(0)) {
            JobSpec spec = JobSpec.program("api").command("sleep", "30")
                    .options(Map.of("port", String.valueOf(server.getLocalPort()), "connectTimeoutMs", "500")).build();
            JobProcess process = handler.start(spec);
            try {
                assertThat(handler.isAlive(spec, process)).isTrue();
                server.close();
                assertThat(handler.isAlive(spec, process)).isFalse();
            } finally {
                handler.stop(spec, process, Duration.ofSeconds(2));
            }
        }
    }

    @Test
    void tcpProbeValidationShouldReportBadOptions() {
        TcpProbeJobHandler handler = new TcpProbeJobHandler(dir);

        assertThat(handler.validate(JobSpec.program("a").command("x").build()))
                .containsExactly("job 'a' uses tcp-probe without options.port");
        assertThat(handler.validate(JobSpec.program("b").command("x").option("port", "70000").build()))
                .containsExactly("job 'b' has invalid options.port '70000'");
        assertThat(handler.validate(JobSpec.program("c").command("x").option("port", "8080").build())).isEmpty();
    }

    @Test
    void tcpProbeShouldAcceptPaddedOptionsItValidated() throws Exception {
        TcpProbeJobHandler handler = new TcpProbeJobHandler(dir);
        try (ServerSocket server = new ServerSocket(0)) {
            JobSpec spec = JobSpec.program("api").command("sleep", "30")
                    .options(Map.of("port", " " + server.getLocalPort() + " ", "connectTimeoutMs", " 500")).build();
            assertThat(handler.validate(spec)).isEmpty();
            JobProcess process = handler.start(spec);
            try {
                assertThat(handler.isAlive(spec, process)).isTrue();
            } finally {
                handler.stop(spec, process, Duration.ofSeconds(2));
            }
        }
    }
}
