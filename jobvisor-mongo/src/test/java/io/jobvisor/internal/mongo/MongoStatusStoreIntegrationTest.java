package io.jobvisor.internal.mongo;

import com.mongodb.client.MongoClients;
import io.jobvisor.JobHandler;
import io.jobvisor.JobProcess;
import io.jobvisor.config.SchedulerProperties;
import io.jobvisor.core.FailureReason;
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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoStatusStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoStatusStore store;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "jobvisor_test");
        mongoTemplate.dropCollection(StatusDocument.class);
        store = new MongoStatusStore(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(StatusDocument.class);
    }

    @Test
    void writeShouldReplaceTheSingleDocumentOfAJob() {
        store.write(JobStatus.idle("backup", JobKind.TASK, T0));
        store.write(running("backup", JobKind.TASK, 4242L));

        assertEquals(1, mongoTemplate.count(new Query(), StatusDocument.class));
        JobStatus stored = store.read("backup").orElseThrow();
        assertEquals(JobState.RUNNING, stored.state());
        assertEquals(4242L, stored.pid());
        assertEquals(Trigger.CLOCK, stored.lastTrigger());
        assertEquals(T0.truncatedTo(ChronoUnit.MILLIS), stored.lastStartTime());
    }

    @Test
    void readAllAndDeleteShouldTrackJobsByName() {
        store.write(JobStatus.idle("mongo", JobKind.PROGRAM, T0));
        store.write(JobStatus.idle("update-fx-data", JobKind.TASK, T0));

        Map<String, JobStatus> all = store.readAll();
        assertEquals(2, all.size());
        assertEquals(JobKind.PROGRAM, all.get("mongo").kind());

        store.delete("mongo");

        assertFalse(store.read("mongo").isPresent());
        assertTrue(store.read("update-fx-data").isPresent());
        assertEquals(1, store.readAll().size());
    }

    @Test
    void findByStateShouldReturnMatchingJobsNewestFirst() {
        store.write(running("a", JobKind.TASK, 1L));
        store.write(new JobStatus("b", JobKind.TASK, JobState.RUNNING, 2L, T0, null, null, 0,
                null, null, false, Trigger.CASCADE, null, null, T0.plusSeconds(30)));
        store.write(JobStatus.idle("c", JobKind.TASK, T0));

        List<JobStatus> runningJobs = store.findByState(JobState.RUNNING);

        assertEquals(List.of("b", "a"), runningJobs.stream().map(JobStatus::name).toList());
    }

    @Test
    void schedulerShouldMarkTaskRunningAtShutdownAsAbandonedOnRestart() {
        store.write(running("nightly-report", JobKind.TASK, 999_999L));
        store.write(JobStatus.idle("retired-job", JobKind.TASK, T0));

        ScheduleGraph graph = ScheduleGraph.of(List.of(
                JobSpec.task("nightly-report").command("true").build()
        ));
        ExecutorService workers = Executors.newSingleThreadExecutor();
        try {
            DefaultScheduler scheduler = new DefaultScheduler(new SchedulerProperties(), () -> graph, store,
                    new JobHandlerRegistry(List.of(new NoopHandler())), new LoggingJobNotifier(),
                    Clock.fixed(T0, ZoneOffset.UTC), workers);
            scheduler.initialize();

            JobStatus replayed = store.read("nightly-report").orElseThrow();
            assertEquals(JobState.FAILED, replayed.state());
            assertEquals(FailureReason.ABANDONED, replayed.failureReason());
            assertNull(replayed.pid());
            assertFalse(store.read("retired-job").isPresent());
        } finally {
            workers.shutdownNow();
        }
    }

    private static JobStatus running(String name, JobKind kind, Long pid) {
        return new JobStatus(name, kind, JobState.RUNNING, pid, T0, null, null, 0,
                null, null, false, Trigger.CLOCK, null, null, T0);
    }

    static class NoopHandler implements JobHandler {
        @Override
        public String name() {
            return JobSpec.DEFAULT_HANDLER;
        }

        @Override
        public JobProcess start(JobSpec spec) throws LaunchException {
            throw new LaunchException("not used in this test");
        }
    }
}
