package io.cronjob4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.cronjob4j.TaskFactory;
import io.cronjob4j.TaskOutput;
import io.cronjob4j.Task;
import io.cronjob4j.config.SchedulerProperties;
import io.cronjob4j.core.ConcurrencyGovernor;
import io.cronjob4j.core.ExecutionRecord;
import io.cronjob4j.core.JobDefinition;
import io.cronjob4j.core.JobStatus;
import io.cronjob4j.core.TaskRegistry;
import io.cronjob4j.errors.DuplicateJobNameException;
import io.cronjob4j.errors.JobNotFoundException;
import io.cronjob4j.internal.PollingJobScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "cronjob4j_test");
        dropCollections();
        jobStore = new MongoJobStore(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        dropCollections();
    }

    @Test
    void createShouldAssignIdAndRejectDuplicateName() {
        JobDefinition saved = jobStore.create(newJob("email-sync", Instant.now().plusSeconds(60)));

        assertNotNull(saved.id());
        assertNotNull(saved.createdAt());
        assertEquals(saved.createdAt(), saved.updatedAt());
        assertEquals(Map.of("to", "ops@example.com"), saved.payload());
        assertEquals(Duration.ofSeconds(30), saved.timeout());

        assertThrows(DuplicateJobNameException.class,
                () -> jobStore.create(newJob("email-sync", Instant.now().plusSeconds(60))));
        assertEquals(1, jobStore.findAll().size());
    }

    @Test
    void dueJobsShouldReturnEnabledJobsInOrder() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        jobStore.create(newJob("later", now.minusSeconds(5)));
        jobStore.create(newJob("earlier", now.minusSeconds(30)));
        jobStore.create(newJob("future", now.plusSeconds(60)));
        jobStore.create(newJob("paused", now.minusSeconds(60)).toBuilder().enabled(false).build());
        jobStore.create(newJob("unscheduled", null));

        List<JobDefinition> due = jobStore.dueJobs(now, 10);

        assertEquals(List.of("earlier", "later"), due.stream().map(JobDefinition::name).toList());
        assertEquals(1, jobStore.dueJobs(now, 1).size());
    }

    @Test
    void updateScheduleShouldOnlyApplyForExpectedValue() {
        Instant next = Instant.now().truncatedTo(ChronoUnit.MILLIS).minusSeconds(1);
        JobDefinition job = jobStore.create(newJob("claim-me", next));
        Instant following = next.plusSeconds(3600);

        assertTrue(jobStore.updateSchedule(job.id(), job.nextRunAt(), following));
        assertFalse(jobStore.updateSchedule(job.id(), job.nextRunAt(), following.plusSeconds(60)));
        assertEquals(following, jobStore.findById(job.id()).orElseThrow().nextRunAt());
    }

    @Test
    void updateShouldKeepTrackingFieldsAndRejectRename() {
        JobDefinition first = jobStore.create(newJob("first", Instant.now().plusSeconds(60)));
        jobStore.create(newJob("second", Instant.now().plusSeconds(60)));
        Instant ranAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        jobStore.updateLastRun(first.id(), ranAt, JobStatus.SUCCESS);

        JobDefinition updated = jobStore.update(jobStore.findById(first.id()).orElseThrow().toBuilder()
                .description("changed")
                .maxRetries(7)
                .build());

        assertEquals("changed", updated.description());
        assertEquals(7, updated.maxRetries());
        assertEquals(ranAt, updated.lastRunAt());
        assertEquals(JobStatus.SUCCESS, updated.lastRunStatus());

        assertThrows(DuplicateJobNameException.class,
                () -> jobStore.update(updated.toBuilder().name("second").build()));
        assertThrows(JobNotFoundException.class,
                () -> jobStore.update(updated.toBuilder().id("000000000000000000000000").name("third").build()));
    }

    @Test
    void setEnabledShouldClearAndRestoreSchedule() {
        JobDefinition job = jobStore.create(newJob("toggle", Instant.now().plusSeconds(60)));

        jobStore.setEnabled(job.id(), false, null);
        JobDefinition paused = jobStore.findById(job.id()).orElseThrow();
        assertFalse(paused.enabled());
        assertNull(paused.nextRunAt());

        Instant next = Instant.now().plusSeconds(120).truncatedTo(ChronoUnit.MILLIS);
        jobStore.setEnabled(job.id(), true, next);
        JobDefinition resumed = jobStore.findById(job.id()).orElseThrow();
        assertTrue(resumed.enabled());
        assertEquals(next, resumed.nextRunAt());
    }

    @Test
    void executionsShouldGetIncreasingIdsAndCompleteOnlyOnce() {
        JobDefinition job = jobStore.create(newJob("history", Instant.now().plusSeconds(60)));
        Instant started = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        ExecutionRecord first = jobStore.recordExecution(ExecutionRecord.running(job, UUID.randomUUID(), 0, started));
        ExecutionRecord second = jobStore.recordExecution(
                ExecutionRecord.running(job, UUID.randomUUID(), 1, started.plusSeconds(1)));
        assertTrue(second.id() > first.id());

        assertTrue(jobStore.completeExecution(first.id(), started.plusSeconds(2), JobStatus.SUCCESS,
                null, null, Map.of("rows", 3)));
        assertFalse(jobStore.completeExecution(first.id(), started.plusSeconds(3), JobStatus.FAILED,
                "late", null, null));

        ExecutionRecord done = jobStore.findExecution(first.id()).orElseThrow();
        assertEquals(JobStatus.SUCCESS, done.status());
        assertEquals(Map.of("rows", 3), done.result());
        assertEquals(Duration.ofSeconds(2), done.duration());

        List<ExecutionRecord> page = jobStore.findExecutions(job.id(), 10, 0);
        assertEquals(List.of(second.id(), first.id()), page.stream().map(ExecutionRecord::id).toList());
        assertEquals(1, jobStore.findExecutions(job.id(), 10, 1).size());
    }

    @Test
    void cancelRunningExecutionsShouldCloseOrphans() {
        JobDefinition job = jobStore.create(newJob("orphan", Instant.now().plusSeconds(60)));
        ExecutionRecord running = jobStore.recordExecution(
                ExecutionRecord.running(job, UUID.randomUUID(), 0, Instant.now()));

        assertEquals(1, jobStore.cancelRunningExecutions(Instant.now(), "restarted"));

        ExecutionRecord cancelled = jobStore.findExecution(running.id()).orElseThrow();
        assertEquals(JobStatus.CANCELLED, cancelled.status());
        assertEquals("restarted", cancelled.errorMessage());
        assertNotNull(cancelled.completedAt());
        assertTrue(jobStore.findExecutionsByStatus(JobStatus.RUNNING).isEmpty());
    }

    @Test
    void deleteExecutionsOlderThanShouldKeepRunningRecords() {
        JobDefinition job = jobStore.create(newJob("retention", Instant.now().plusSeconds(60)));
        Instant old = Instant.now().minus(Duration.ofDays(40));
        ExecutionRecord finished = jobStore.recordExecution(ExecutionRecord.running(job, UUID.randomUUID(), 0, old));
        jobStore.completeExecution(finished.id(), old.plusSeconds(1), JobStatus.FAILED, "boom", null, null);
        ExecutionRecord stuck = jobStore.recordExecution(ExecutionRecord.running(job, UUID.randomUUID(), 0, old));
        ExecutionRecord fresh = jobStore.recordExecution(
                ExecutionRecord.running(job, UUID.randomUUID(), 0, Instant.now()));
        jobStore.completeExecution(fresh.id(), Instant.now(), JobStatus.SUCCESS, null, null, null);

        assertEquals(1, jobStore.deleteExecutionsOlderThan(Instant.now().minus(Duration.ofDays(30))));

        assertTrue(jobStore.findExecution(finished.id()).isEmpty());
        assertTrue(jobStore.findExecution(stuck.id()).isPresent());
        assertTrue(jobStore.findExecution(fresh.id()).isPresent());
    }

    @Test
    void deleteShouldCascadeToExecutions() {
        JobDefinition job = jobStore.create(newJob("doomed", Instant.now().plusSeconds(60)));
        jobStore.recordExecution(ExecutionRecord.running(job, UUID.randomUUID(), 0, Instant.now()));

        assertTrue(jobStore.delete(job.id()));
        assertFalse(jobStore.delete(job.id()));
        assertTrue(jobStore.findById(job.id()).isEmpty());
        assertTrue(jobStore.findExecutions(job.id(), 10, 0).isEmpty());
    }

    @Test
    void schedulerShouldRunDueJobAgainstMongo() throws Exception {
        SchedulerProperties props = new SchedulerProperties();
        props.setPollInterval(Duration.ofMillis(100));
        props.setShutdownGracePeriod(Duration.ofSeconds(1));

        TaskFactory<Void> echo = new TaskFactory<>() {
            @Override
            public String taskType() {
                return "echo";
            }

            @Override
            public Class<Void> payloadClass() {
                return Void.class;
            }

            @Override
            public Task create(Void payload) {
                return ctx -> TaskOutput.of(Map.of("job", ctx.jobName()));
            }
        };

        JobDefinition job = jobStore.create(JobDefinition.builder()
                .name("mongo-echo")
                .taskType("echo")
                .cronExpression("0 0 1 1 *")
                .nextRunAt(Instant.now().minusSeconds(1))
                .build());

        try (PollingJobScheduler scheduler = new PollingJobScheduler(props, jobStore,
                new TaskRegistry(List.of(echo), new ObjectMapper()), new ConcurrencyGovernor())) {
            scheduler.start();

            assertTrue(waitUntil(10, TimeUnit.SECONDS,
                    () -> jobStore.findById(job.id()).orElseThrow().lastRunStatus() == JobStatus.SUCCESS));
        }

        List<ExecutionRecord> history = jobStore.findExecutions(job.id(), 10, 0);
        assertEquals(1, history.size());
        assertEquals(Map.of("job", "mongo-echo"), history.get(0).result());
        assertTrue(jobStore.findById(job.id()).orElseThrow().nextRunAt().isAfter(Instant.now()));
    }

    private void dropCollections() {
        mongoTemplate.dropCollection(ScheduledJobDocument.class);
        mongoTemplate.dropCollection(JobExecutionDocument.class);
        mongoTemplate.dropCollection(MongoJobStore.COUNTERS_COLLECTION);
    }

    private static JobDefinition newJob(String name, Instant nextRunAt) {
        return JobDefinition.builder()
                .name(name)
                .taskType("email")
                .cronExpression("*/5 * * * *")
                .timeout(Duration.ofSeconds(30))
                .put("to", "ops@example.com")
                .nextRunAt(nextRunAt)
                .build();
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return condition.getAsBoolean();
    }
}
