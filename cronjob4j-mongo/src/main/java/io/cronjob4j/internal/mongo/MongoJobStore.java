package io.cronjob4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.cronjob4j.core.ExecutionRecord;
import io.cronjob4j.core.JobDefinition;
import io.cronjob4j.core.JobStatus;
import io.cronjob4j.core.JobStore;
import io.cronjob4j.errors.DuplicateJobNameException;
import io.cronjob4j.errors.JobNotFoundException;
import io.cronjob4j.errors.PersistenceException;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for job definitions and execution records.
 *
 * <p>Collections:
 * <ul>
 *   <li>{@code scheduled_jobs}: one document per definition, unique by {@code name}</li>
 *   <li>{@code job_executions}: append-only attempt history, keyed by a monotonic long id</li>
 *   <li>{@code cronjob_counters}: sequence documents backing the execution ids</li>
 * </ul>
 *
 * <p>Spring {@link DataAccessException}s are rethrown as {@link PersistenceException}; unique-index
 * violations on {@code name} become {@link DuplicateJobNameException}.
 */
public class MongoJobStore implements JobStore {

    public static final String COUNTERS_COLLECTION = "cronjob_counters";
    static final String EXECUTION_SEQUENCE = "job_executions";

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /* ================= definitions ================= */

    @Override
    public JobDefinition create(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(job.name(), "job.name must not be null");

        return execute("create", () -> {
            if (mongoTemplate.exists(byName(job.name()), ScheduledJobDocument.class)) {
                throw new DuplicateJobNameException(job.name());
            }
            Instant now = nowInstant();
            ScheduledJobDocument doc = toDocument(job);
            doc.setId(job.id());
            doc.setCreatedAt(now);
            doc.setUpdatedAt(now);
            try {
                return toDefinition(mongoTemplate.insert(doc));
            } catch (DuplicateKeyException e) {
                throw new DuplicateJobNameException(job.name(), e);
            }
        });
    }

    @Override
    public Optional<JobDefinition> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return execute("findById", () ->
                Optional.ofNullable(mongoTemplate.findById(id, ScheduledJobDocument.class)).map(this::toDefinition));
    }

    @Override
    public Optional<JobDefinition> findByName(String name) {
        return execute("findByName", () ->
                Optional.ofNullable(mongoTemplate.findOne(byName(name), ScheduledJobDocument.class)).map(this::toDefinition));
    }

    @Override
    public List<JobDefinition> findAll() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("name")));
        return execute("findAll", () ->
                mongoTemplate.find(q, ScheduledJobDocument.class).stream().map(this::toDefinition).toList());
    }

    @Override
    public List<JobDefinition> findEnabled() {
        Query q = new Query(Criteria.where("enabled").is(true)).with(Sort.by(Sort.Order.asc("name")));
        return execute("findEnabled", () ->
                mongoTemplate.find(q, ScheduledJobDocument.class).stream().map(this::toDefinition).toList());
    }

    /**
     * Enabled definitions with {@code nextRunAt <= now}, earliest first. Served by {@code idx_due}.
     */
    @Override
    public List<JobDefinition> dueJobs(Instant now, int limit) {
        Objects.requireNonNull(now, "now must not be null");
        if (limit <= 0) {
            return List.of();
        }
        Query q = new Query(Criteria.where("enabled").is(true).and("nextRunAt").ne(null).lte(now))
                .with(Sort.by(Sort.Order.asc("nextRunAt")))
                .limit(limit);
        return execute("dueJobs", () ->
                mongoTemplate.find(q, ScheduledJobDocument.class).stream().map(this::toDefinition).toList());
    }

    @Override
    public JobDefinition update(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(job.id(), "job.id must not be null");

        Update u = new Update()
                .set("name", job.name())
                .set("taskType", job.taskType())
                .set("cronExpression", job.cronExpression())
                .set("enabled", job.enabled())
                .set("allowConcurrent", job.allowConcurrent())
                .set("maxConcurrent", job.maxConcurrent())
                .set("maxRetries", job.maxRetries())
                .set("retryDelayMillis", toMillis(job.retryDelay()))
                .set("retryBackoffMultiplier", job.retryBackoffMultiplier())
                .set("timeoutMillis", toMillis(job.timeout()))
                .set("payload", job.payload())
                .set("description", job.description())
                .set("createdBy", job.createdBy())
                .set("nextRunAt", job.nextRunAt())
                .set("updatedAt", nowInstant());

        return execute("update", () -> {
            ScheduledJobDocument sameName = mongoTemplate.findOne(byName(job.name()), ScheduledJobDocument.class);
            if (sameName != null && !sameName.getId().equals(job.id())) {
                throw new DuplicateJobNameException(job.name());
            }
            ScheduledJobDocument updated;
            try {
                updated = mongoTemplate.findAndModify(byId(job.id()), u,
                        FindAndModifyOptions.options().returnNew(true), ScheduledJobDocument.class);
            } catch (DuplicateKeyException e) {
                throw new DuplicateJobNameException(job.name(), e);
            }
            if (updated == null) {
                throw new JobNotFoundException("id", job.id());
            }
            return toDefinition(updated);
        });
    }

    /**
     * Delete the definition, then its executions.
     */
    @Override
    public boolean delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return execute("delete", () -> {
            long deleted = mongoTemplate.remove(byId(id), ScheduledJobDocument.class).getDeletedCount();
            if (deleted == 0) {
                return false;
            }
            mongoTemplate.remove(new Query(Criteria.where("jobId").is(id)), JobExecutionDocument.class);
            return true;
        });
    }

    @Override
    public boolean updateSchedule(String jobId, Instant expectedNextRunAt, Instant nextRunAt) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Query q = new Query(Criteria.where("_id").is(jobId).and("nextRunAt").is(expectedNextRunAt));
        Update u = new Update().set("nextRunAt", nextRunAt);
        return execute("updateSchedule", () ->
                mongoTemplate.updateFirst(q, u, ScheduledJobDocument.class).getMatchedCount() > 0);
    }

    @Override
    public void disableScheduling(String jobId) {
        setEnabled(jobId, false, null);
    }

    @Override
    public void setEnabled(String jobId, boolean enabled, Instant nextRunAt) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Update u = new Update()
                .set("enabled", enabled)
                .set("nextRunAt", nextRunAt)
                .set("updatedAt", nowInstant());
        execute("setEnabled", () -> mongoTemplate.updateFirst(byId(jobId), u, ScheduledJobDocument.class));
    }

    @Override
    public void updateLastRun(String jobId, Instant lastRunAt, JobStatus status) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Update u = new Update()
                .set("lastRunAt", lastRunAt)
                .set("lastRunStatus", status == null ? null : status.name());
        execute("updateLastRun", () -> mongoTemplate.updateFirst(byId(jobId), u, ScheduledJobDocument.class));
    }

    /* ================= executions ================= */

    @Override
    public ExecutionRecord recordExecution(ExecutionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        return execute("recordExecution", () -> {
            JobExecutionDocument doc = toDocument(record);
            doc.setId(nextSequence(EXECUTION_SEQUENCE));
            return toRecord(mongoTemplate.insert(doc));
        });
    }

    @Override
    public boolean completeExecution(long id,
                                     Instant completedAt,
                                     JobStatus status,
                                     String errorMessage,
                                     Map<String, Object> errorDetails,
                                     Map<String, Object> result) {
        Objects.requireNonNull(status, "status must not be null");
        Query q = new Query(Criteria.where("_id").is(id).and("status").is(JobStatus.RUNNING.name()));
        Update u = new Update()
                .set("completedAt", completedAt)
                .set("status", status.name())
                .set("errorMessage", errorMessage)
                .set("errorDetails", errorDetails)
                .set("result", result);
        return execute("completeExecution", () ->
                mongoTemplate.updateFirst(q, u, JobExecutionDocument.class).getModifiedCount() > 0);
    }

    @Override
    public Optional<ExecutionRecord> findExecution(long id) {
        return execute("findExecution", () ->
                Optional.ofNullable(mongoTemplate.findById(id, JobExecutionDocument.class)).map(this::toRecord));
    }

    @Override
    public List<ExecutionRecord> findExecutions(String jobId, int limit, int offset) {
        if (limit <= 0) {
            return List.of();
        }
        Query q = new Query(Criteria.where("jobId").is(jobId))
                .with(Sort.by(Sort.Order.desc("startedAt"), Sort.Order.desc("_id")))
                .skip(Math.max(0, offset))
                .limit(limit);
        return execute("findExecutions", () ->
                mongoTemplate.find(q, JobExecutionDocument.class).stream().map(this::toRecord).toList());
    }

    @Override
    public List<ExecutionRecord> findExecutionsByStatus(JobStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        Query q = new Query(Criteria.where("status").is(status.name()))
                .with(Sort.by(Sort.Order.asc("_id")));
        return execute("findExecutionsByStatus", () ->
                mongoTemplate.find(q, JobExecutionDocument.class).stream().map(this::toRecord).toList());
    }

    @Override
    public long cancelRunningExecutions(Instant completedAt, String reason) {
        Query q = new Query(Criteria.where("status").is(JobStatus.RUNNING.name()));
        Update u = new Update()
                .set("status", JobStatus.CANCELLED.name())
                .set("completedAt", completedAt)
                .set("errorMessage", reason);
        return execute("cancelRunningExecutions", () -> {
            UpdateResult r = mongoTemplate.updateMulti(q, u, JobExecutionDocument.class);
            return r.getModifiedCount();
        });
    }

    @Override
    public long deleteExecutionsOlderThan(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        Query q = new Query(Criteria.where("startedAt").lt(cutoff)
                .and("status").nin(JobStatus.RUNNING.name(), JobStatus.PENDING.name()));
        return execute("deleteExecutionsOlderThan", () ->
                mongoTemplate.remove(q, JobExecutionDocument.class).getDeletedCount());
    }

    /**
     * Utility: current store time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    /**
     * Atomically increment and return the named sequence, creating it on first use.
     */
    long nextSequence(String name) {
        Query q = new Query(Criteria.where("_id").is(name));
        Update u = new Update().inc("seq", 1L);
        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true).upsert(true);
        Document counter = mongoTemplate.findAndModify(q, u, options, Document.class, COUNTERS_COLLECTION);
        if (counter == null) {
            throw new IllegalStateException("sequence " + name + " was not created");
        }
        return ((Number) counter.get("seq")).longValue();
    }

    /* ================= mapping ================= */

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private static Query byName(String name) {
        return new Query(Criteria.where("name").is(name));
    }

    private ScheduledJobDocument toDocument(JobDefinition job) {
        ScheduledJobDocument doc = new ScheduledJobDocument();
        doc.setName(job.name());
        doc.setTaskType(job.taskType());
        doc.setCronExpression(job.cronExpression());
        doc.setEnabled(job.enabled());
        doc.setAllowConcurrent(job.allowConcurrent());
        doc.setMaxConcurrent(job.maxConcurrent());
        doc.setMaxRetries(job.maxRetries());
        doc.setRetryDelayMillis(toMillis(job.retryDelay()));
        doc.setRetryBackoffMultiplier(job.retryBackoffMultiplier());
        doc.setTimeoutMillis(toMillis(job.timeout()));
        doc.setPayload(job.payload());
        doc.setDescription(job.description());
        doc.setCreatedBy(job.createdBy());
        doc.setLastRunAt(job.lastRunAt());
        doc.setLastRunStatus(job.lastRunStatus());
        doc.setNextRunAt(job.nextRunAt());
        return doc;
    }

    private JobDefinition toDefinition(ScheduledJobDocument doc) {
        return JobDefinition.builder()
                .id(doc.getId())
                .name(doc.getName())
                .taskType(doc.getTaskType())
                .cronExpression(doc.getCronExpression())
                .enabled(doc.isEnabled())
                .allowConcurrent(doc.isAllowConcurrent())
                .maxConcurrent(doc.getMaxConcurrent())
                .maxRetries(doc.getMaxRetries())
                .retryDelay(Duration.ofMillis(doc.getRetryDelayMillis()))
                .retryBackoffMultiplier(doc.getRetryBackoffMultiplier())
                .timeout(Duration.ofMillis(doc.getTimeoutMillis()))
                .payload(doc.getPayload())
                .description(doc.getDescription())
                .createdBy(doc.getCreatedBy())
                .lastRunAt(doc.getLastRunAt())
                .lastRunStatus(doc.getLastRunStatus())
                .nextRunAt(doc.getNextRunAt())
                .createdAt(doc.getCreatedAt())
                .updatedAt(doc.getUpdatedAt())
                .build();
    }

    private JobExecutionDocument toDocument(ExecutionRecord record) {
        JobExecutionDocument doc = new JobExecutionDocument();
        doc.setJobId(record.jobId());
        doc.setJobName(record.jobName());
        doc.setExecutionId(record.executionId().toString());
        doc.setStartedAt(record.startedAt());
        doc.setCompletedAt(record.completedAt());
        doc.setStatus(record.status());
        doc.setRetryAttempt(record.retryAttempt());
        doc.setErrorMessage(record.errorMessage());
        doc.setErrorDetails(record.errorDetails());
        doc.setResult(record.result());
        return doc;
    }

    private ExecutionRecord toRecord(JobExecutionDocument doc) {
        return new ExecutionRecord(
                doc.getId(),
                doc.getJobId(),
                doc.getJobName(),
                UUID.fromString(doc.getExecutionId()),
                doc.getStartedAt(),
                doc.getCompletedAt(),
                doc.getStatus(),
                doc.getRetryAttempt(),
                doc.getErrorMessage(),
                doc.getErrorDetails(),
                doc.getResult()
        );
    }

    private static long toMillis(Duration d) {
        return d == null ? 0L : d.toMillis();
    }

    private static <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new PersistenceException("mongo " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
