package io.cronjob4j.internal;

import io.cronjob4j.core.ExecutionRecord;
import io.cronjob4j.core.JobDefinition;
import io.cronjob4j.core.JobStatus;
import io.cronjob4j.core.JobStore;
import io.cronjob4j.errors.DuplicateJobNameException;
import io.cronjob4j.errors.JobNotFoundException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Non-durable {@link JobStore} for single-process use and tests. All state is lost with the process.
 */
public class InMemoryJobStore implements JobStore {

    private static final Comparator<ExecutionRecord> NEWEST_FIRST =
            Comparator.comparing(ExecutionRecord::startedAt).thenComparingLong(ExecutionRecord::id).reversed();

    private final Map<String, JobDefinition> jobs = new LinkedHashMap<>();
    private final Map<Long, ExecutionRecord> executions = new LinkedHashMap<>();
    private long executionSeq = 0;

    @Override
    public synchronized JobDefinition create(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(job.name(), "job.name must not be null");
        if (findByNameInternal(job.name()) != null) {
            throw new DuplicateJobNameException(job.name());
        }
        String id = job.id() != null ? job.id() : UUID.randomUUID().toString();
        if (jobs.containsKey(id)) {
            throw new IllegalArgumentException("job id already in use: " + id);
        }
        Instant now = nowInstant();
        JobDefinition saved = job.toBuilder()
                .id(id)
                .createdAt(now)
                .updatedAt(now)
                .build();
        jobs.put(id, saved);
        return saved;
    }

    @Override
    public synchronized Optional<JobDefinition> findById(String id) {
        return Optional.ofNullable(id == null ? null : jobs.get(id));
    }

    @Override
    public synchronized Optional<JobDefinition> findByName(String name) {
        return Optional.ofNullable(findByNameInternal(name));
    }

    @Override
    public synchronized List<JobDefinition> findAll() {
        List<JobDefinition> all = new ArrayList<>(jobs.values());
        all.sort(Comparator.comparing(JobDefinition::name));
        return all;
    }

    @Override
    public synchronized List<JobDefinition> findEnabled() {
        return jobs.values().stream()
                .filter(JobDefinition::enabled)
                .sorted(Comparator.comparing(JobDefinition::name))
                .toList();
    }

    @Override
    public synchronized List<JobDefinition> dueJobs(Instant now, int limit) {
        return jobs.values().stream()
                .filter(JobDefinition::enabled)
                .filter(j -> j.nextRunAt() != null && !j.nextRunAt().isAfter(now))
                .sorted(Comparator.comparing(JobDefinition::nextRunAt))
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public synchronized JobDefinition update(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        JobDefinition existing = jobs.get(job.id());
        if (existing == null) {
            throw new JobNotFoundException("id", job.id());
        }
        JobDefinition sameName = findByNameInternal(job.name());
        if (sameName != null && !sameName.id().equals(job.id())) {
            throw new DuplicateJobNameException(job.name());
        }
        JobDefinition saved = job.toBuilder()
                .lastRunAt(existing.lastRunAt())
                .lastRunStatus(existing.lastRunStatus())
                .createdAt(existing.createdAt())
                .updatedAt(nowInstant())
                .build();
        jobs.put(saved.id(), saved);
        return saved;
    }

    @Override
    public synchronized boolean delete(String id) {
        if (jobs.remove(id) == null) {
            return false;
        }
        executions.values().removeIf(e -> e.jobId().equals(id));
        return true;
    }

    @Override
    public synchronized boolean updateSchedule(String jobId, Instant expectedNextRunAt, Instant nextRunAt) {
        JobDefinition job = jobs.get(jobId);
        if (job == null || !Objects.equals(job.nextRunAt(), expectedNextRunAt)) {
            return false;
        }
        jobs.put(jobId, job.toBuilder().nextRunAt(nextRunAt).build());
        return true;
    }

    @Override
    public synchronized void disableScheduling(String jobId) {
        setEnabled(jobId, false, null);
    }

    @Override
    public synchronized void setEnabled(String jobId, boolean enabled, Instant nextRunAt) {
        JobDefinition job = jobs.get(jobId);
        if (job == null) {
            return;
        }
        jobs.put(jobId, job.toBuilder().enabled(enabled).nextRunAt(nextRunAt).updatedAt(nowInstant()).build());
    }

    @Override
    public synchronized void updateLastRun(String jobId, Instant lastRunAt, JobStatus status) {
        JobDefinition job = jobs.get(jobId);
        if (job == null) {
            return;
        }
        jobs.put(jobId, job.toBuilder().lastRunAt(lastRunAt).lastRunStatus(status).build());
    }

    @Override
    public synchronized ExecutionRecord recordExecution(ExecutionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        boolean duplicate = executions.values().stream()
                .anyMatch(e -> e.executionId().equals(record.executionId()));
        if (duplicate) {
            throw new IllegalArgumentException("executionId already recorded: " + record.executionId());
        }
        ExecutionRecord saved = record.withId(++executionSeq);
        executions.put(saved.id(), saved);
        return saved;
    }

    @Override
    public synchronized boolean completeExecution(long id,
                                                  Instant completedAt,
                                                  JobStatus status,
                                                  String errorMessage,
                                                  Map<String, Object> errorDetails,
                                                  Map<String, Object> result) {
        ExecutionRecord existing = executions.get(id);
        if (existing == null || !existing.isRunning()) {
            return false;
        }
        executions.put(id, existing.complete(completedAt, status, errorMessage, errorDetails, result));
        return true;
    }

    @Override
    public synchronized Optional<ExecutionRecord> findExecution(long id) {
        return Optional.ofNullable(executions.get(id));
    }

    @Override
    public synchronized List<ExecutionRecord> findExecutions(String jobId, int limit, int offset) {
        return executions.values().stream()
                .filter(e -> e.jobId().equals(jobId))
                .sorted(NEWEST_FIRST)
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public synchronized List<ExecutionRecord> findExecutionsByStatus(JobStatus status) {
        return select(e -> e.status() == status);
    }

    @Override
    public synchronized long cancelRunningExecutions(Instant completedAt, String reason) {
        long changed = 0;
        for (ExecutionRecord e : select(ExecutionRecord::isRunning)) {
            executions.put(e.id(), e.complete(completedAt, JobStatus.CANCELLED, reason, null, null));
            changed++;
        }
        return changed;
    }

    @Override
    public synchronized long deleteExecutionsOlderThan(Instant cutoff) {
        List<ExecutionRecord> old = select(e -> e.status().isTerminal() && e.startedAt().isBefore(cutoff));
        old.forEach(e -> executions.remove(e.id()));
        return old.size();
    }

    /**
     * Utility: current store time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    private JobDefinition findByNameInternal(String name) {
        for (JobDefinition job : jobs.values()) {
            if (job.name().equals(name)) {
                return job;
            }
        }
        return null;
    }

    private List<ExecutionRecord> select(Predicate<ExecutionRecord> filter) {
        return executions.values().stream()
                .filter(filter)
                .sorted(Comparator.comparingLong(ExecutionRecord::id))
                .toList();
    }
}
