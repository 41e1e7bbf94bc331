package io.cronjob4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One attempt of a {@link JobDefinition}.
 *
 * <p>Records are append-only. The only write after creation is the completion of a {@code RUNNING} record,
 * which fills {@code completedAt}, {@code status}, error fields and {@code result}. {@code jobName} is copied
 * from the definition so the audit trail survives renames.
 */
public record ExecutionRecord(
        long id,
        String jobId,
        String jobName,
        UUID executionId,
        Instant startedAt,
        Instant completedAt,
        JobStatus status,
        int retryAttempt,
        String errorMessage,
        Map<String, Object> errorDetails,
        Map<String, Object> result
) {
    public ExecutionRecord {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (retryAttempt < 0) {
            throw new IllegalArgumentException("retryAttempt must not be negative");
        }
        errorDetails = errorDetails == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(errorDetails));
        result = result == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    /**
     * A new RUNNING record, not yet persisted (id 0).
     */
    public static ExecutionRecord running(JobDefinition job, UUID executionId, int retryAttempt, Instant startedAt) {
        return new ExecutionRecord(0L, job.id(), job.name(), executionId, startedAt, null,
                JobStatus.RUNNING, retryAttempt, null, null, null);
    }

    /**
     * Wall time between start and completion, or null while still running.
     */
    public Duration duration() {
        if (completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }

    public boolean isRunning() {
        return status == JobStatus.RUNNING;
    }

    public ExecutionRecord withId(long newId) {
        return new ExecutionRecord(newId, jobId, jobName, executionId, startedAt, completedAt,
                status, retryAttempt, errorMessage, errorDetails, result);
    }

    public ExecutionRecord complete(Instant completedAt,
                                    JobStatus status,
                                    String errorMessage,
                                    Map<String, Object> errorDetails,
                                    Map<String, Object> result) {
        return new ExecutionRecord(id, jobId, jobName, executionId, startedAt, completedAt,
                status, retryAttempt, errorMessage, errorDetails, result);
    }
}
