package io.cronjob4j.core;

import io.cronjob4j.errors.DuplicateJobNameException;
import io.cronjob4j.errors.JobNotFoundException;
import io.cronjob4j.errors.PersistenceException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable repository of job definitions and their execution records.
 *
 * <p>Every method may throw {@link PersistenceException} when the backing store fails.
 * Implementations must be safe for use from the scheduler loop and worker threads at the same time.
 */
public interface JobStore {

    /* ================= definitions ================= */

    /**
     * Insert a new definition. The store assigns {@code id}, {@code createdAt} and {@code updatedAt}.
     *
     * @throws DuplicateJobNameException when a definition with the same name exists
     */
    JobDefinition create(JobDefinition job);

    Optional<JobDefinition> findById(String id);

    Optional<JobDefinition> findByName(String name);

    List<JobDefinition> findAll();

    List<JobDefinition> findEnabled();

    /**
     * Enabled definitions whose {@code nextRunAt <= now}, earliest first.
     */
    List<JobDefinition> dueJobs(Instant now, int limit);

    /**
     * Replace the configuration fields and {@code nextRunAt} of an existing definition and bump
     * {@code updatedAt}. Tracking fields ({@code lastRunAt}, {@code lastRunStatus}) and {@code createdAt}
     * are kept.
     *
     * @throws JobNotFoundException      when no definition has {@code job.id()}
     * @throws DuplicateJobNameException when renaming onto an existing name
     */
    JobDefinition update(JobDefinition job);

    /**
     * Delete a definition and all of its execution records.
     *
     * @return true if a definition was deleted
     */
    boolean delete(String id);

    /**
     * Compare-and-set of {@code nextRunAt}: applies only while the stored value still equals
     * {@code expectedNextRunAt} (null matches an unset value).
     *
     * @return true if this call moved the schedule
     */
    boolean updateSchedule(String jobId, Instant expectedNextRunAt, Instant nextRunAt);

    /**
     * Stop scheduling a job: {@code enabled=false}, {@code nextRunAt} cleared.
     */
    void disableScheduling(String jobId);

    /**
     * Set {@code enabled} and {@code nextRunAt} together (pause / resume).
     */
    void setEnabled(String jobId, boolean enabled, Instant nextRunAt);

    void updateLastRun(String jobId, Instant lastRunAt, JobStatus status);

    /* ================= executions ================= */

    /**
     * Append an execution record. The store assigns a monotonic {@code id}.
     */
    ExecutionRecord recordExecution(ExecutionRecord record);

    /**
     * Complete a RUNNING record. Records in any other status are left untouched.
     *
     * @return true if the record was RUNNING and is now completed
     */
    boolean completeExecution(long id,
                              Instant completedAt,
                              JobStatus status,
                              String errorMessage,
                              Map<String, Object> errorDetails,
                              Map<String, Object> result);

    Optional<ExecutionRecord> findExecution(long id);

    /**
     * Execution history of a job, newest first.
     */
    List<ExecutionRecord> findExecutions(String jobId, int limit, int offset);

    List<ExecutionRecord> findExecutionsByStatus(JobStatus status);

    /**
     * Mark every RUNNING record as CANCELLED. Used at startup to close attempts orphaned by a previous process.
     *
     * @return number of records changed
     */
    long cancelRunningExecutions(Instant completedAt, String reason);

    /**
     * Delete execution records started before {@code cutoff} that are no longer running.
     *
     * @return number of records deleted
     */
    long deleteExecutionsOlderThan(Instant cutoff);
}
