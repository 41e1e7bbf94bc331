package io.cronjob4j;

import io.cronjob4j.config.SchedulerProperties;
import io.cronjob4j.core.ExecutionRecord;
import io.cronjob4j.core.JobDefinition;
import io.cronjob4j.core.JobStore;
import io.cronjob4j.errors.DuplicateJobNameException;
import io.cronjob4j.errors.InvalidCronExpressionException;
import io.cronjob4j.errors.InvalidJobDefinitionException;
import io.cronjob4j.errors.JobNotFoundException;
import io.cronjob4j.utils.CronTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Management operations on job definitions: the surface an HTTP layer or application code calls.
 *
 * <p>Every write validates the definition and keeps {@code nextRunAt} consistent with the cron
 * expression and the {@code enabled} flag. Tracking fields are never taken from the caller.
 */
public class JobDefinitionService {
    private static final Logger log = LoggerFactory.getLogger(JobDefinitionService.class);

    private final JobStore jobStore;
    private final CronTrigger cronTrigger;
    private final SchedulerProperties props;

    public JobDefinitionService(JobStore jobStore, SchedulerProperties props) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.cronTrigger = new CronTrigger(props.zoneId());
    }

    /**
     * A builder prefilled with the configured defaults. Nothing is persisted.
     */
    public JobDefinition.Builder newDefinition(String name, String taskType, String cronExpression) {
        SchedulerProperties.Defaults defaults = props.getDefaults();
        return JobDefinition.builder()
                .name(name)
                .taskType(taskType)
                .cronExpression(cronExpression)
                .timeout(defaults.getTimeout())
                .maxRetries(defaults.getMaxRetries())
                .retryDelay(defaults.getRetryDelay())
                .retryBackoffMultiplier(defaults.getRetryBackoffMultiplier());
    }

    public JobDefinition create(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        validate(job);

        Instant next = job.enabled() ? cronTrigger.next(job.cronExpression(), nowInstant()) : null;
        JobDefinition saved = jobStore.create(job.toBuilder()
                .nextRunAt(next)
                .lastRunAt(null)
                .lastRunStatus(null)
                .build());

        log.info("cronjob definition created name={} id={} cron={} nextRunAt={}",
                saved.name(), saved.id(), saved.cronExpression(), saved.nextRunAt());
        return saved;
    }

    /**
     * Create the definition unless one with the same name exists; the existing one is returned unchanged.
     */
    public JobDefinition registerIfAbsent(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        Optional<JobDefinition> existing = jobStore.findByName(job.name());
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            return create(job);
        } catch (DuplicateJobNameException e) {
            return jobStore.findByName(job.name()).orElseThrow(() -> e);
        }
    }

    public JobDefinition get(String id) {
        return jobStore.findById(id).orElseThrow(() -> new JobNotFoundException("id", id));
    }

    public JobDefinition getByName(String name) {
        return jobStore.findByName(name).orElseThrow(() -> new JobNotFoundException("name", name));
    }

    public List<JobDefinition> list() {
        return jobStore.findAll();
    }

    /**
     * Replace the configuration of an existing definition. {@code nextRunAt} is recomputed when the cron
     * expression changes or the job becomes enabled, and cleared when it is disabled.
     */
    public JobDefinition update(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        if (job.id() == null) {
            throw new InvalidJobDefinitionException(List.of("id must not be null"));
        }
        JobDefinition existing = get(job.id());
        validate(job);

        Instant next;
        if (!job.enabled()) {
            next = null;
        } else if (!job.cronExpression().equals(existing.cronExpression()) || existing.nextRunAt() == null) {
            next = cronTrigger.next(job.cronExpression(), nowInstant());
        } else {
            next = existing.nextRunAt();
        }

        JobDefinition saved = jobStore.update(job.toBuilder().nextRunAt(next).build());
        log.info("cronjob definition updated name={} id={} enabled={} nextRunAt={}",
                saved.name(), saved.id(), saved.enabled(), saved.nextRunAt());
        return saved;
    }

    /**
     * Delete a definition together with its execution history.
     */
    public void delete(String id) {
        JobDefinition existing = get(id);
        if (!jobStore.delete(id)) {
            throw new JobNotFoundException("id", id);
        }
        log.info("cronjob definition deleted name={} id={}", existing.name(), id);
    }

    public JobDefinition pause(String id) {
        JobDefinition existing = get(id);
        jobStore.setEnabled(id, false, null);
        log.info("cronjob definition paused name={} id={}", existing.name(), id);
        return get(id);
    }

    public JobDefinition resume(String id) {
        JobDefinition existing = get(id);
        Instant next = cronTrigger.next(existing.cronExpression(), nowInstant());
        jobStore.setEnabled(id, true, next);
        log.info("cronjob definition resumed name={} id={} nextRunAt={}", existing.name(), id, next);
        return get(id);
    }

    /**
     * Execution history of one job, newest first.
     */
    public List<ExecutionRecord> listExecutions(String jobId, int limit, int offset) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        get(jobId);
        return jobStore.findExecutions(jobId, limit, offset);
    }

    /**
     * @throws InvalidJobDefinitionException   when a field constraint is violated
     * @throws InvalidCronExpressionException when every other field is valid but the cron expression is not
     */
    public void validate(JobDefinition job) {
        List<String> violations = new ArrayList<>();
        if (isBlank(job.name())) {
            violations.add("name must not be blank");
        }
        if (isBlank(job.taskType())) {
            violations.add("taskType must not be blank");
        }
        if (isBlank(job.cronExpression())) {
            violations.add("cronExpression must not be blank");
        }
        if (job.maxConcurrent() != null) {
            if (job.maxConcurrent() <= 0) {
                violations.add("maxConcurrent must be a positive number");
            }
            if (!job.allowConcurrent()) {
                violations.add("maxConcurrent requires allowConcurrent");
            }
        }
        if (job.maxRetries() < 0) {
            violations.add("maxRetries must not be negative");
        }
        if (!isPositive(job.retryDelay())) {
            violations.add("retryDelay must be a positive duration");
        }
        if (Double.isNaN(job.retryBackoffMultiplier()) || job.retryBackoffMultiplier() < 1.0) {
            violations.add("retryBackoffMultiplier must be at least 1.0");
        }
        if (!isPositive(job.timeout())) {
            violations.add("timeout must be a positive duration");
        }
        if (!violations.isEmpty()) {
            throw new InvalidJobDefinitionException(violations);
        }
        cronTrigger.validate(job.cronExpression());
    }

    /**
     * Utility: current service time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isZero() && !d.isNegative();
    }
}
