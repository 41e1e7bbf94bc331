package io.cronjob4j.internal;

import io.cronjob4j.CancellationToken;
import io.cronjob4j.JobScheduler;
import io.cronjob4j.Task;
import io.cronjob4j.TaskContext;
import io.cronjob4j.config.SchedulerProperties;
import io.cronjob4j.core.ConcurrencyGovernor;
import io.cronjob4j.core.ExecutionOutcome;
import io.cronjob4j.core.ExecutionRecord;
import io.cronjob4j.core.JobDefinition;
import io.cronjob4j.core.JobExecutor;
import io.cronjob4j.core.JobStatus;
import io.cronjob4j.core.JobStore;
import io.cronjob4j.core.RetryDecision;
import io.cronjob4j.core.RetryPolicy;
import io.cronjob4j.core.TaskRegistry;
import io.cronjob4j.errors.InvalidCronExpressionException;
import io.cronjob4j.errors.PayloadDecodeException;
import io.cronjob4j.errors.UnknownTaskTypeException;
import io.cronjob4j.utils.CronTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the {@link JobStore} for due definitions and runs them on a bounded worker pool.
 *
 * <p>Per tick, for every due job:
 * <ol>
 *   <li>compute the next cron fire time and claim it with a compare-and-set on {@code nextRunAt}</li>
 *   <li>ask the {@link ConcurrencyGovernor} for a slot (rejection skips this trigger)</li>
 *   <li>build the task through the {@link TaskRegistry} (failure is recorded as FAILED, never retried)</li>
 *   <li>hand the attempt to a worker, which records RUNNING, runs it through the {@link JobExecutor},
 *       releases the slot and either schedules a retry or writes the terminal status</li>
 * </ol>
 *
 * <p>Retries do not go through cron. They wait in a delay queue and re-acquire a slot when due; a retry
 * whose slot is taken waits another poll interval.
 *
 * <p>Typical usage:
 * <pre>{@code
 * JobScheduler scheduler = new PollingJobScheduler(props, store, registry, new ConcurrencyGovernor());
 * scheduler.start();
 * ...
 * scheduler.stop();
 * }</pre>
 */
public class PollingJobScheduler implements JobScheduler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PollingJobScheduler.class);

    static final String SHUTDOWN_REASON = "scheduler shutting down";
    static final String RECOVERY_REASON = "scheduler restarted while execution was running";

    private final SchedulerProperties props;
    private final JobStore jobStore;
    private final TaskRegistry taskRegistry;
    private final ConcurrencyGovernor governor;
    private final JobExecutor executor;
    private final RetryPolicy retryPolicy;
    private final CronTrigger cronTrigger;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean accepting = false;

    private volatile ExecutorService workerPool;

    private Thread pollerThread;
    private Thread retryDispatcherThread;

    private final DelayQueue<PendingRetry> retryQueue = new DelayQueue<>();
    private final ConcurrentHashMap<UUID, Attempt> inFlight = new ConcurrentHashMap<>();

    private int systemErrorCount = 0;

    /**
     * A running attempt. {@code finished} decides whether normal completion or a shutdown cancel writes
     * the terminal status.
     */
    private static final class Attempt {
        private final JobDefinition job;
        private final UUID executionId = UUID.randomUUID();
        private final int retryAttempt;
        private final CancellationToken token = new CancellationToken();
        private final AtomicBoolean finished = new AtomicBoolean(false);
        private volatile long recordId;

        private Attempt(JobDefinition job, int retryAttempt) {
            this.job = job;
            this.retryAttempt = retryAttempt;
        }
    }

    private static final class PendingRetry implements Delayed {
        private final String jobId;
        private final String jobName;
        private final int retryAttempt;
        private final JobStatus previousStatus;
        private final Instant previousCompletedAt;
        private final long dueNanos;

        private PendingRetry(String jobId,
                             String jobName,
                             int retryAttempt,
                             JobStatus previousStatus,
                             Instant previousCompletedAt,
                             Duration delay) {
            this.jobId = jobId;
            this.jobName = jobName;
            this.retryAttempt = retryAttempt;
            this.previousStatus = previousStatus;
            this.previousCompletedAt = previousCompletedAt;
            this.dueNanos = saturatedAdd(System.nanoTime(), delay.toNanos());
        }

        private PendingRetry postpone(Duration delay) {
            return new PendingRetry(jobId, jobName, retryAttempt, previousStatus, previousCompletedAt, delay);
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(dueNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof PendingRetry o) {
                return Long.compare(this.dueNanos - o.dueNanos, 0L);
            }
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
        }

        private static long saturatedAdd(long a, long b) {
            long r = a + b;
            if (((a ^ r) & (b ^ r)) < 0) {
                return Long.MAX_VALUE;
            }
            return r;
        }
    }

    public PollingJobScheduler(SchedulerProperties props,
                               JobStore jobStore,
                               TaskRegistry taskRegistry,
                               ConcurrencyGovernor governor) {
        this(props, jobStore, taskRegistry, governor, new JobExecutor(), new RetryPolicy());
    }

    public PollingJobScheduler(SchedulerProperties props,
                               JobStore jobStore,
                               TaskRegistry taskRegistry,
                               ConcurrencyGovernor governor,
                               JobExecutor executor,
                               RetryPolicy retryPolicy) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.taskRegistry = Objects.requireNonNull(taskRegistry, "taskRegistry must not be null");
        this.governor = Objects.requireNonNull(governor, "governor must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.cronTrigger = new CronTrigger(props.zoneId());
    }

    /**
     * Recover orphaned executions, initialise missing fire times and start polling. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            props.validate();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        log.info("cronjob scheduler starting with pollInterval={}, maxConcurrency={}, batchSize={}, timezone={}, shutdownGracePeriod={}",
                props.getPollInterval(),
                props.getMaxConcurrency(),
                props.getBatchSize(),
                props.getTimezone(),
                props.getShutdownGracePeriod());

        governor.clear();
        recover();

        accepting = true;
        systemErrorCount = 0;

        AtomicInteger workerSeq = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
            Thread t = new Thread(r);
            t.setName("cronjob4j.worker-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        retryDispatcherThread = new Thread(this::retryDispatchLoop);
        retryDispatcherThread.setName("cronjob4j.retry-dispatcher");
        retryDispatcherThread.setDaemon(true);
        retryDispatcherThread.start();

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("cronjob4j.poller");
        pollerThread.setDaemon(true);
        pollerThread.start();

        log.info("cronjob scheduler started successfully.");
    }

    /**
     * Stop polling and retry dispatch, drop queued work, wait up to the grace period for running attempts
     * and cancel whatever is still running. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("cronjob scheduler stopping...");
        accepting = false;

        stopThread(pollerThread);
        pollerThread = null;
        stopThread(retryDispatcherThread);
        retryDispatcherThread = null;

        finalizePendingRetries();

        ExecutorService pool = workerPool;
        workerPool = null;
        if (pool != null) {
            pool.shutdown();
            try {
                Duration grace = props.getShutdownGracePeriod();
                if (!pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("cronjob grace period elapsed; cancelling running executions count={}", inFlight.size());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }

            for (Attempt attempt : List.copyOf(inFlight.values())) {
                cancelAttempt(attempt);
            }
            pool.shutdownNow();
        }

        // a worker may have queued a retry while shutdown was in progress
        finalizePendingRetries();
        inFlight.clear();
        governor.clear();
        log.info("cronjob scheduler stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    /**
     * Stop, then release the task threads of the executor. The scheduler cannot be restarted afterwards.
     */
    @Override
    public void close() {
        stop();
        executor.close();
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    /* ================= startup ================= */

    private void recover() {
        Instant now = nowInstant();
        try {
            long cancelled = jobStore.cancelRunningExecutions(now, "Execution cancelled: " + RECOVERY_REASON);
            if (cancelled > 0) {
                log.warn("cronjob recovered orphaned executions count={}", cancelled);
            }
        } catch (RuntimeException e) {
            log.error("cronjob startup recovery failed msg={}", e.getMessage(), e);
        }

        List<JobDefinition> enabled;
        try {
            enabled = jobStore.findEnabled();
        } catch (RuntimeException e) {
            log.error("cronjob startup could not load definitions msg={}", e.getMessage(), e);
            return;
        }

        for (JobDefinition job : enabled) {
            if (job.nextRunAt() != null) {
                continue;
            }
            try {
                Instant next = cronTrigger.next(job.cronExpression(), now);
                jobStore.updateSchedule(job.id(), null, next);
                log.debug("cronjob initialised schedule name={} nextRunAt={}", job.name(), next);
            } catch (InvalidCronExpressionException e) {
                disableInvalid(job, e);
            } catch (RuntimeException e) {
                log.error("cronjob startup could not schedule name={} msg={}", job.name(), e.getMessage(), e);
            }
        }
        log.info("cronjob loaded enabled definitions count={}", enabled.size());
    }

    /* ================= polling ================= */

    private void pollerLoop() {
        while (started.get()) {
            try {
                pollOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("cronjob poll failed; skipping tick failures={} msg={}", systemErrorCount, e.getMessage(), e);

                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                Thread.sleep(props.getPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated poll failures, capped at one minute (or the poll interval if longer).
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long base = Math.max(1L, props.getPollInterval().toMillis());
        long cap = Math.max(60_000L, base);
        long ms = Math.min(base * (1L << exp), cap);
        return Duration.ofMillis(ms);
    }

    void pollOnce() {
        Instant now = nowInstant();
        List<JobDefinition> due = jobStore.dueJobs(now, props.getBatchSize());

        log.debug("cronjob polled due jobs count={} now={}", due.size(), now);

        for (JobDefinition job : due) {
            if (!accepting) {
                return;
            }
            try {
                processDue(job, now);
            } catch (Exception e) {
                log.error("cronjob could not process due job name={} id={} msg={}", job.name(), job.id(), e.getMessage(), e);
            }
        }
    }

    private void processDue(JobDefinition job, Instant now) {
        if (!job.enabled()) {
            return;
        }

        Instant next;
        try {
            next = cronTrigger.next(job.cronExpression(), now);
        } catch (InvalidCronExpressionException e) {
            disableInvalid(job, e);
            return;
        }

        if (!jobStore.updateSchedule(job.id(), job.nextRunAt(), next)) {
            log.debug("cronjob claim lost name={} id={}", job.name(), job.id());
            return;
        }

        if (!governor.tryAcquire(job)) {
            log.debug("cronjob skipped; concurrency limit reached name={} running={} nextRunAt={}",
                    job.name(), governor.runningCount(job.name()), next);
            return;
        }

        buildAndSubmit(job, 0);
    }

    private void disableInvalid(JobDefinition job, InvalidCronExpressionException e) {
        log.error("cronjob invalid cron expression; disabling job name={} id={} cron={} msg={}",
                job.name(), job.id(), job.cronExpression(), e.getMessage());
        jobStore.disableScheduling(job.id());
    }

    /* ================= dispatch ================= */

    // Caller holds a governor slot for the job; every path below either hands it to a worker or releases it.
    private void buildAndSubmit(JobDefinition job, int retryAttempt) {
        Task task;
        try {
            task = taskRegistry.build(job.taskType(), job.payload());
        } catch (UnknownTaskTypeException | PayloadDecodeException e) {
            try {
                recordInvalidConfig(job, retryAttempt, e);
            } finally {
                governor.release(job.name());
            }
            return;
        }

        Attempt attempt = new Attempt(job, retryAttempt);
        ExecutorService pool = workerPool;
        try {
            if (pool == null) {
                throw new RejectedExecutionException("worker pool is not running");
            }
            pool.execute(() -> runAttempt(attempt, task));
            log.debug("cronjob queued name={} executionId={} attempt={}", job.name(), attempt.executionId, retryAttempt);
        } catch (RejectedExecutionException e) {
            governor.release(job.name());
            log.warn("cronjob dispatch rejected name={} msg={}", job.name(), e.getMessage());
        }
    }

    private void recordInvalidConfig(JobDefinition job, int retryAttempt, RuntimeException e) {
        log.error("cronjob cannot build task name={} taskType={} msg={}", job.name(), job.taskType(), e.getMessage());

        Instant now = nowInstant();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("kind", "InvalidConfig");
        details.put("exception", e.getClass().getName());
        details.put("taskType", job.taskType());

        jobStore.recordExecution(new ExecutionRecord(0L, job.id(), job.name(), UUID.randomUUID(), now, now,
                JobStatus.FAILED, retryAttempt, e.getMessage(), details, null));
        jobStore.updateLastRun(job.id(), now, JobStatus.FAILED);
    }

    private void runAttempt(Attempt attempt, Task task) {
        JobDefinition job = attempt.job;
        if (!accepting) {
            governor.release(job.name());
            log.debug("cronjob dropped queued attempt on shutdown name={}", job.name());
            return;
        }

        Instant startedAt = nowInstant();
        try {
            ExecutionRecord record = jobStore.recordExecution(
                    ExecutionRecord.running(job, attempt.executionId, attempt.retryAttempt, startedAt));
            attempt.recordId = record.id();
        } catch (RuntimeException e) {
            governor.release(job.name());
            log.error("cronjob could not record execution start name={} msg={}", job.name(), e.getMessage(), e);
            return;
        }
        inFlight.put(attempt.executionId, attempt);

        log.debug("cronjob started name={} executionId={} attempt={} startedAt={}",
                job.name(), attempt.executionId, attempt.retryAttempt, startedAt);

        Duration timeout = job.timeout() != null ? job.timeout() : JobDefinition.DEFAULT_TIMEOUT;
        TaskContext ctx = new TaskContext(
                attempt.executionId,
                job.id(),
                job.name(),
                attempt.retryAttempt,
                startedAt.plus(timeout),
                attempt.token,
                jobStore
        );

        ExecutionOutcome outcome;
        try {
            outcome = executor.run(task, ctx, timeout);
        } catch (RuntimeException e) {
            outcome = ExecutionOutcome.failed(e.getMessage(), Map.of("kind", "TaskExecutionFailed"), Duration.ZERO);
        }
        finishAttempt(attempt, outcome);
    }

    private void finishAttempt(Attempt attempt, ExecutionOutcome outcome) {
        if (!attempt.finished.compareAndSet(false, true)) {
            return;
        }
        JobDefinition job = attempt.job;
        inFlight.remove(attempt.executionId);

        RetryDecision decision = retryPolicy.decide(job, attempt.retryAttempt, outcome);
        Instant completedAt = nowInstant();

        // the slot is held until the record has left RUNNING
        try {
            jobStore.completeExecution(attempt.recordId, completedAt, outcome.status(),
                    outcome.errorMessage(), outcome.errorDetails(), outcome.result());
        } catch (RuntimeException e) {
            log.error("cronjob could not record execution result name={} executionId={} msg={}",
                    job.name(), attempt.executionId, e.getMessage(), e);
        } finally {
            governor.release(job.name());
        }

        if (outcome.status() == JobStatus.SUCCESS) {
            log.debug("cronjob succeeded name={} executionId={} duration={}", job.name(), attempt.executionId, outcome.duration());
        } else {
            log.error("cronjob job failed name={} executionId={} status={} attempt={} msg={}",
                    job.name(), attempt.executionId, outcome.status(), attempt.retryAttempt, outcome.errorMessage());
        }

        if (decision.retry() && accepting) {
            log.warn("cronjob retry scheduled name={} attempt={} delay={}", job.name(), attempt.retryAttempt + 1, decision.delay());
            retryQueue.offer(new PendingRetry(job.id(), job.name(), attempt.retryAttempt + 1,
                    outcome.status(), completedAt, decision.delay()));
            return;
        }

        if (outcome.status().isRetryable() && job.maxRetries() > 0 && attempt.retryAttempt >= job.maxRetries()) {
            log.warn("cronjob retries exhausted name={} attempts={} maxRetries={}",
                    job.name(), attempt.retryAttempt + 1, job.maxRetries());
        }
        updateLastRun(job.id(), job.name(), completedAt, outcome.status());
    }

    private void cancelAttempt(Attempt attempt) {
        if (!attempt.finished.compareAndSet(false, true)) {
            return;
        }
        JobDefinition job = attempt.job;
        attempt.token.cancel(SHUTDOWN_REASON);
        inFlight.remove(attempt.executionId);

        Instant now = nowInstant();
        try {
            jobStore.completeExecution(attempt.recordId, now, JobStatus.CANCELLED,
                    "Execution cancelled: " + SHUTDOWN_REASON, Map.of("kind", "Cancelled"), null);
        } catch (RuntimeException e) {
            log.error("cronjob could not record cancellation name={} executionId={} msg={}",
                    job.name(), attempt.executionId, e.getMessage(), e);
        } finally {
            governor.release(job.name());
        }
        updateLastRun(job.id(), job.name(), now, JobStatus.CANCELLED);
        log.warn("cronjob execution cancelled by shutdown name={} executionId={}", job.name(), attempt.executionId);
    }

    private void updateLastRun(String jobId, String jobName, Instant at, JobStatus status) {
        try {
            jobStore.updateLastRun(jobId, at, status);
        } catch (RuntimeException e) {
            log.error("cronjob could not update last run name={} msg={}", jobName, e.getMessage(), e);
        }
    }

    /* ================= retries ================= */

    private void retryDispatchLoop() {
        while (started.get()) {
            PendingRetry retry;
            try {
                retry = retryQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            if (!accepting) {
                finalizeRetry(retry);
                break;
            }

            try {
                dispatchRetry(retry);
            } catch (Exception e) {
                log.error("cronjob retry dispatch failed name={} msg={}", retry.jobName, e.getMessage(), e);
                retryQueue.offer(retry.postpone(props.getPollInterval()));
            }
        }
    }

    private void dispatchRetry(PendingRetry retry) {
        Optional<JobDefinition> current = jobStore.findById(retry.jobId);
        if (current.isEmpty()) {
            log.info("cronjob retry dropped; job no longer exists name={}", retry.jobName);
            return;
        }

        JobDefinition job = current.get();
        if (!job.enabled()) {
            log.info("cronjob retry dropped; job is paused name={}", job.name());
            finalizeRetry(retry);
            return;
        }

        if (retry.retryAttempt > job.maxRetries()) {
            log.info("cronjob retry dropped; maxRetries lowered name={} attempt={} maxRetries={}",
                    job.name(), retry.retryAttempt, job.maxRetries());
            finalizeRetry(retry);
            return;
        }

        if (!governor.tryAcquire(job)) {
            log.debug("cronjob retry postponed; concurrency limit reached name={}", job.name());
            retryQueue.offer(retry.postpone(props.getPollInterval()));
            return;
        }

        buildAndSubmit(job, retry.retryAttempt);
    }

    private void finalizePendingRetries() {
        for (PendingRetry retry : retryQueue.toArray(new PendingRetry[0])) {
            if (retryQueue.remove(retry)) {
                finalizeRetry(retry);
            }
        }
    }

    // A retry that will never run leaves the previous attempt's status as the job's last run.
    private void finalizeRetry(PendingRetry retry) {
        updateLastRun(retry.jobId, retry.jobName, retry.previousCompletedAt, retry.previousStatus);
    }

    private static void stopThread(Thread t) {
        if (t == null) {
            return;
        }
        t.interrupt();
        try {
            t.join(5_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
