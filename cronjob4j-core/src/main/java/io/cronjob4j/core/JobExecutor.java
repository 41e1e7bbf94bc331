package io.cronjob4j.core;

import io.cronjob4j.Task;
import io.cronjob4j.TaskContext;
import io.cronjob4j.TaskOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one task under a deadline and turns whatever happens into an {@link ExecutionOutcome}.
 *
 * <p>The task body runs on a task thread owned by this executor while the caller waits. When the deadline
 * passes the token is cancelled and the task thread interrupted, and the caller gets TIMEOUT at once. A task
 * that ignores both keeps running detached from the scheduler until it returns on its own.
 */
public class JobExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final ExecutorService taskPool;

    public JobExecutor() {
        AtomicInteger seq = new AtomicInteger();
        this.taskPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("cronjob4j.task-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ExecutionOutcome run(Task task, TaskContext ctx, Duration timeout) {
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(ctx, "ctx must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        long startNanos = System.nanoTime();
        Future<TaskOutput> future;
        try {
            future = taskPool.submit(() -> task.execute(ctx));
        } catch (RejectedExecutionException e) {
            return ExecutionOutcome.cancelled("executor is shut down", elapsed(startNanos));
        }

        try {
            TaskOutput output = future.get(toNanos(timeout), TimeUnit.NANOSECONDS);
            return ExecutionOutcome.success(output == null ? null : output.result(), elapsed(startNanos));
        } catch (TimeoutException e) {
            ctx.cancellationToken().cancel("timed out after " + timeout);
            future.cancel(true);
            log.warn("cronjob task timed out name={} executionId={} timeout={}",
                    ctx.jobName(), ctx.executionId(), timeout);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("kind", "Timeout");
            details.put("timeoutMillis", timeout.toMillis());
            return ExecutionOutcome.timeout("Execution timed out after " + timeout, details, elapsed(startNanos));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (ctx.cancellationToken().isCancelled()
                    && (cause instanceof CancellationException || cause instanceof InterruptedException)) {
                return ExecutionOutcome.cancelled(cancelMessage(ctx), elapsed(startNanos));
            }
            return ExecutionOutcome.failed(messageOf(cause), failureDetails(cause), elapsed(startNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.cancellationToken().cancel("scheduler shutting down");
            future.cancel(true);
            return ExecutionOutcome.cancelled(cancelMessage(ctx), elapsed(startNanos));
        } catch (CancellationException e) {
            return ExecutionOutcome.cancelled(cancelMessage(ctx), elapsed(startNanos));
        }
    }

    /**
     * Interrupt every task thread still running. Tasks that were abandoned on timeout are included.
     */
    @Override
    public void close() {
        taskPool.shutdownNow();
    }

    private static String cancelMessage(TaskContext ctx) {
        String reason = ctx.cancellationToken().reason();
        return reason == null ? "Execution cancelled" : "Execution cancelled: " + reason;
    }

    private static String messageOf(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
    }

    private static Map<String, Object> failureDetails(Throwable t) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("kind", "TaskExecutionFailed");
        details.put("exception", t.getClass().getName());
        if (t.getMessage() != null) {
            details.put("message", t.getMessage());
        }
        return details;
    }

    private static long toNanos(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
