package io.cronjob4j.core;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Structured result of running one task attempt under a deadline.
 */
public record ExecutionOutcome(
        JobStatus status,
        String errorMessage,
        Map<String, Object> errorDetails,
        Map<String, Object> result,
        Duration duration
) {
    public ExecutionOutcome {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("outcome status must be terminal: " + status);
        }
    }

    public static ExecutionOutcome success(Map<String, Object> result, Duration duration) {
        return new ExecutionOutcome(JobStatus.SUCCESS, null, null, result, duration);
    }

    public static ExecutionOutcome failed(String message, Map<String, Object> details, Duration duration) {
        return new ExecutionOutcome(JobStatus.FAILED, message, details, null, duration);
    }

    public static ExecutionOutcome timeout(String message, Map<String, Object> details, Duration duration) {
        return new ExecutionOutcome(JobStatus.TIMEOUT, message, details, null, duration);
    }

    public static ExecutionOutcome cancelled(String message, Duration duration) {
        return new ExecutionOutcome(JobStatus.CANCELLED, message, null, null, duration);
    }
}
