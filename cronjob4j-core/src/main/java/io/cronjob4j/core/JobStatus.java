package io.cronjob4j.core;

/**
 * Status of a single execution attempt.
 *
 * <p>{@code PENDING -> RUNNING -> SUCCESS | FAILED | TIMEOUT}, with FAILED/TIMEOUT looping back to PENDING
 * while retries remain. {@code CANCELLED} is only reached when the scheduler shuts down under a running attempt.
 */
public enum JobStatus {
    PENDING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    RUNNING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    SUCCESS,
    FAILED,
    TIMEOUT,
    CANCELLED;

    public boolean isTerminal() {
        return true;
    }

    /**
     * Whether an attempt ending in this status may be retried by the retry policy.
     */
    public boolean isRetryable() {
        return this == FAILED || this == TIMEOUT;
    }
}
