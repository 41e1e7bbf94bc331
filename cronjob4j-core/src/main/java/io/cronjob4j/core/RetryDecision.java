package io.cronjob4j.core;

import java.time.Duration;

/**
 * Result of {@link RetryPolicy#decide}: either retry after {@code delay}, or stop.
 */
public record RetryDecision(
        boolean retry,
        Duration delay
) {
    private static final RetryDecision TERMINAL = new RetryDecision(false, Duration.ZERO);

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }

    public static RetryDecision terminal() {
        return TERMINAL;
    }

    public boolean isTerminal() {
        return !retry;
    }
}
