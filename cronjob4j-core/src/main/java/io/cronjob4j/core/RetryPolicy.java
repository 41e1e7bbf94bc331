package io.cronjob4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff.
 *
 * <p>{@code attempt} is the number of retries already performed for the current trigger (0 after the
 * first attempt fails). The delay before the next attempt is {@code retryDelay * multiplier ^ attempt},
 * so 60s with multiplier 2.0 gives 60s, 120s, 240s. Delays too large to represent saturate at
 * {@link #MAX_DELAY}.
 */
public class RetryPolicy {

    public static final Duration MAX_DELAY = Duration.ofNanos(Long.MAX_VALUE);

    public RetryDecision decide(JobDefinition job, int attempt, ExecutionOutcome outcome) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");

        if (!outcome.status().isRetryable()) {
            return RetryDecision.terminal();
        }
        if (attempt >= job.maxRetries()) {
            return RetryDecision.terminal();
        }
        Duration base = job.retryDelay() != null ? job.retryDelay() : JobDefinition.DEFAULT_RETRY_DELAY;
        return RetryDecision.retryAfter(delay(base, job.retryBackoffMultiplier(), attempt));
    }

    public Duration delay(Duration base, double multiplier, int attempt) {
        Objects.requireNonNull(base, "base must not be null");
        double nanos = (double) base.getSeconds() * 1_000_000_000d + base.getNano();
        nanos *= Math.pow(multiplier, Math.max(0, attempt));
        if (Double.isNaN(nanos) || nanos >= (double) Long.MAX_VALUE) {
            return MAX_DELAY;
        }
        return Duration.ofNanos(Math.max(0L, Math.round(nanos)));
    }
}
