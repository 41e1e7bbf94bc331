package io.cronjob4j.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy();

    private static final ExecutionOutcome FAILED = ExecutionOutcome.failed("boom", null, Duration.ofMillis(5));

    @Test
    void delaysShouldGrowExponentially() {
        JobDefinition job = job(3, Duration.ofSeconds(60), 2.0);

        assertEquals(Duration.ofSeconds(60), policy.decide(job, 0, FAILED).delay());
        assertEquals(Duration.ofSeconds(120), policy.decide(job, 1, FAILED).delay());
        assertEquals(Duration.ofSeconds(240), policy.decide(job, 2, FAILED).delay());
    }

    @Test
    void shouldStopAfterMaxRetries() {
        JobDefinition job = job(3, Duration.ofSeconds(60), 2.0);

        assertTrue(policy.decide(job, 2, FAILED).retry());
        assertTrue(policy.decide(job, 3, FAILED).isTerminal());
    }

    @Test
    void zeroMaxRetriesShouldNeverRetry() {
        JobDefinition job = job(0, Duration.ofSeconds(60), 2.0);
        assertTrue(policy.decide(job, 0, FAILED).isTerminal());
    }

    @Test
    void timeoutShouldBeRetried() {
        JobDefinition job = job(1, Duration.ofSeconds(10), 1.0);
        ExecutionOutcome timeout = ExecutionOutcome.timeout("timed out", null, Duration.ofSeconds(1));

        RetryDecision decision = policy.decide(job, 0, timeout);
        assertTrue(decision.retry());
        assertEquals(Duration.ofSeconds(10), decision.delay());
    }

    @Test
    void successAndCancelledShouldBeTerminal() {
        JobDefinition job = job(3, Duration.ofSeconds(60), 2.0);

        assertFalse(policy.decide(job, 0, ExecutionOutcome.success(null, Duration.ZERO)).retry());
        assertFalse(policy.decide(job, 0, ExecutionOutcome.cancelled("stop", Duration.ZERO)).retry());
    }

    @Test
    void hugeDelaysShouldSaturate() {
        Duration delay = policy.delay(Duration.ofDays(365), 10.0, 60);
        assertEquals(RetryPolicy.MAX_DELAY, delay);
    }

    private static JobDefinition job(int maxRetries, Duration retryDelay, double multiplier) {
        return JobDefinition.builder()
                .id("job-1")
                .name("flaky")
                .taskType("noop")
                .cronExpression("* * * * *")
                .maxRetries(maxRetries)
                .retryDelay(retryDelay)
                .retryBackoffMultiplier(multiplier)
                .build();
    }
}
