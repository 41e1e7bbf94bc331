package io.cronjob4j;

import io.cronjob4j.core.JobStore;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * What a running task knows about its attempt.
 *
 * @param executionId  unique id of this attempt
 * @param retryAttempt 0 for the first attempt
 * @param deadline     instant after which the attempt is reported as timed out
 * @param jobStore     store handle, for tasks that maintain the scheduler's own data
 */
public record TaskContext(
        UUID executionId,
        String jobId,
        String jobName,
        int retryAttempt,
        Instant deadline,
        CancellationToken cancellationToken,
        JobStore jobStore
) {
    public TaskContext {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(cancellationToken, "cancellationToken must not be null");
    }
}
