package io.cronjob4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted configuration of a recurring job: schedule, concurrency and retry policy, timeout and payload.
 *
 * <p>Instances are immutable. Use {@link #builder()} to create one and {@link #toBuilder()} to derive a
 * modified copy. Tracking fields ({@code lastRunAt}, {@code lastRunStatus}, {@code nextRunAt}) are owned by the
 * scheduler and written through {@link JobStore}.
 */
public record JobDefinition(

        // identity
        String id,
        String name,
        String taskType,

        // scheduling
        String cronExpression,
        boolean enabled,

        // concurrency policy
        boolean allowConcurrent,
        Integer maxConcurrent,

        // retry policy
        int maxRetries,
        Duration retryDelay,
        double retryBackoffMultiplier,

        Duration timeout,

        // payload
        Map<String, Object> payload,
        String description,
        String createdBy,

        // tracking
        Instant lastRunAt,
        JobStatus lastRunStatus,
        Instant nextRunAt,

        // audit
        Instant createdAt,
        Instant updatedAt
) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(60);
    public static final double DEFAULT_RETRY_BACKOFF_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);

    public JobDefinition {
        payload = payload == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .taskType(taskType)
                .cronExpression(cronExpression)
                .enabled(enabled)
                .allowConcurrent(allowConcurrent)
                .maxConcurrent(maxConcurrent)
                .maxRetries(maxRetries)
                .retryDelay(retryDelay)
                .retryBackoffMultiplier(retryBackoffMultiplier)
                .timeout(timeout)
                .payload(payload)
                .description(description)
                .createdBy(createdBy)
                .lastRunAt(lastRunAt)
                .lastRunStatus(lastRunStatus)
                .nextRunAt(nextRunAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static final class Builder {
        private String id;
        private String name;
        private String taskType;
        private String cronExpression;
        private boolean enabled = true;
        private boolean allowConcurrent = false;
        private Integer maxConcurrent;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private double retryBackoffMultiplier = DEFAULT_RETRY_BACKOFF_MULTIPLIER;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Map<String, Object> payload;
        private String description;
        private String createdBy;
        private Instant lastRunAt;
        private JobStatus lastRunStatus;
        private Instant nextRunAt;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder taskType(String taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder allowConcurrent(boolean allowConcurrent) {
            this.allowConcurrent = allowConcurrent;
            return this;
        }

        /**
         * Upper bound of simultaneous attempts when {@code allowConcurrent} is set; null means unlimited.
         */
        public Builder maxConcurrent(Integer maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder retryBackoffMultiplier(double retryBackoffMultiplier) {
            this.retryBackoffMultiplier = retryBackoffMultiplier;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        /**
         * Add a single payload entry.
         */
        public Builder put(String key, Object value) {
            Objects.requireNonNull(key, "key must not be null");
            Map<String, Object> copy = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
            copy.put(key, value);
            this.payload = copy;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder lastRunStatus(JobStatus lastRunStatus) {
            this.lastRunStatus = lastRunStatus;
            return this;
        }

        public Builder nextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public JobDefinition build() {
            return new JobDefinition(
                    id,
                    name,
                    taskType,
                    cronExpression,
                    enabled,
                    allowConcurrent,
                    maxConcurrent,
                    maxRetries,
                    retryDelay,
                    retryBackoffMultiplier,
                    timeout,
                    payload,
                    description,
                    createdBy,
                    lastRunAt,
                    lastRunStatus,
                    nextRunAt,
                    createdAt,
                    updatedAt
            );
        }
    }
}
