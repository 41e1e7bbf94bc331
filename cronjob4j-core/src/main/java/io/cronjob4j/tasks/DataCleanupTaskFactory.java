package io.cronjob4j.tasks;

import io.cronjob4j.Task;
import io.cronjob4j.TaskFactory;
import io.cronjob4j.TaskOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Built-in {@code data_cleanup} task: deletes finished execution records older than the retention window.
 *
 * <p>Payload: {@code {"retentionDays": 30}}. When the payload leaves it out the factory default applies.
 */
public class DataCleanupTaskFactory implements TaskFactory<DataCleanupTaskFactory.Payload> {
    private static final Logger log = LoggerFactory.getLogger(DataCleanupTaskFactory.class);

    public static final String TASK_TYPE = "data_cleanup";
    public static final int DEFAULT_RETENTION_DAYS = 30;

    private final int defaultRetentionDays;
    private final Clock clock;

    public record Payload(Integer retentionDays) {
    }

    public DataCleanupTaskFactory() {
        this(DEFAULT_RETENTION_DAYS, Clock.systemUTC());
    }

    public DataCleanupTaskFactory(int defaultRetentionDays, Clock clock) {
        if (defaultRetentionDays <= 0) {
            throw new IllegalArgumentException("defaultRetentionDays must be a positive number");
        }
        this.defaultRetentionDays = defaultRetentionDays;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String taskType() {
        return TASK_TYPE;
    }

    @Override
    public Class<Payload> payloadClass() {
        return Payload.class;
    }

    @Override
    public Task create(Payload payload) {
        int days = (payload == null || payload.retentionDays() == null)
                ? defaultRetentionDays
                : payload.retentionDays();
        if (days <= 0) {
            throw new IllegalArgumentException("retentionDays must be a positive number, got " + days);
        }

        return ctx -> {
            Instant cutoff = clock.instant().minus(Duration.ofDays(days));
            long deleted = ctx.jobStore().deleteExecutionsOlderThan(cutoff);
            log.info("cronjob data cleanup deleted={} retentionDays={} cutoff={}", deleted, days, cutoff);

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("deletedExecutions", deleted);
            result.put("retentionDays", days);
            result.put("cutoff", cutoff.toString());
            return TaskOutput.of(result);
        };
    }
}
