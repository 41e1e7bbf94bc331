package io.cronjob4j.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExecutionRecordTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final JobDefinition job = JobDefinition.builder()
            .id("job-1")
            .name("export")
            .taskType("noop")
            .cronExpression("0 * * * *")
            .build();

    @Test
    void completedRecordShouldNotFollowLaterChangesToCallerMaps() {
        Map<String, Object> result = new HashMap<>();
        result.put("rows", 10);
        Map<String, Object> details = new HashMap<>();
        details.put("kind", "TaskExecutionFailed");

        ExecutionRecord record = ExecutionRecord.running(job, UUID.randomUUID(), 0, T0)
                .complete(T0.plusSeconds(1), JobStatus.SUCCESS, null, details, result);
        result.put("rows", 99);
        details.clear();

        assertEquals(Map.of("rows", 10), record.result());
        assertEquals(Map.of("kind", "TaskExecutionFailed"), record.errorDetails());
        assertThrows(UnsupportedOperationException.class, () -> record.result().put("rows", 1));
    }

    @Test
    void missingMapsShouldStayNull() {
        ExecutionRecord record = ExecutionRecord.running(job, UUID.randomUUID(), 0, T0);

        assertNull(record.result());
        assertNull(record.errorDetails());
        assertNull(record.duration());
    }
}
