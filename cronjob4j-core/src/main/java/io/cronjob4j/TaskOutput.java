package io.cronjob4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured result of a successful task, stored on the execution record.
 */
public record TaskOutput(Map<String, Object> result) {

    private static final TaskOutput EMPTY = new TaskOutput(null);

    public TaskOutput {
        result = result == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    public static TaskOutput empty() {
        return EMPTY;
    }

    public static TaskOutput of(Map<String, Object> result) {
        return new TaskOutput(result);
    }
}
