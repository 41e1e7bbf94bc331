package io.cronjob4j.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronjob4j.Task;
import io.cronjob4j.TaskFactory;
import io.cronjob4j.errors.JobSchedulingException;
import io.cronjob4j.errors.PayloadDecodeException;
import io.cronjob4j.errors.UnknownTaskTypeException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps task types to the factories that build them, decoding JSON payloads with Jackson.
 */
public class TaskRegistry {

    private final Map<String, TaskFactory<?>> factoriesByType = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public TaskRegistry(ObjectMapper objectMapper) {
        this(List.of(), objectMapper);
    }

    public TaskRegistry(List<? extends TaskFactory<?>> factories, ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        Objects.requireNonNull(factories, "factories must not be null").forEach(this::register);
    }

    /**
     * @throws IllegalStateException if the task type is already registered
     */
    public void register(TaskFactory<?> factory) {
        Objects.requireNonNull(factory, "factory must not be null");
        String type = factory.taskType();
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("taskType must not be blank: " + factory.getClass().getName());
        }
        if (factoriesByType.putIfAbsent(type, factory) != null) {
            throw new IllegalStateException("Duplicate TaskFactory task type: " + type);
        }
    }

    public boolean contains(String taskType) {
        return taskType != null && factoriesByType.containsKey(taskType);
    }

    public Set<String> taskTypes() {
        return Set.copyOf(factoriesByType.keySet());
    }

    /**
     * Build a task instance for one attempt.
     *
     * @throws UnknownTaskTypeException when nothing is registered for {@code taskType}
     * @throws PayloadDecodeException   when the payload does not fit the factory's payload class
     *                                  or the factory rejects it
     */
    public Task build(String taskType, Map<String, Object> payload) {
        TaskFactory<?> factory = taskType == null ? null : factoriesByType.get(taskType);
        if (factory == null) {
            throw new UnknownTaskTypeException(taskType);
        }
        return create(factory, payload);
    }

    private <P> Task create(TaskFactory<P> factory, Map<String, Object> payload) {
        String type = factory.taskType();
        P decoded = decode(type, factory.payloadClass(), payload);

        Task task;
        try {
            task = factory.create(decoded);
        } catch (JobSchedulingException e) {
            throw e;
        } catch (Exception e) {
            throw new PayloadDecodeException(type, e.getMessage(), e);
        }
        if (task == null) {
            throw new PayloadDecodeException(type, "factory returned no task", null);
        }
        return task;
    }

    private <P> P decode(String taskType, Class<P> payloadClass, Map<String, Object> payload) {
        if (payloadClass == null || payloadClass == Void.class) {
            return null;
        }
        Map<String, Object> raw = payload == null ? Map.of() : payload;
        try {
            return objectMapper.convertValue(raw, payloadClass);
        } catch (IllegalArgumentException e) {
            throw new PayloadDecodeException(taskType, e.getMessage(), e);
        }
    }
}
