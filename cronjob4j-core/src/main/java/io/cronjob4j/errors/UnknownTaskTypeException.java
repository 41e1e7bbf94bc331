package io.cronjob4j.errors;

/**
 * No task factory is registered for a job's task type. Configuration error, never retried.
 */
public class UnknownTaskTypeException extends JobSchedulingException {
    private final String taskType;

    public UnknownTaskTypeException(String taskType) {
        super("No TaskFactory registered for task type: " + taskType);
        this.taskType = taskType;
    }

    public String getTaskType() {
        return taskType;
    }
}
