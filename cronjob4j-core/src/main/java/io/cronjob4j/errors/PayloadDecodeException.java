package io.cronjob4j.errors;

/**
 * A job payload could not be turned into a task instance. Configuration error, never retried.
 */
public class PayloadDecodeException extends JobSchedulingException {
    private final String taskType;

    public PayloadDecodeException(String taskType, String message, Throwable cause) {
        super("Cannot decode payload for task type " + taskType + ": " + message, cause);
        this.taskType = taskType;
    }

    public String getTaskType() {
        return taskType;
    }
}
