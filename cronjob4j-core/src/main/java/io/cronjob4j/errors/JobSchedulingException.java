package io.cronjob4j.errors;

/**
 * Base type of all errors raised by the scheduling subsystem.
 */
public class JobSchedulingException extends RuntimeException {

    public JobSchedulingException(String message) {
        super(message);
    }

    public JobSchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
