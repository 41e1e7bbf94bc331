package io.cronjob4j.errors;

/**
 * The job store failed. Inside the scheduler loop this skips the current tick and is never fatal.
 */
public class PersistenceException extends JobSchedulingException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
