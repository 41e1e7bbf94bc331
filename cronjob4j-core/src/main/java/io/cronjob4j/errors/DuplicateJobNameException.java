package io.cronjob4j.errors;

public class DuplicateJobNameException extends JobSchedulingException {

    public DuplicateJobNameException(String name) {
        super("Job already exists: " + name);
    }

    public DuplicateJobNameException(String name, Throwable cause) {
        super("Job already exists: " + name, cause);
    }
}
