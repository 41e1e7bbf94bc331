package io.cronjob4j.errors;

public class JobNotFoundException extends JobSchedulingException {

    public JobNotFoundException(String field, String value) {
        super("Job not found: " + field + "=" + value);
    }
}
