package io.cronjob4j.errors;

import java.util.List;

/**
 * A job definition violates one or more field constraints.
 */
public class InvalidJobDefinitionException extends JobSchedulingException {
    private final List<String> violations;

    public InvalidJobDefinitionException(List<String> violations) {
        super("Invalid job definition: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
