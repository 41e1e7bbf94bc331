package io.cronjob4j.errors;

/**
 * A cron expression that cannot be parsed or never fires again. Scheduling of the owning job is disabled.
 */
public class InvalidCronExpressionException extends JobSchedulingException {
    private final String expression;

    public InvalidCronExpressionException(String expression, String reason) {
        super("Invalid cron expression '" + expression + "': " + reason);
        this.expression = expression;
    }

    public InvalidCronExpressionException(String expression, String reason, Throwable cause) {
        super("Invalid cron expression '" + expression + "': " + reason, cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
