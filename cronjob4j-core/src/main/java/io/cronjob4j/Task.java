package io.cronjob4j;

/**
 * One unit of work built from a job definition's payload.
 *
 * <p>Throw to report failure; the message and exception type are recorded on the execution. Long running
 * tasks should poll {@link TaskContext#cancellationToken()} and respond to interruption, otherwise they are
 * abandoned when their deadline passes.
 */
@FunctionalInterface
public interface Task {

    TaskOutput execute(TaskContext context) throws Exception;
}
