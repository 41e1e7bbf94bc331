package io.cronjob4j;

/**
 * Runs enabled job definitions on their cron schedules.
 */
public interface JobScheduler {

    /**
     * Recover state left by a previous process and begin polling. Idempotent.
     */
    void start();

    /**
     * Stop polling, wait for in-flight attempts up to the grace period and cancel the rest. Idempotent.
     */
    void stop();

    boolean isRunning();
}
