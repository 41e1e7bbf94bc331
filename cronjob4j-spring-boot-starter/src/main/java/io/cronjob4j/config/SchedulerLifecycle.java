package io.cronjob4j.config;

import io.cronjob4j.JobScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler start/stop with the Spring container lifecycle.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private final JobScheduler scheduler;
    private final boolean autoStartup;

    public SchedulerLifecycle(JobScheduler scheduler, boolean autoStartup) {
        this.scheduler = scheduler;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        scheduler.start();
    }

    @Override
    public void stop() {
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
