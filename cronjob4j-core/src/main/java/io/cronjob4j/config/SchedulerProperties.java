package io.cronjob4j.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the cron job scheduler.
 */
@ConfigurationProperties(prefix = "cronjob")
public class SchedulerProperties {
    private boolean enabled = true;
    private boolean autoStartup = true;
    private Duration pollInterval = Duration.ofSeconds(5);
    private int maxConcurrency = 20; // global
    private int batchSize = 100; // due jobs per tick
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);
    private String timezone = "UTC";
    private boolean ensureIndexesOnStartup = false;
    private Defaults defaults = new Defaults();
    private Retention retention = new Retention();

    /**
     * Fail fast on values the scheduler cannot run with.
     */
    public void validate() {
        requirePositive(pollInterval, "cronjob.pollInterval");
        requirePositive(shutdownGracePeriod, "cronjob.shutdownGracePeriod");
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("cronjob.maxConcurrency must be a positive number");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("cronjob.batchSize must be a positive number");
        }
        zoneId();
    }

    public ZoneId zoneId() {
        Objects.requireNonNull(timezone, "cronjob.timezone must not be null");
        try {
            return ZoneId.of(timezone);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("cronjob.timezone is not a valid zone id: " + timezone, e);
        }
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    /**
     * Values applied to definitions created through {@code JobDefinitionService.newDefinition}.
     */
    public static class Defaults {
        private Duration timeout = Duration.ofSeconds(300);
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(60);
        private double retryBackoffMultiplier = 2.0;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public double getRetryBackoffMultiplier() {
            return retryBackoffMultiplier;
        }

        public void setRetryBackoffMultiplier(double retryBackoffMultiplier) {
            this.retryBackoffMultiplier = retryBackoffMultiplier;
        }
    }

    /**
     * Execution history cleanup, registered as an ordinary {@code data_cleanup} job.
     */
    public static class Retention {
        private boolean enabled = false;
        private String cron = "0 3 * * *";
        private int retentionDays = 30;
        private String jobName = "execution-history-cleanup";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }

        public String getJobName() {
            return jobName;
        }

        public void setJobName(String jobName) {
            this.jobName = jobName;
        }
    }
}
