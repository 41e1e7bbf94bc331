package io.cronjob4j.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local admission control: how many attempts of each job name are in flight.
 *
 * <p>Check and increment happen under one lock, so two callers can never both observe a free slot
 * for a non-concurrent job. The lock is only held for the map update.
 */
public class ConcurrencyGovernor {
    private static final Logger log = LoggerFactory.getLogger(ConcurrencyGovernor.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Integer> running = new HashMap<>();

    public boolean tryAcquire(JobDefinition job) {
        return tryAcquire(job.name(), job.allowConcurrent(), job.maxConcurrent());
    }

    /**
     * Admit one more attempt of {@code jobName} if its policy allows it.
     *
     * @param maxConcurrent only consulted when {@code allowConcurrent}; null means unlimited
     * @return true if admitted, in which case the caller owns one slot until {@link #release}
     */
    public boolean tryAcquire(String jobName, boolean allowConcurrent, Integer maxConcurrent) {
        Objects.requireNonNull(jobName, "jobName must not be null");
        lock.lock();
        try {
            int current = running.getOrDefault(jobName, 0);
            boolean admit;
            if (!allowConcurrent) {
                admit = current == 0;
            } else if (maxConcurrent != null) {
                admit = current < maxConcurrent;
            } else {
                admit = true;
            }
            if (admit) {
                running.put(jobName, current + 1);
            }
            return admit;
        } finally {
            lock.unlock();
        }
    }

    public void release(String jobName) {
        Objects.requireNonNull(jobName, "jobName must not be null");
        lock.lock();
        try {
            Integer current = running.get(jobName);
            if (current == null) {
                log.warn("cronjob release without slot name={}", jobName);
                return;
            }
            if (current <= 1) {
                running.remove(jobName);
            } else {
                running.put(jobName, current - 1);
            }
        } finally {
            lock.unlock();
        }
    }

    public int runningCount(String jobName) {
        lock.lock();
        try {
            return running.getOrDefault(jobName, 0);
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Integer> snapshot() {
        lock.lock();
        try {
            return Map.copyOf(running);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            running.clear();
        } finally {
            lock.unlock();
        }
    }
}
