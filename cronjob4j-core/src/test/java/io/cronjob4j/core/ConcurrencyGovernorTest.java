package io.cronjob4j.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConcurrencyGovernorTest {

    private final ConcurrencyGovernor governor = new ConcurrencyGovernor();

    @Test
    void nonConcurrentJobShouldAdmitOnlyOne() {
        assertTrue(governor.tryAcquire("report", false, null));
        assertFalse(governor.tryAcquire("report", false, null));
        assertEquals(1, governor.runningCount("report"));

        governor.release("report");
        assertTrue(governor.tryAcquire("report", false, null));
    }

    @Test
    void nonConcurrentJobShouldIgnoreMaxConcurrent() {
        assertTrue(governor.tryAcquire("report", false, 5));
        assertFalse(governor.tryAcquire("report", false, 5));
    }

    @Test
    void concurrentJobShouldRespectMax() {
        assertTrue(governor.tryAcquire("sync", true, 2));
        assertTrue(governor.tryAcquire("sync", true, 2));
        assertFalse(governor.tryAcquire("sync", true, 2));

        governor.release("sync");
        assertTrue(governor.tryAcquire("sync", true, 2));
        assertEquals(2, governor.runningCount("sync"));
    }

    @Test
    void concurrentJobWithoutMaxShouldAlwaysAdmit() {
        for (int i = 0; i < 100; i++) {
            assertTrue(governor.tryAcquire("fanout", true, null));
        }
        assertEquals(100, governor.runningCount("fanout"));
    }

    @Test
    void jobsShouldNotShareSlots() {
        assertTrue(governor.tryAcquire("a", false, null));
        assertTrue(governor.tryAcquire("b", false, null));
        assertEquals(2, governor.snapshot().size());
    }

    @Test
    void releaseShouldDropEntryAtZero() {
        governor.tryAcquire("a", false, null);
        governor.release("a");

        assertEquals(0, governor.runningCount("a"));
        assertTrue(governor.snapshot().isEmpty());
    }

    @Test
    void releaseOfUnknownNameShouldBeNoOp() {
        governor.release("never-acquired");
        assertTrue(governor.snapshot().isEmpty());
    }

    @Test
    void racingCallersShouldGetExactlyOneSlot() throws Exception {
        int threads = 32;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    go.await();
                    return governor.tryAcquire("exclusive", false, null);
                }));
            }
            go.countDown();

            int admitted = 0;
            for (Future<Boolean> f : results) {
                if (f.get(5, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertEquals(1, admitted);
            assertEquals(1, governor.runningCount("exclusive"));
        } finally {
            pool.shutdownNow();
        }
    }
}
