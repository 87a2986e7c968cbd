package com.changeguard.core.change;

import com.changeguard.core.exception.ConcurrencyConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LockRegistryTest {

    private final LockRegistry registry = new LockRegistry(Duration.ofMillis(200));

    @Test
    @DisplayName("returns the action's result and releases the lock")
    void releasesAfterAction() {
        String result = registry.withLock("path:a", () -> {
            assertTrue(registry.isLocked("path:a"));
            return "done";
        });

        assertEquals("done", result);
        assertFalse(registry.isLocked("path:a"));
    }

    @Test
    @DisplayName("releases every lock when the action throws")
    void releasesOnFailure() {
        assertThrows(IllegalStateException.class, () -> registry.withLocks(List.of("id:1", "path:a"), () -> {
            throw new IllegalStateException("boom");
        }));

        assertFalse(registry.isLocked("id:1"));
        assertFalse(registry.isLocked("path:a"));
    }

    @Test
    @DisplayName("the same thread may re-enter a lock it holds")
    void reentrant() {
        int value = registry.withLock("path:a", () -> registry.withLocks(List.of("path:a", "path:b"), () -> 7));

        assertEquals(7, value);
    }

    @Test
    @DisplayName("times out with a conflict while another thread holds the key")
    void conflictWhenHeldElsewhere() throws Exception {
        var acquired = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = pool.submit(() -> registry.withLock("path:a", () -> {
                acquired.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }));
            assertTrue(acquired.await(5, TimeUnit.SECONDS));

            var e = assertThrows(ConcurrencyConflictException.class,
                    () -> registry.withLocks(List.of("path:b", "path:a"), () -> "never"));
            assertTrue(e.getMessage().contains("path:a"));
            assertFalse(registry.isLocked("path:b"), "locks taken before the conflict are released");

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("overlapping key sets in different orders do not deadlock")
    void sortedAcquisition() throws Exception {
        var slowRegistry = new LockRegistry(Duration.ofSeconds(5));
        var counter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            var futures = new ArrayList<Future<Integer>>();
            for (int i = 0; i < 40; i++) {
                List<String> keys = new ArrayList<>(List.of("id:x", "path:y"));
                if (i % 2 == 0) {
                    Collections.reverse(keys);
                }
                futures.add(pool.submit(() -> slowRegistry.withLocks(keys, counter::incrementAndGet)));
            }
            for (Future<Integer> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(40, counter.get());
    }
}
