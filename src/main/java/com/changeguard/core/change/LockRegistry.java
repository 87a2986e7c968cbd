package com.changeguard.core.change;

import com.changeguard.core.exception.ConcurrencyConflictException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Named reentrant locks acquired with a timeout. Several keys are always taken in sorted order.
 */
class LockRegistry {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    LockRegistry(Duration timeout) {
        this.timeout = timeout;
    }

    <T> T withLock(String key, Supplier<T> action) {
        return withLocks(List.of(key), action);
    }

    /**
     * @throws ConcurrencyConflictException if any lock is not obtained within the timeout
     */
    <T> T withLocks(Collection<String> keys, Supplier<T> action) {
        List<String> ordered = keys.stream().distinct().sorted().toList();
        var held = new ArrayList<ReentrantLock>(ordered.size());
        try {
            for (String key : ordered) {
                ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
                if (!lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new ConcurrencyConflictException(
                            "Another operation holds " + key + " (waited " + timeout.toSeconds() + "s)");
                }
                held.add(lock);
            }
            return action.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyConflictException("Interrupted while waiting for " + ordered);
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    boolean isLocked(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }
}
