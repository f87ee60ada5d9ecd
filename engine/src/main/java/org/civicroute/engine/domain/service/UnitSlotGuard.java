package org.civicroute.engine.domain.service;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes commits that target the same handling unit within this process.
 * Combined with a re-read of the unit's open count under the lock, this turns
 * concurrent assignments to one unit into an ordered sequence of compare-and-commit steps.
 */
public final class UnitSlotGuard {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withUnitLock(String unitId, Supplier<T> action) {
        Objects.requireNonNull(unitId, "unitId must not be null");
        ReentrantLock lock = locks.computeIfAbsent(unitId, id -> new ReentrantLock(true));
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
