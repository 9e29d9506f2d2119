package com.pocketpilot.budget.service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per key. A key's lock leaves the registry once no thread holds or waits for it.
 */
final class KeyedLocks<K> {

    private final Map<K, Handle> locks = new ConcurrentHashMap<>();

    <T> T withLock(K key, Supplier<T> action) {
        Handle handle = acquire(key);
        try {
            return action.get();
        } finally {
            release(key, handle);
        }
    }

    int size() {
        return locks.size();
    }

    private Handle acquire(K key) {
        Handle handle = locks.compute(key, (k, existing) -> {
            Handle current = existing == null ? new Handle() : existing;
            current.users++;
            return current;
        });
        handle.lock.lock();
        return handle;
    }

    private void release(K key, Handle handle) {
        handle.lock.unlock();
        locks.computeIfPresent(key, (k, current) -> --current.users == 0 ? null : current);
    }

    // users is only read and written inside compute calls for the same key
    private static final class Handle {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
