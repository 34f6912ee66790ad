package com.heystive.guard.service.security;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed array of locks selected by key hash. Operations on the same key are serialised;
 * operations on keys that land on different stripes proceed in parallel.
 */
final class StripedLocks {

    private final ReentrantLock[] locks;

    StripedLocks(int stripes) {
        if (stripes <= 0) {
            throw new IllegalArgumentException("stripes must be > 0");
        }
        this.locks = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    ReentrantLock forKey(String key) {
        return locks[Math.floorMod(key.hashCode(), locks.length)];
    }

    <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = forKey(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    int size() {
        return locks.length;
    }
}
