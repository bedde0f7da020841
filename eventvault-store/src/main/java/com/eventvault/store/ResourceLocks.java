package com.eventvault.store;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lazily created lock per resource key. Different keys never contend.
 */
@Slf4j
public class ResourceLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public ResourceLocks(Duration timeout) {
        this.timeoutMs = Math.max(1, timeout.toMillis());
    }

    /**
     * Handle to a held resource lock. Released exactly once on close.
     */
    public static class LockHandle implements AutoCloseable {
        private final String key;
        private final ReentrantLock lock;
        private boolean released = false;

        LockHandle(String key, ReentrantLock lock) {
            this.key = key;
            this.lock = lock;
        }

        public String getKey() {
            return key;
        }

        public void release() {
            if (released)
                return;
            released = true;
            lock.unlock();
        }

        @Override
        public void close() {
            release();
        }
    }

    /**
     * Acquire the lock for a key, waiting at most the configured timeout.
     *
     * @throws StoreException on timeout or interruption
     */
    public LockHandle acquire(String key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        try {
            if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Timed out after {}ms waiting for lock on {}", timeoutMs, key);
                throw new StoreException("Lock timeout on resource " + key);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted waiting for lock on resource " + key, e);
        }
        return new LockHandle(key, lock);
    }
}
