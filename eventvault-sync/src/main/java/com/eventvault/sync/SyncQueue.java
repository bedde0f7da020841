package com.eventvault.sync;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO of sync tasks holding at most one task per resource key.
 * Offering a task for a key that is already waiting replaces its snapshot
 * but keeps its place in line.
 */
public class SyncQueue {

    public enum Offer {
        ADDED, COALESCED, REJECTED
    }

    private final int capacity;
    private final Map<String, SyncTask> pending = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    public SyncQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public Offer offer(SyncTask task) {
        lock.lock();
        try {
            if (pending.containsKey(task.key())) {
                pending.put(task.key(), task);
                return Offer.COALESCED;
            }
            if (pending.size() >= capacity) {
                return Offer.REJECTED;
            }
            pending.put(task.key(), task);
            notEmpty.signal();
            return Offer.ADDED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the oldest task, waiting up to the timeout for one to arrive.
     *
     * @return the task, or {@code null} on timeout
     */
    public SyncTask poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (pending.isEmpty()) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            Iterator<SyncTask> it = pending.values().iterator();
            SyncTask head = it.next();
            it.remove();
            return head;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int capacity() {
        return capacity;
    }
}
