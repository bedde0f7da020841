package com.eventvault.sync;

import com.eventvault.common.config.EventVaultConfig.RemoteConfig;
import com.eventvault.common.infra.Backoff;
import com.eventvault.common.infra.ErrorUtils;
import com.eventvault.store.ResourceChangeListener;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mirrors saved resources to the remote tabular backend from one background
 * worker.
 * <p>
 * Saves are queued (coalesced per key) and never wait on the network. The
 * worker keeps a minimum gap between remote calls, bounds each call with a
 * timeout, retries throttled or timed-out calls with exponential backoff and
 * jitter up to a fixed number of attempts, and pauses without spending
 * attempts while the mirror is unreachable. Large resources go out in
 * batches. The mirror is a secondary replica; nothing here ever writes back
 * to the local store.
 */
@Slf4j
public class SyncEngine implements ResourceChangeListener, AutoCloseable {

    private static final long IDLE_POLL_MS = 200;

    private final RemoteConnector connector;
    private final SyncQueue queue;
    private final long minIntervalMs;
    private final long callTimeoutMs;
    private final int maxAttempts;
    private final int batchThreshold;
    private final int batchSize;
    private final long reconnectPollMs;
    private final Backoff.Policy backoff;

    private final ExecutorService callExecutor;
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final Object idleMonitor = new Object();
    private volatile Thread worker;
    private volatile SyncTask inFlight;
    /** Queued plus in-flight tasks. */
    private final AtomicInteger outstanding = new AtomicInteger();
    private long lastCallNanos;

    private final AtomicLong pushed = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong coalesced = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public SyncEngine(RemoteConnector connector, RemoteConfig config) {
        this.connector = connector;
        this.queue = new SyncQueue(config.getQueueCapacity());
        this.minIntervalMs = Math.max(0, config.getMinIntervalMs());
        this.callTimeoutMs = Math.max(1, config.getCallTimeoutMs());
        this.maxAttempts = Math.max(1, config.getMaxAttempts());
        this.batchThreshold = Math.max(1, config.getBatchThreshold());
        this.batchSize = Math.max(1, config.getBatchSize());
        this.reconnectPollMs = Math.max(1, config.getReconnectPollMs());
        this.backoff = Backoff.Policy.of(config);
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "sync-call");
            t.setDaemon(true);
            return t;
        });
    }

    // ── Producer side ──────────────────────────────────────────────────

    @Override
    public void onResourceSaved(String key, JsonNode snapshot) {
        enqueue(new SyncTask(key, snapshot, Instant.now()));
    }

    /**
     * Queue a task. Never blocks.
     *
     * @return {@code false} if the queue was full and the task was not taken
     */
    public boolean enqueue(SyncTask task) {
        outstanding.incrementAndGet();
        SyncQueue.Offer offer = queue.offer(task);
        if (offer != SyncQueue.Offer.ADDED) {
            outstanding.decrementAndGet();
        }
        switch (offer) {
            case COALESCED:
                coalesced.incrementAndGet();
                log.debug("Coalesced pending sync of {}", task.key());
                return true;
            case REJECTED:
                rejected.incrementAndGet();
                log.error("Sync queue full ({} resources), not mirroring save of {}", queue.capacity(), task.key());
                return false;
            case ADDED:
            default:
                log.debug("Queued sync of {} ({} pending)", task.key(), queue.size());
                return true;
        }
    }

    // ── Lifecycle ──────────────────────────────────────────────────────

    public synchronized void start() {
        if (worker != null) {
            return;
        }
        stopping.set(false);
        Thread t = new Thread(this::runWorker, "sync-worker");
        t.setDaemon(true);
        worker = t;
        t.start();
        log.info("Sync engine started against {}", connector.describe());
    }

    public boolean isRunning() {
        Thread t = worker;
        return t != null && t.isAlive();
    }

    /**
     * Wait until every queued task has been processed (pushed or dropped).
     *
     * @return {@code true} if the queue drained within the timeout
     */
    public boolean flush(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (!isIdle()) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                try {
                    idleMonitor.wait(Math.min(remainingMs, IDLE_POLL_MS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    /**
     * Flush for at most {@code timeout}, then stop the worker.
     */
    public void shutdown(Duration timeout) {
        if (!flush(timeout)) {
            log.warn("Sync queue not drained within {}ms, {} task(s) will not be mirrored",
                    timeout.toMillis(), queue.size() + (inFlight != null ? 1 : 0));
        }
        close();
    }

    @Override
    public void close() {
        stopping.set(true);
        Thread t;
        synchronized (this) {
            t = worker;
            worker = null;
        }
        if (t != null) {
            t.interrupt();
            try {
                t.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        callExecutor.shutdownNow();
        log.info("Sync engine stopped ({})", stats());
    }

    public SyncStats stats() {
        return new SyncStats(pushed.get(), retried.get(), dropped.get(), coalesced.get(), rejected.get(),
                queue.size());
    }

    private boolean isIdle() {
        return outstanding.get() <= 0;
    }

    // ── Worker ─────────────────────────────────────────────────────────

    private void runWorker() {
        while (!stopping.get()) {
            SyncTask task;
            try {
                task = queue.poll(IDLE_POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                break;
            }
            if (task == null) {
                signalIdle();
                continue;
            }
            inFlight = task;
            try {
                deliver(task);
            } catch (InterruptedException e) {
                log.warn("Sync of {} interrupted by shutdown", task.key());
                break;
            } catch (RuntimeException e) {
                dropped.incrementAndGet();
                log.error("Unexpected failure syncing {}: {}", task.key(), ErrorUtils.formatErrorChain(e), e);
            } finally {
                inFlight = null;
                outstanding.decrementAndGet();
                signalIdle();
            }
        }
        log.debug("Sync worker exiting");
    }

    private void signalIdle() {
        synchronized (idleMonitor) {
            idleMonitor.notifyAll();
        }
    }

    /**
     * Push one task, retrying as needed. Batches already accepted by the
     * mirror are not re-sent on retry.
     */
    void deliver(SyncTask task) throws InterruptedException {
        JsonNode snapshot = task.snapshot();
        List<RecordBatch> batches = RecordBatch.recordCount(snapshot) > batchThreshold
                ? RecordBatch.split(snapshot, batchSize)
                : null;
        int nextBatch = 0;
        int attempt = 0;

        while (true) {
            awaitConnected(task);
            attempt++;
            try {
                if (batches == null) {
                    call(() -> connector.push(task.key(), snapshot));
                } else {
                    while (nextBatch < batches.size()) {
                        RecordBatch batch = batches.get(nextBatch);
                        call(() -> connector.pushBatch(task.key(), batch));
                        nextBatch++;
                    }
                }
                pushed.incrementAndGet();
                log.debug("Mirrored {} after {} attempt(s){}", task.key(), attempt,
                        batches != null ? " in " + batches.size() + " batches" : "");
                return;
            } catch (RemoteThrottledException e) {
                if (attempt >= maxAttempts) {
                    dropped.incrementAndGet();
                    log.error("Dropping sync of {} after {} attempts: {}", task.key(), attempt, e.getMessage());
                    return;
                }
                long delay = backoff.delayMs(attempt, e.getRetryAfterMs());
                retried.incrementAndGet();
                log.warn("Sync of {} throttled (attempt {}/{}): {}; retrying in {}ms",
                        task.key(), attempt, maxAttempts, e.getMessage(), delay);
                Backoff.sleepUnlessStopped(delay, stopping::get);
            } catch (RemoteUnavailableException e) {
                // Lost connectivity mid-task: wait it out without spending an attempt.
                attempt--;
                log.warn("Mirror unreachable while syncing {}: {}", task.key(), e.getMessage());
                Backoff.sleepUnlessStopped(reconnectPollMs, stopping::get);
            } catch (RemoteRejectedException e) {
                dropped.incrementAndGet();
                log.error("Mirror rejected sync of {} (status {}): {}", task.key(), e.getStatus(), e.getMessage());
                return;
            } catch (RemoteException e) {
                dropped.incrementAndGet();
                log.error("Sync of {} failed: {}", task.key(), ErrorUtils.formatErrorChain(e));
                return;
            }
        }
    }

    private void awaitConnected(SyncTask task) throws InterruptedException {
        if (connector.isConnected()) {
            return;
        }
        log.warn("Mirror disconnected, pausing sync of {} ({} more pending)", task.key(), queue.size());
        while (!connector.isConnected()) {
            Backoff.sleepUnlessStopped(reconnectPollMs, stopping::get);
        }
        log.info("Mirror reachable again, resuming sync");
    }

    @FunctionalInterface
    interface RemoteCall {
        void run() throws RemoteException;
    }

    /**
     * Run one remote call after the minimum interval, bounded by the call
     * timeout. A timeout counts as throttling.
     */
    private void call(RemoteCall remoteCall) throws RemoteException, InterruptedException {
        long sinceLast = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastCallNanos);
        if (lastCallNanos != 0 && sinceLast < minIntervalMs) {
            Backoff.sleepUnlessStopped(minIntervalMs - sinceLast, stopping::get);
        }
        lastCallNanos = System.nanoTime();

        Future<Void> future = callExecutor.submit(() -> {
            remoteCall.run();
            return null;
        });
        try {
            future.get(callTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RemoteThrottledException("remote call timed out after " + callTimeoutMs + "ms", 0, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RemoteException remote) {
                throw remote;
            }
            // Unknown connector failures are treated as transient.
            throw new RemoteThrottledException("remote call failed: " + ErrorUtils.formatErrorMessage(cause), 0,
                    cause);
        }
    }
}
