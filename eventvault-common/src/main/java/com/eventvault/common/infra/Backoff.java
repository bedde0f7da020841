package com.eventvault.common.infra;

import com.eventvault.common.config.EventVaultConfig.RemoteConfig;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Retry delays for remote calls: exponential growth, random jitter on top,
 * never shorter than the remote side's retry-after hint, never above the cap.
 */
public final class Backoff {

    private static final long STOP_CHECK_MS = 50;

    private Backoff() {
    }

    /**
     * @param initialMs delay before the first retry
     * @param maxMs     upper bound for any delay, hint included
     * @param factor    growth per attempt
     * @param jitter    extra random share of the base delay, 0..1
     */
    public record Policy(long initialMs, long maxMs, double factor, double jitter) {

        public static Policy of(RemoteConfig remote) {
            return new Policy(remote.getBackoffInitialMs(), remote.getBackoffMaxMs(),
                    remote.getBackoffFactor(), remote.getBackoffJitter());
        }

        /**
         * Delay before retrying after failed attempt number {@code attempt}.
         *
         * @param attempt      1-based number of the attempt that failed
         * @param retryAfterMs hint from the remote side; ignored if {@code <= 0}
         */
        public long delayMs(int attempt, long retryAfterMs) {
            double base = initialMs * Math.pow(factor, Math.max(0, attempt - 1));
            double spread = jitter > 0 ? base * jitter * ThreadLocalRandom.current().nextDouble() : 0;
            long delay = Math.max(Math.round(base + spread), retryAfterMs);
            return Math.min(maxMs, delay);
        }

        public long delayMs(int attempt) {
            return delayMs(attempt, 0);
        }
    }

    /**
     * Sleep for {@code ms}, checking {@code stopped} between short slices.
     *
     * @throws InterruptedException if interrupted, or if {@code stopped}
     *                              turns true before the time is up
     */
    public static void sleepUnlessStopped(long ms, BooleanSupplier stopped) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0, ms));
        long remainingMs = ms;
        while (remainingMs > 0) {
            if (stopped.getAsBoolean()) {
                throw new InterruptedException("stopped");
            }
            TimeUnit.MILLISECONDS.sleep(Math.min(remainingMs, STOP_CHECK_MS));
            remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        }
    }
}
