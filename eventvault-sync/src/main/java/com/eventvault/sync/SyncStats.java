package com.eventvault.sync;

/**
 * Counters since the engine was created.
 *
 * @param pushed    tasks delivered to the mirror
 * @param retried   retry attempts after throttling or timeouts
 * @param dropped   tasks given up after exhausting retries or on rejection
 * @param coalesced saves folded into an already-queued task
 * @param rejected  saves not queued because the queue was full
 * @param pending   tasks currently waiting (not counting one in flight)
 */
public record SyncStats(long pushed, long retried, long dropped, long coalesced, long rejected, int pending) {
}
