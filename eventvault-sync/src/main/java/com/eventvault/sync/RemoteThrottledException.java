package com.eventvault.sync;

/**
 * The remote side asked us to slow down, or a call did not finish in time.
 * Retried with backoff.
 */
public class RemoteThrottledException extends RemoteException {

    private final long retryAfterMs;

    public RemoteThrottledException(String message) {
        this(message, 0, null);
    }

    public RemoteThrottledException(String message, long retryAfterMs) {
        this(message, retryAfterMs, null);
    }

    public RemoteThrottledException(String message, long retryAfterMs, Throwable cause) {
        super(message, cause);
        this.retryAfterMs = Math.max(0, retryAfterMs);
    }

    /** Server hint in milliseconds, {@code 0} when none was given. */
    public long getRetryAfterMs() {
        return retryAfterMs;
    }
}
