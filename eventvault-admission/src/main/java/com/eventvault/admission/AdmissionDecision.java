package com.eventvault.admission;

import java.time.Duration;

/**
 * Outcome of an admission check. A denial is a normal result, not an error.
 *
 * @param allowed    whether the action may proceed
 * @param reason     why it was denied; {@code null} when allowed
 * @param message    human-readable explanation for the actor
 * @param retryAfter how long until the same request would pass; zero when allowed
 */
public record AdmissionDecision(boolean allowed, DenialReason reason, String message, Duration retryAfter) {

    private static final AdmissionDecision ALLOWED = new AdmissionDecision(true, null, null, Duration.ZERO);

    public static AdmissionDecision allow() {
        return ALLOWED;
    }

    public static AdmissionDecision deny(DenialReason reason, String message, long retryAfterMs) {
        return new AdmissionDecision(false, reason, message, Duration.ofMillis(Math.max(0, retryAfterMs)));
    }

    public boolean denied() {
        return !allowed;
    }
}
