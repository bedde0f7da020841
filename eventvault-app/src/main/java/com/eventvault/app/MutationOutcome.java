package com.eventvault.app;

import com.eventvault.admission.AdmissionDecision;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * Result of {@link MutationGateway#mutate}.
 *
 * @param status   what happened
 * @param value    the saved document when {@link Status#APPLIED}
 * @param decision the admission decision; carries the denial reason
 */
public record MutationOutcome(Status status, JsonNode value, AdmissionDecision decision) {

    public enum Status {
        /** Admitted and durably saved. */
        APPLIED,
        /** Refused by admission control; nothing was read or written. */
        DENIED,
        /** The mutation function declined to change anything. */
        UNCHANGED,
        /** Admitted, but the store could not save. */
        FAILED
    }

    static MutationOutcome applied(JsonNode value, AdmissionDecision decision) {
        return new MutationOutcome(Status.APPLIED, value, decision);
    }

    static MutationOutcome denied(AdmissionDecision decision) {
        return new MutationOutcome(Status.DENIED, null, decision);
    }

    static MutationOutcome unchanged(AdmissionDecision decision) {
        return new MutationOutcome(Status.UNCHANGED, null, decision);
    }

    static MutationOutcome failed(AdmissionDecision decision) {
        return new MutationOutcome(Status.FAILED, null, decision);
    }

    public boolean applied() {
        return status == Status.APPLIED;
    }

    /** Human-readable reason for a denial, {@code null} otherwise. */
    public String message() {
        return status == Status.DENIED ? decision.message() : null;
    }

    public Duration retryAfter() {
        return decision != null ? decision.retryAfter() : Duration.ZERO;
    }
}
