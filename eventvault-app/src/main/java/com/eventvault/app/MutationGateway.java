package com.eventvault.app;

import com.eventvault.admission.AdmissionController;
import com.eventvault.admission.AdmissionDecision;
import com.eventvault.store.ResourceStore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Entry point for actor-initiated changes: admission first, then a locked
 * load-modify-save on the store. A denied actor never reaches the store.
 */
@Slf4j
public class MutationGateway {

    private final AdmissionController admission;
    private final ResourceStore store;

    public MutationGateway(AdmissionController admission, ResourceStore store) {
        this.admission = admission;
        this.store = store;
    }

    /**
     * Apply {@code fn} to a resource on behalf of an actor.
     *
     * @param actorId     actor requesting the change
     * @param actionClass action name used for rate limits and cooldowns
     * @param key         resource to change
     * @param fn          returns the new document, or {@code null} to leave it
     *                    unchanged
     */
    public MutationOutcome mutate(long actorId, String actionClass, String key, UnaryOperator<JsonNode> fn) {
        Objects.requireNonNull(actionClass, "action class is required");
        Objects.requireNonNull(key, "resource key is required");
        Objects.requireNonNull(fn, "mutation is required");
        AdmissionDecision decision = admission.check(actorId, actionClass);
        if (decision.denied()) {
            log.debug("Mutation of {} by {} ({}) denied: {}", key, actorId, actionClass, decision.message());
            return MutationOutcome.denied(decision);
        }

        AtomicBoolean declined = new AtomicBoolean(false);
        Optional<JsonNode> saved = store.update(key, null, current -> {
            JsonNode next = fn.apply(current);
            if (next == null) {
                declined.set(true);
            }
            return next;
        });
        if (saved.isPresent()) {
            log.debug("Applied {} to {} for actor {}", actionClass, key, actorId);
            return MutationOutcome.applied(saved.get(), decision);
        }
        if (declined.get()) {
            return MutationOutcome.unchanged(decision);
        }
        log.warn("Mutation of {} by {} ({}) was admitted but could not be saved", key, actorId, actionClass);
        return MutationOutcome.failed(decision);
    }

    /**
     * Admission check for an interactive control (button) before it triggers
     * a mutation.
     */
    public AdmissionDecision checkButton(long actorId) {
        return admission.recordButtonTrigger(actorId);
    }
}
