package com.eventvault.admission;

/**
 * Why an action was not admitted.
 */
public enum DenialReason {
    /** Too many actions in the rolling minute. */
    MINUTE_LIMIT,
    /** Too many actions in the rolling hour. */
    HOUR_LIMIT,
    /** The action itself is still cooling down for this actor. */
    COOLDOWN,
    /** Too many control triggers in the rolling minute. */
    BUTTON_MINUTE_LIMIT,
    /** Rapid repeated triggering of a control. */
    BUTTON_BURST
}
