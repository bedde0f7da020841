package com.eventvault.admission;

import java.util.Map;

/**
 * Current counters of one actor.
 *
 * @param commandsLastMinute    admitted actions in the rolling minute
 * @param commandsLastHour      admitted actions in the rolling hour
 * @param buttonsLastMinute     admitted control triggers in the rolling minute
 * @param activeCooldownSeconds action class to whole seconds remaining
 * @param rateLimited           whether the per-minute budget is exhausted
 */
public record ActorStats(int commandsLastMinute, int commandsLastHour, int buttonsLastMinute,
        Map<String, Long> activeCooldownSeconds, boolean rateLimited) {

    public ActorStats {
        activeCooldownSeconds = Map.copyOf(activeCooldownSeconds);
    }
}
