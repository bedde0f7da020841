package com.eventvault.admission;

/**
 * Counters across all actors.
 *
 * @param activeActorsLastHour actors with at least one action in the last hour
 * @param rateLimitedActors    actors whose per-minute budget is exhausted
 * @param commandsLastHour     actions admitted in the last hour
 * @param activeCooldowns      cooldowns still running
 */
public record GlobalStats(int activeActorsLastHour, int rateLimitedActors, long commandsLastHour,
        int activeCooldowns) {
}
