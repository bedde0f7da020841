package com.eventvault.admission;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decides whether an actor may perform an action right now.
 * <p>
 * Per actor it keeps the timestamps of admitted actions (rolling minute and
 * hour budgets), the last use of each action class that has a cooldown, and
 * the timestamps of control triggers (per-minute budget plus a short burst
 * detector). Only admitted requests are recorded. State lives in memory only
 * and is forgotten on restart; actors idle for longer than every window are
 * evicted.
 * <p>
 * An entry counts towards a window while {@code now - t <= window}.
 */
@Slf4j
public class AdmissionController {

    static final long MINUTE_MS = 60_000;
    static final long HOUR_MS = 3_600_000;

    private final AdmissionLimits limits;
    private final Cache<Long, ActorState> actors;

    public AdmissionController(AdmissionLimits limits) {
        this.limits = limits;
        this.actors = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofMillis(HOUR_MS + limits.longestCooldownMs()))
                .build();
    }

    public AdmissionController() {
        this(AdmissionLimits.defaults());
    }

    public AdmissionLimits getLimits() {
        return limits;
    }

    // ── Actions ────────────────────────────────────────────────────────

    /**
     * Check and, if admitted, record an action. Never touches stored
     * resources.
     *
     * @param actorId the acting user
     * @param action  action class, e.g. {@code "win"}; not {@code null}
     */
    public AdmissionDecision check(long actorId, String action) {
        return check(actorId, action, System.currentTimeMillis());
    }

    /**
     * Check with an explicit timestamp (useful for testing).
     */
    public AdmissionDecision check(long actorId, String action, long nowMs) {
        Objects.requireNonNull(action, "action class is required");
        ActorState state = actors.get(actorId, id -> new ActorState());
        AdmissionDecision decision;
        synchronized (state) {
            decision = state.checkCommand(action, nowMs);
        }
        if (decision.denied()) {
            log.debug("Denied {} for actor {}: {}", action, actorId, decision.message());
        }
        return decision;
    }

    /**
     * Check and, if admitted, record a trigger of an interactive control.
     */
    public AdmissionDecision recordButtonTrigger(long actorId) {
        return recordButtonTrigger(actorId, System.currentTimeMillis());
    }

    public AdmissionDecision recordButtonTrigger(long actorId, long nowMs) {
        ActorState state = actors.get(actorId, id -> new ActorState());
        AdmissionDecision decision;
        synchronized (state) {
            decision = state.checkButton(nowMs);
        }
        if (decision.denied()) {
            log.debug("Denied control trigger for actor {}: {}", actorId, decision.message());
        }
        return decision;
    }

    /**
     * Forget every counter and cooldown of an actor. Privileged.
     */
    public void reset(long actorId) {
        actors.invalidate(actorId);
        log.info("Reset admission counters for actor {}", actorId);
    }

    // ── Observability ──────────────────────────────────────────────────

    public ActorStats stats(long actorId) {
        return stats(actorId, System.currentTimeMillis());
    }

    public ActorStats stats(long actorId, long nowMs) {
        ActorState state = actors.getIfPresent(actorId);
        if (state == null) {
            return new ActorStats(0, 0, 0, Map.of(), false);
        }
        synchronized (state) {
            int lastMinute = countWithin(state.commands, nowMs, MINUTE_MS);
            return new ActorStats(lastMinute, countWithin(state.commands, nowMs, HOUR_MS),
                    countWithin(state.buttons, nowMs, MINUTE_MS), state.activeCooldownSeconds(nowMs),
                    lastMinute >= limits.commandsPerMinute());
        }
    }

    /**
     * Whether the actor's per-minute budget is currently exhausted.
     */
    public boolean isRateLimited(long actorId) {
        return isRateLimited(actorId, System.currentTimeMillis());
    }

    public boolean isRateLimited(long actorId, long nowMs) {
        ActorState state = actors.getIfPresent(actorId);
        if (state == null) {
            return false;
        }
        synchronized (state) {
            return countWithin(state.commands, nowMs, MINUTE_MS) >= limits.commandsPerMinute();
        }
    }

    public GlobalStats globalStats() {
        return globalStats(System.currentTimeMillis());
    }

    public GlobalStats globalStats(long nowMs) {
        int active = 0;
        int limited = 0;
        long commands = 0;
        int cooldowns = 0;
        for (ActorState state : actors.asMap().values()) {
            synchronized (state) {
                int lastHour = countWithin(state.commands, nowMs, HOUR_MS);
                if (lastHour > 0) {
                    active++;
                }
                if (countWithin(state.commands, nowMs, MINUTE_MS) >= limits.commandsPerMinute()) {
                    limited++;
                }
                commands += lastHour;
                cooldowns += state.activeCooldownSeconds(nowMs).size();
            }
        }
        return new GlobalStats(active, limited, commands, cooldowns);
    }

    // ── Internals ──────────────────────────────────────────────────────

    private static int countWithin(Deque<Long> timestamps, long nowMs, long windowMs) {
        int count = 0;
        for (long t : timestamps) {
            if (nowMs - t <= windowMs) {
                count++;
            }
        }
        return count;
    }

    /** Oldest timestamp still inside the window, or {@code nowMs} if none. */
    private static long oldestWithin(Deque<Long> timestamps, long nowMs, long windowMs) {
        for (long t : timestamps) {
            if (nowMs - t <= windowMs) {
                return t;
            }
        }
        return nowMs;
    }

    /** Milliseconds until an entry made at {@code t} leaves the window. */
    private static long untilExpiry(long t, long nowMs, long windowMs) {
        return t + windowMs - nowMs + 1;
    }

    private static void pruneOlderThan(Deque<Long> timestamps, long nowMs, long windowMs) {
        Iterator<Long> it = timestamps.iterator();
        while (it.hasNext() && nowMs - it.next() > windowMs) {
            it.remove();
        }
    }

    private static long ceilSeconds(long ms) {
        return (ms + 999) / 1000;
    }

    /** Counters of one actor; guarded by its own monitor. */
    private final class ActorState {
        final Deque<Long> commands = new ArrayDeque<>();
        final Deque<Long> buttons = new ArrayDeque<>();
        final Map<String, Long> lastUsed = new HashMap<>();

        AdmissionDecision checkCommand(String action, long nowMs) {
            pruneOlderThan(commands, nowMs, HOUR_MS);

            int lastMinute = countWithin(commands, nowMs, MINUTE_MS);
            if (lastMinute >= limits.commandsPerMinute()) {
                return AdmissionDecision.deny(DenialReason.MINUTE_LIMIT,
                        "Rate limit: max " + limits.commandsPerMinute() + " commands per minute",
                        untilExpiry(oldestWithin(commands, nowMs, MINUTE_MS), nowMs, MINUTE_MS));
            }
            if (commands.size() >= limits.commandsPerHour()) {
                return AdmissionDecision.deny(DenialReason.HOUR_LIMIT,
                        "Rate limit: max " + limits.commandsPerHour() + " commands per hour",
                        untilExpiry(commands.peekFirst(), nowMs, HOUR_MS));
            }
            long cooldown = limits.cooldownFor(action);
            if (cooldown > 0) {
                Long last = lastUsed.get(action);
                if (last != null) {
                    long left = cooldown - (nowMs - last);
                    if (left > 0) {
                        return AdmissionDecision.deny(DenialReason.COOLDOWN,
                                "Command cooldown: " + ceilSeconds(left) + "s remaining", left);
                    }
                }
            }

            commands.addLast(nowMs);
            if (cooldown > 0) {
                lastUsed.put(action, nowMs);
            }
            return AdmissionDecision.allow();
        }

        AdmissionDecision checkButton(long nowMs) {
            pruneOlderThan(buttons, nowMs, MINUTE_MS);

            if (buttons.size() >= limits.buttonsPerMinute()) {
                return AdmissionDecision.deny(DenialReason.BUTTON_MINUTE_LIMIT,
                        "Button rate limit: max " + limits.buttonsPerMinute() + " clicks per minute",
                        untilExpiry(buttons.peekFirst(), nowMs, MINUTE_MS));
            }
            if (countWithin(buttons, nowMs, limits.burstWindowMs()) >= limits.burstLimit()) {
                return AdmissionDecision.deny(DenialReason.BUTTON_BURST, "Button spam detected: slow down!",
                        untilExpiry(oldestWithin(buttons, nowMs, limits.burstWindowMs()), nowMs,
                                limits.burstWindowMs()));
            }

            buttons.addLast(nowMs);
            return AdmissionDecision.allow();
        }

        Map<String, Long> activeCooldownSeconds(long nowMs) {
            Map<String, Long> active = new LinkedHashMap<>();
            lastUsed.forEach((action, last) -> {
                long left = limits.cooldownFor(action) - (nowMs - last);
                if (left > 0) {
                    active.put(action, ceilSeconds(left));
                }
            });
            return active;
        }
    }
}
