package com.eventvault.admission;

import com.eventvault.common.config.EventVaultConfig.AdmissionConfig;

import java.util.HashMap;
import java.util.Map;

/**
 * Limits applied by the {@link AdmissionController}, in milliseconds.
 *
 * @param commandsPerMinute actions per rolling minute
 * @param commandsPerHour   actions per rolling hour
 * @param buttonsPerMinute  control triggers per rolling minute
 * @param burstWindowMs     window of the burst detector
 * @param burstLimit        triggers tolerated inside the burst window
 * @param cooldownMs        per action class minimum gap between two uses
 */
public record AdmissionLimits(int commandsPerMinute, int commandsPerHour, int buttonsPerMinute,
        long burstWindowMs, int burstLimit, Map<String, Long> cooldownMs) {

    public AdmissionLimits {
        cooldownMs = Map.copyOf(cooldownMs);
    }

    public static AdmissionLimits defaults() {
        return from(new AdmissionConfig());
    }

    public static AdmissionLimits from(AdmissionConfig config) {
        Map<String, Long> cooldowns = new HashMap<>();
        if (config.getCooldownSeconds() != null) {
            config.getCooldownSeconds().forEach((action, seconds) -> {
                if (seconds != null && seconds > 0) {
                    cooldowns.put(action, seconds * 1000);
                }
            });
        }
        return new AdmissionLimits(config.getCommandsPerMinute(), config.getCommandsPerHour(),
                config.getButtonsPerMinute(), config.getButtonBurstWindowSeconds() * 1000L,
                config.getButtonBurstLimit(), cooldowns);
    }

    /** Cooldown of an action class, {@code 0} if it has none. */
    public long cooldownFor(String action) {
        return cooldownMs.getOrDefault(action, 0L);
    }

    public long longestCooldownMs() {
        return cooldownMs.values().stream().mapToLong(Long::longValue).max().orElse(0);
    }
}
