package com.eventvault.common.config;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root configuration type for EventVault.
 * <p>
 * Every field carries the production default so that a missing or partial
 * config file still yields a usable configuration.
 */
@Data
public class EventVaultConfig {

    /** Local storage settings. */
    private StorageConfig storage = new StorageConfig();

    /** Remote tabular mirror settings. */
    private RemoteConfig remote = new RemoteConfig();

    /** Actor admission limits. */
    private AdmissionConfig admission = new AdmissionConfig();

    /** Snapshot archive settings. */
    private BackupConfig backup = new BackupConfig();

    // --- Nested config types ---

    @Data
    public static class StorageConfig {
        /** Directory holding one JSON document per resource. */
        private String dataDir = "data";
        /** How long a caller may wait for a resource lock. */
        private long lockTimeoutMs = 10_000;
        /** Per-resource default overrides, keyed by resource key. */
        private Map<String, Object> defaults = new LinkedHashMap<>();
    }

    @Data
    public static class RemoteConfig {
        /** Base URL of the tabular mirror; blank means offline. */
        private String endpoint;
        /** Bearer token for the mirror. */
        private String token;
        /** Minimum gap between two remote calls. */
        private long minIntervalMs = 100;
        /** Upper bound for a single remote call. */
        private long callTimeoutMs = 10_000;
        /** Attempts per push before the task is dropped. */
        private int maxAttempts = 5;
        private long backoffInitialMs = 1_000;
        private long backoffMaxMs = 64_000;
        private double backoffFactor = 2.0;
        private double backoffJitter = 0.5;
        /** Resources with more records than this are pushed in batches. */
        private int batchThreshold = 100;
        /** Records per batch. */
        private int batchSize = 50;
        /** How often a paused worker re-checks connectivity. */
        private long reconnectPollMs = 5_000;
        /** Maximum number of distinct resources waiting in the queue. */
        private int queueCapacity = 1024;
        /** Whether to pull absent resources from the mirror at startup. */
        private boolean bootstrapFromMirror = true;

        public boolean isConfigured() {
            return endpoint != null && !endpoint.isBlank();
        }
    }

    @Data
    public static class AdmissionConfig {
        private int commandsPerMinute = 10;
        private int commandsPerHour = 100;
        private int buttonsPerMinute = 5;
        /** Window for burst detection on interactive controls. */
        private int buttonBurstWindowSeconds = 2;
        /** Maximum triggers allowed inside the burst window. */
        private int buttonBurstLimit = 3;
        /** Per-action cooldowns in seconds. */
        private Map<String, Long> cooldownSeconds = defaultCooldowns();

        private static Map<String, Long> defaultCooldowns() {
            Map<String, Long> cooldowns = new LinkedHashMap<>();
            cooldowns.put("startevent", 300L);
            cooldowns.put("win", 60L);
            cooldowns.put("loss", 60L);
            cooldowns.put("block", 30L);
            cooldowns.put("unblock", 30L);
            return cooldowns;
        }
    }

    @Data
    public static class BackupConfig {
        /** Archive directory; defaults to {@code <dataDir>/backups}. */
        private String backupDir;
        private int maxBackups = 30;
        private int maxAgeDays = 30;
        private long maxTotalMb = 500;
        /** Interval of the automatic snapshot check; 0 disables it. */
        private int intervalHours = 6;
    }
}
