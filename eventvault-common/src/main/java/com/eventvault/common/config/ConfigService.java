package com.eventvault.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the EventVault configuration.
 * <p>
 * The raw file goes through {@code ${VAR}} / {@code ${VAR:-default}}
 * substitution before parsing, then environment overrides are applied on top.
 */
@Slf4j
public class ConfigService {

    public static final String ENV_CONFIG = "EVENTVAULT_CONFIG";
    public static final String ENV_DATA_DIR = "EVENTVAULT_DATA_DIR";
    public static final String ENV_BACKUP_DIR = "EVENTVAULT_BACKUP_DIR";
    public static final String ENV_REMOTE_ENDPOINT = "EVENTVAULT_REMOTE_ENDPOINT";
    public static final String ENV_REMOTE_TOKEN = "EVENTVAULT_REMOTE_TOKEN";

    public static final Path DEFAULT_CONFIG_PATH = Path.of("config", "eventvault.json");

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, EventVaultConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    ConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            configPath = Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Resolve the config path from {@value #ENV_CONFIG}, falling back to
     * {@link #DEFAULT_CONFIG_PATH}.
     */
    public static Path resolveConfigPath(Map<String, String> env) {
        String fromEnv = env.get(ENV_CONFIG);
        return fromEnv != null && !fromEnv.isBlank() ? Path.of(fromEnv.trim()) : DEFAULT_CONFIG_PATH;
    }

    /**
     * Load config with caching.
     *
     * @throws ConfigurationException if the file exists but cannot be parsed
     */
    public EventVaultConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public EventVaultConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private EventVaultConfig doLoadConfig() {
        EventVaultConfig config;
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            config = new EventVaultConfig();
        } else {
            try {
                String raw = substituteEnvVars(Files.readString(configPath));
                config = objectMapper.readValue(raw, EventVaultConfig.class);
                log.info("Config loaded from: {}", configPath);
            } catch (IOException e) {
                log.error("Failed to load config from: {}", configPath, e);
                throw new ConfigurationException("Unreadable config file " + configPath, e);
            }
        }
        return resolveBackupDir(applyEnvOverrides(applyDefaults(config)));
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Fill sections a partial config file left null.
     */
    EventVaultConfig applyDefaults(EventVaultConfig config) {
        if (config.getStorage() == null) {
            config.setStorage(new EventVaultConfig.StorageConfig());
        }
        if (config.getRemote() == null) {
            config.setRemote(new EventVaultConfig.RemoteConfig());
        }
        if (config.getAdmission() == null) {
            config.setAdmission(new EventVaultConfig.AdmissionConfig());
        }
        if (config.getBackup() == null) {
            config.setBackup(new EventVaultConfig.BackupConfig());
        }
        return config;
    }

    private EventVaultConfig resolveBackupDir(EventVaultConfig config) {
        String backupDir = config.getBackup().getBackupDir();
        String dataDir = config.getStorage().getDataDir();
        if ((backupDir == null || backupDir.isBlank()) && dataDir != null && !dataDir.isBlank()) {
            config.getBackup().setBackupDir(
                    Path.of(dataDir, "backups").toString());
        }
        return config;
    }

    EventVaultConfig applyEnvOverrides(EventVaultConfig config) {
        String dataDir = env.get(ENV_DATA_DIR);
        if (dataDir != null && !dataDir.isBlank()) {
            config.getStorage().setDataDir(dataDir.trim());
        }
        String backupDir = env.get(ENV_BACKUP_DIR);
        if (backupDir != null && !backupDir.isBlank()) {
            config.getBackup().setBackupDir(backupDir.trim());
        }
        String endpoint = env.get(ENV_REMOTE_ENDPOINT);
        if (endpoint != null && !endpoint.isBlank()) {
            config.getRemote().setEndpoint(endpoint.trim());
        }
        String token = env.get(ENV_REMOTE_TOKEN);
        if (token != null && !token.isBlank()) {
            config.getRemote().setToken(token.trim());
        }
        return config;
    }
}
