package com.eventvault.common.config;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Semantic checks on a loaded configuration.
 * <p>
 * Errors make the configuration unusable; warnings are logged and tolerated.
 */
@Slf4j
public final class ConfigValidation {

    private ConfigValidation() {
    }

    public enum Severity {
        ERROR, WARNING
    }

    public record ValidationIssue(
            String path,
            String message,
            Severity severity) {

        @Override
        public String toString() {
            return path + ": " + message;
        }
    }

    public record ValidationResult(
            boolean ok,
            List<ValidationIssue> issues,
            List<ValidationIssue> warnings) {
    }

    /**
     * Validate a config object after deserialization.
     */
    public static ValidationResult validate(EventVaultConfig config) {
        List<ValidationIssue> issues = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();

        validateStorage(config.getStorage(), issues);
        validateRemote(config.getRemote(), issues, warnings);
        validateAdmission(config.getAdmission(), issues, warnings);
        validateBackup(config.getBackup(), issues);

        return new ValidationResult(issues.isEmpty(), List.copyOf(issues), List.copyOf(warnings));
    }

    /**
     * Validate and fail loudly on any error.
     *
     * @throws ConfigurationException listing every error found
     */
    public static EventVaultConfig requireValid(EventVaultConfig config) {
        ValidationResult result = validate(config);
        for (ValidationIssue warning : result.warnings()) {
            log.warn("Config warning: {}", warning);
        }
        if (!result.ok()) {
            List<String> problems = result.issues().stream().map(ValidationIssue::toString).toList();
            log.error("Invalid configuration: {}", problems);
            throw new ConfigurationException("Invalid configuration", problems);
        }
        return config;
    }

    private static void validateStorage(EventVaultConfig.StorageConfig storage, List<ValidationIssue> issues) {
        if (storage == null) {
            issues.add(error("storage", "section is missing"));
            return;
        }
        if (storage.getDataDir() == null || storage.getDataDir().isBlank()) {
            issues.add(error("storage.dataDir", "data directory is required"));
        }
        if (storage.getLockTimeoutMs() <= 0) {
            issues.add(error("storage.lockTimeoutMs", "must be positive, got " + storage.getLockTimeoutMs()));
        }
    }

    private static void validateRemote(EventVaultConfig.RemoteConfig remote,
            List<ValidationIssue> issues, List<ValidationIssue> warnings) {
        if (remote == null) {
            return;
        }
        if (remote.getMinIntervalMs() < 0) {
            issues.add(error("remote.minIntervalMs", "must not be negative"));
        }
        if (remote.getCallTimeoutMs() <= 0) {
            issues.add(error("remote.callTimeoutMs", "must be positive"));
        }
        if (remote.getMaxAttempts() < 1) {
            issues.add(error("remote.maxAttempts", "must be at least 1"));
        }
        if (remote.getBackoffInitialMs() < 0 || remote.getBackoffMaxMs() < remote.getBackoffInitialMs()) {
            issues.add(error("remote.backoff", "require 0 <= backoffInitialMs <= backoffMaxMs"));
        }
        if (remote.getBackoffJitter() < 0 || remote.getBackoffJitter() > 1) {
            issues.add(error("remote.backoffJitter", "must be within 0..1"));
        }
        if (remote.getBatchSize() < 1 || remote.getBatchThreshold() < 1) {
            issues.add(error("remote.batchSize", "batchSize and batchThreshold must be positive"));
        }
        if (remote.getQueueCapacity() < 1) {
            issues.add(error("remote.queueCapacity", "must be positive"));
        }
        if (remote.isConfigured() && (remote.getToken() == null || remote.getToken().isBlank())) {
            warnings.add(new ValidationIssue("remote.token",
                    "endpoint configured without a token", Severity.WARNING));
        }
    }

    private static void validateAdmission(EventVaultConfig.AdmissionConfig admission,
            List<ValidationIssue> issues, List<ValidationIssue> warnings) {
        if (admission == null) {
            return;
        }
        if (admission.getCommandsPerMinute() < 1) {
            issues.add(error("admission.commandsPerMinute", "must be at least 1"));
        }
        if (admission.getCommandsPerHour() < admission.getCommandsPerMinute()) {
            warnings.add(new ValidationIssue("admission.commandsPerHour",
                    "hourly budget below the per-minute budget", Severity.WARNING));
        }
        if (admission.getButtonsPerMinute() < 1 || admission.getButtonBurstLimit() < 1
                || admission.getButtonBurstWindowSeconds() < 1) {
            issues.add(error("admission.buttons", "button limits and burst window must be positive"));
        }
        if (admission.getCooldownSeconds() != null) {
            for (Map.Entry<String, Long> entry : admission.getCooldownSeconds().entrySet()) {
                if (entry.getValue() == null || entry.getValue() < 0) {
                    issues.add(error("admission.cooldownSeconds." + entry.getKey(), "must not be negative"));
                }
            }
        }
    }

    private static void validateBackup(EventVaultConfig.BackupConfig backup, List<ValidationIssue> issues) {
        if (backup == null) {
            return;
        }
        if (backup.getMaxBackups() < 1) {
            issues.add(error("backup.maxBackups", "must keep at least one archive"));
        }
        if (backup.getMaxAgeDays() < 0 || backup.getMaxTotalMb() < 0 || backup.getIntervalHours() < 0) {
            issues.add(error("backup", "maxAgeDays, maxTotalMb and intervalHours must not be negative"));
        }
    }

    private static ValidationIssue error(String path, String message) {
        return new ValidationIssue(path, message, Severity.ERROR);
    }
}
