package com.eventvault.common.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigValidationTest {

    @Test
    void defaults_areValid() {
        var result = ConfigValidation.validate(new EventVaultConfig());
        assertTrue(result.ok());
        assertTrue(result.issues().isEmpty());
    }

    @Test
    void blankDataDir_isError() {
        EventVaultConfig config = new EventVaultConfig();
        config.getStorage().setDataDir("  ");

        var result = ConfigValidation.validate(config);

        assertFalse(result.ok());
        assertEquals("storage.dataDir", result.issues().get(0).path());
    }

    @Test
    void requireValid_listsEveryProblem() {
        EventVaultConfig config = new EventVaultConfig();
        config.getStorage().setDataDir(null);
        config.getRemote().setMaxAttempts(0);
        config.getBackup().setMaxBackups(0);

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigValidation.requireValid(config));

        assertEquals(3, e.getProblems().size());
        assertTrue(e.getMessage().contains("remote.maxAttempts"));
    }

    @Test
    void endpointWithoutToken_isOnlyWarning() {
        EventVaultConfig config = new EventVaultConfig();
        config.getRemote().setEndpoint("https://mirror.example");

        var result = ConfigValidation.validate(config);

        assertTrue(result.ok());
        assertEquals(1, result.warnings().size());
        assertSame(config, ConfigValidation.requireValid(config));
    }

    @Test
    void negativeCooldown_isError() {
        EventVaultConfig config = new EventVaultConfig();
        config.getAdmission().getCooldownSeconds().put("win", -1L);

        assertFalse(ConfigValidation.validate(config).ok());
    }
}
