package com.eventvault.app;

import com.eventvault.common.config.ConfigService;
import com.eventvault.common.config.ConfigurationException;
import com.eventvault.common.config.EventVaultConfig;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Process entry point. Loads configuration from {@code EVENTVAULT_CONFIG}
 * (or {@code config/eventvault.json}), starts EventVault and keeps the
 * process alive until it is asked to stop.
 */
@Slf4j
public final class EventVaultMain {

    private EventVaultMain() {
    }

    public static void main(String[] args) {
        Path configPath = args.length > 0 ? Path.of(args[0]) : ConfigService.resolveConfigPath(System.getenv());
        EventVault vault;
        try {
            EventVaultConfig config = new ConfigService(configPath).loadConfig();
            vault = new EventVault(config).start();
        } catch (ConfigurationException e) {
            log.error("Refusing to start: {}", e.getMessage());
            System.exit(2);
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            vault.close();
            stopped.countDown();
        }, "eventvault-shutdown"));

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            vault.close();
        }
    }
}
