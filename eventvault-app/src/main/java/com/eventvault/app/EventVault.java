package com.eventvault.app;

import com.eventvault.admission.AdmissionController;
import com.eventvault.admission.AdmissionLimits;
import com.eventvault.backup.BackupManager;
import com.eventvault.common.config.ConfigValidation;
import com.eventvault.common.config.ConfigurationException;
import com.eventvault.common.config.EventVaultConfig;
import com.eventvault.common.config.EventVaultConfig.RemoteConfig;
import com.eventvault.common.infra.ErrorUtils;
import com.eventvault.store.ResourceCatalog;
import com.eventvault.store.ResourceStore;
import com.eventvault.store.integrity.BootstrapSource;
import com.eventvault.store.integrity.DisplayNameResolver;
import com.eventvault.store.integrity.FixReport;
import com.eventvault.store.integrity.IntegrityValidator;
import com.eventvault.sync.InMemoryConnector;
import com.eventvault.sync.RemoteBootstrap;
import com.eventvault.sync.RemoteConnector;
import com.eventvault.sync.SyncEngine;
import com.eventvault.sync.http.HttpTabularConnector;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires the store, integrity check, sync engine, admission control and
 * backups together and owns their lifecycle.
 * <p>
 * {@link #start()} runs the integrity check to completion before the sync
 * worker or backup schedule start, and before {@link #gateway()} is
 * available; nothing serves against unchecked data.
 */
@Slf4j
public class EventVault implements AutoCloseable {

    static final Duration SHUTDOWN_FLUSH_TIMEOUT = Duration.ofSeconds(10);

    private final EventVaultConfig config;
    private final RemoteConnector injectedConnector;
    private final DisplayNameResolver displayNames;

    private ResourceStore store;
    private RemoteConnector connector;
    private SyncEngine sync;
    private AdmissionController admission;
    private BackupManager backups;
    private MutationGateway gateway;
    private FixReport startupReport;
    private volatile boolean started;

    public EventVault(EventVaultConfig config) {
        this(config, null, DisplayNameResolver.NONE);
    }

    /**
     * @param connector    mirror connector to use instead of the one the
     *                     configuration describes; {@code null} for the default
     * @param displayNames resolves numeric actor ids during the integrity check
     */
    public EventVault(EventVaultConfig config, RemoteConnector connector, DisplayNameResolver displayNames) {
        this.config = config;
        this.injectedConnector = connector;
        this.displayNames = displayNames;
    }

    /**
     * Validate configuration, repair state and start background work.
     *
     * @throws ConfigurationException if the configuration is unusable or the
     *                                data directory is not writable
     */
    public synchronized EventVault start() {
        if (started) {
            return this;
        }
        ConfigValidation.requireValid(config);
        Path dataDir = requireWritableDir(Path.of(config.getStorage().getDataDir()), "storage.dataDir");
        Path backupDir = resolveBackupDir(dataDir);

        ResourceCatalog catalog;
        try {
            catalog = ResourceCatalog.standard().withDefaultOverrides(config.getStorage().getDefaults());
        } catch (IllegalArgumentException e) {
            log.error("Invalid resource default override: {}", e.getMessage());
            throw new ConfigurationException("Invalid storage.defaults: " + e.getMessage(), e);
        }
        store = new ResourceStore(dataDir, catalog, Duration.ofMillis(config.getStorage().getLockTimeoutMs()));

        RemoteConfig remote = config.getRemote();
        connector = injectedConnector != null ? injectedConnector : createConnector(remote);
        sync = new SyncEngine(connector, remote);
        store.addListener(sync);

        try {
            BootstrapSource bootstrap = remote.isBootstrapFromMirror()
                    ? new RemoteBootstrap(connector)
                    : BootstrapSource.NONE;
            startupReport = new IntegrityValidator(store, bootstrap, displayNames).run();

            sync.start();
            admission = new AdmissionController(AdmissionLimits.from(config.getAdmission()));
            gateway = new MutationGateway(admission, store);
            backups = new BackupManager(store, backupDir, config.getBackup());
            backups.start();
        } catch (RuntimeException e) {
            log.error("Startup failed: {}", ErrorUtils.formatErrorChain(e));
            stopBackground(Duration.ZERO);
            throw e;
        }

        started = true;
        log.info("EventVault ready: data={}, backups={}, mirror={}, {} startup fix(es)",
                dataDir, backupDir, connector.describe(), startupReport.size());
        return this;
    }

    public boolean isStarted() {
        return started;
    }

    public MutationGateway gateway() {
        requireStarted();
        return gateway;
    }

    public ResourceStore store() {
        requireStarted();
        return store;
    }

    public SyncEngine sync() {
        requireStarted();
        return sync;
    }

    public AdmissionController admission() {
        requireStarted();
        return admission;
    }

    public BackupManager backups() {
        requireStarted();
        return backups;
    }

    /** Fixes applied by the integrity check during {@link #start()}. */
    public FixReport startupReport() {
        requireStarted();
        return startupReport;
    }

    /**
     * Stop the backup schedule, give the sync queue a bounded chance to drain,
     * then stop the worker.
     */
    @Override
    public synchronized void close() {
        if (!started) {
            return;
        }
        started = false;
        log.info("Shutting down EventVault");
        stopBackground(SHUTDOWN_FLUSH_TIMEOUT);
    }

    private void stopBackground(Duration flushTimeout) {
        if (backups != null) {
            backups.close();
        }
        if (sync != null) {
            store.removeListener(sync);
            sync.shutdown(flushTimeout);
        }
    }

    private void requireStarted() {
        if (!started) {
            throw new IllegalStateException("EventVault is not started");
        }
    }

    private Path resolveBackupDir(Path dataDir) {
        String configured = config.getBackup().getBackupDir();
        Path dir = configured == null || configured.isBlank() ? dataDir.resolve("backups") : Path.of(configured);
        return requireWritableDir(dir, "backup.backupDir");
    }

    static RemoteConnector createConnector(RemoteConfig remote) {
        if (!remote.isConfigured()) {
            log.info("No mirror endpoint configured, running with an in-memory mirror");
            return new InMemoryConnector();
        }
        try {
            return new HttpTabularConnector(remote.getEndpoint(), remote.getToken(),
                    Duration.ofMillis(remote.getCallTimeoutMs()));
        } catch (IllegalArgumentException e) {
            log.error("Invalid mirror endpoint {}: {}", remote.getEndpoint(), e.getMessage());
            throw new ConfigurationException("Invalid remote.endpoint: " + remote.getEndpoint(), e);
        }
    }

    static Path requireWritableDir(Path dir, String setting) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("Cannot create {} {}: {}", setting, dir, e.getMessage());
            throw new ConfigurationException("Cannot create " + setting + " " + dir, e);
        }
        if (!Files.isDirectory(dir) || !Files.isWritable(dir)) {
            log.error("{} {} is not a writable directory", setting, dir);
            throw new ConfigurationException(setting + " " + dir + " is not a writable directory");
        }
        return dir;
    }
}
