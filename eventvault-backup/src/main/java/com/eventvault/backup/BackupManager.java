package com.eventvault.backup;

import com.eventvault.common.config.EventVaultConfig.BackupConfig;
import com.eventvault.common.infra.ErrorUtils;
import com.eventvault.store.ResourceDefinition;
import com.eventvault.store.ResourceStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Point-in-time zip snapshots of every declared resource, with rotation and
 * a confirmed restore.
 * <p>
 * Archives are named {@code backup_<trigger>_<timestamp>.zip} and hold one
 * {@code <key>.json} entry per present resource plus {@code metadata.json}.
 * Snapshots only read resources. Restores write through
 * {@link ResourceStore#restoreRaw}, so each resource is replaced atomically.
 */
@Slf4j
public class BackupManager implements AutoCloseable {

    public static final String ARCHIVE_PREFIX = "backup_";
    public static final String ARCHIVE_SUFFIX = ".zip";
    public static final String METADATA_ENTRY = "metadata.json";
    public static final String TRIGGER_MANUAL = "manual";
    public static final String TRIGGER_AUTOMATIC = "automatic";
    public static final String TRIGGER_PRE_RESTORE = "pre-restore";

    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);
    private static final long MB = 1024L * 1024L;

    private final ResourceStore store;
    private final Path backupDir;
    private final BackupConfig config;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Object snapshotLock = new Object();
    private ScheduledExecutorService scheduler;

    public BackupManager(ResourceStore store, Path backupDir, BackupConfig config) {
        this(store, backupDir, config, Clock.systemUTC());
    }

    public BackupManager(ResourceStore store, Path backupDir, BackupConfig config, Clock clock) {
        this.store = store;
        this.backupDir = backupDir;
        this.config = config;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getBackupDir() {
        return backupDir;
    }

    // ── Snapshots ──────────────────────────────────────────────────────

    /**
     * Archive every present resource.
     *
     * @param trigger why the snapshot is taken, e.g. {@code "manual"}
     * @return the archive, or empty if it could not be written
     */
    public Optional<Path> createSnapshot(String trigger) {
        String label = sanitizeTrigger(trigger);
        synchronized (snapshotLock) {
            Instant now = clock.instant();
            Path temp = null;
            try {
                Files.createDirectories(backupDir);
                Path target = uniqueArchivePath(label, now);
                temp = Files.createTempFile(backupDir, ".snapshot-", ".tmp");
                BackupMetadata metadata = writeArchive(temp, label, now);
                try {
                    Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, target);
                }
                Files.setLastModifiedTime(target, FileTime.from(now));
                log.info("Backup created: {} ({} resources, {} bytes)", target.getFileName(),
                        metadata.getFiles().size(), metadata.getTotalSize());
                rotate(target);
                return Optional.of(target);
            } catch (IOException e) {
                log.error("Failed to create {} backup: {}", label, ErrorUtils.formatErrorMessage(e));
                deleteQuietly(temp);
                return Optional.empty();
            }
        }
    }

    /**
     * Take a snapshot only if some resource changed after the newest
     * existing archive.
     *
     * @return the archive, or empty if nothing changed or the write failed
     */
    public Optional<Path> snapshotIfChanged(String trigger) {
        Optional<Instant> lastChange = latestResourceChange();
        if (lastChange.isEmpty()) {
            log.debug("No resources on disk, skipping {} backup", trigger);
            return Optional.empty();
        }
        Optional<Instant> lastBackup = listBackups().stream().findFirst().map(BackupInfo::created);
        if (lastBackup.isPresent() && !lastChange.get().isAfter(lastBackup.get())) {
            log.debug("No changes since {}, skipping {} backup", lastBackup.get(), trigger);
            return Optional.empty();
        }
        return createSnapshot(trigger);
    }

    private BackupMetadata writeArchive(Path file, String trigger, Instant now) throws IOException {
        BackupMetadata metadata = BackupMetadata.builder()
                .timestamp(now)
                .trigger(trigger)
                .build();
        long total = 0;
        try (ZipOutputStream zip = new ZipOutputStream(new BufferedOutputStream(Files.newOutputStream(file)))) {
            for (ResourceDefinition def : store.getCatalog().all()) {
                Optional<byte[]> bytes = store.readRaw(def.key());
                if (bytes.isEmpty()) {
                    continue;
                }
                String entryName = entryNameFor(def.key());
                zip.putNextEntry(new ZipEntry(entryName));
                zip.write(bytes.get());
                zip.closeEntry();
                total += bytes.get().length;
                metadata.getFiles().add(BackupMetadata.FileEntry.builder()
                        .key(def.key())
                        .fileName(def.fileName())
                        .archiveName(entryName)
                        .size(bytes.get().length)
                        .build());
            }
            metadata.setTotalSize(total);
            zip.putNextEntry(new ZipEntry(METADATA_ENTRY));
            zip.write(objectMapper.writeValueAsBytes(metadata));
            zip.closeEntry();
        }
        return metadata;
    }

    private Path uniqueArchivePath(String trigger, Instant now) {
        String base = ARCHIVE_PREFIX + trigger + "_" + STAMP.format(now);
        Path candidate = backupDir.resolve(base + ARCHIVE_SUFFIX);
        for (int n = 1; Files.exists(candidate); n++) {
            candidate = backupDir.resolve(base + "_" + n + ARCHIVE_SUFFIX);
        }
        return candidate;
    }

    private Optional<Instant> latestResourceChange() {
        return store.getCatalog().keys().stream()
                .map(store::lastModified)
                .flatMap(Optional::stream)
                .max(Comparator.naturalOrder());
    }

    static String entryNameFor(String key) {
        return key + ".json";
    }

    static String sanitizeTrigger(String trigger) {
        if (trigger == null || trigger.isBlank()) {
            return TRIGGER_MANUAL;
        }
        String cleaned = trigger.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]+", "-");
        return cleaned.isEmpty() ? TRIGGER_MANUAL : cleaned;
    }

    // ── Rotation ───────────────────────────────────────────────────────

    /**
     * Delete archives beyond the configured count, age and total size,
     * oldest first. {@code keep} is never deleted.
     *
     * @return number of archives deleted
     */
    int rotate(Path keep) {
        List<BackupInfo> backups = listBackups();
        Instant cutoff = config.getMaxAgeDays() > 0
                ? clock.instant().minus(Duration.ofDays(config.getMaxAgeDays()))
                : null;
        long maxBytes = config.getMaxTotalMb() > 0 ? config.getMaxTotalMb() * MB : Long.MAX_VALUE;

        int deleted = 0;
        int kept = 0;
        long keptBytes = 0;
        for (BackupInfo backup : backups) {
            boolean isKeep = keep != null && backup.path().equals(keep);
            boolean overCount = kept >= config.getMaxBackups();
            boolean tooOld = cutoff != null && backup.created().isBefore(cutoff);
            boolean overSize = keptBytes + backup.size() > maxBytes;
            if (!isKeep && (overCount || tooOld || overSize)) {
                try {
                    Files.deleteIfExists(backup.path());
                    deleted++;
                    log.info("Removed old backup {} ({})", backup.fileName(),
                            overCount ? "count" : tooOld ? "age" : "size");
                } catch (IOException e) {
                    log.warn("Failed to remove old backup {}: {}", backup.fileName(), e.getMessage());
                }
                continue;
            }
            kept++;
            keptBytes += backup.size();
        }
        return deleted;
    }

    // ── Listing ────────────────────────────────────────────────────────

    /**
     * Archives in the backup directory, newest first.
     */
    public List<BackupInfo> listBackups() {
        if (!Files.isDirectory(backupDir)) {
            return List.of();
        }
        List<BackupInfo> backups = new ArrayList<>();
        try (Stream<Path> files = Files.list(backupDir)) {
            for (Path path : (Iterable<Path>) files::iterator) {
                String name = path.getFileName().toString();
                if (!name.startsWith(ARCHIVE_PREFIX) || !name.endsWith(ARCHIVE_SUFFIX) || !Files.isRegularFile(path)) {
                    continue;
                }
                try {
                    backups.add(new BackupInfo(path, Files.size(path),
                            Files.getLastModifiedTime(path).toInstant(), readMetadata(path).orElse(null)));
                } catch (IOException e) {
                    log.warn("Cannot stat backup {}: {}", name, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Failed to list backups in {}: {}", backupDir, e.getMessage());
            return List.of();
        }
        backups.sort(Comparator.comparing(BackupInfo::created)
                .thenComparing(BackupInfo::fileName)
                .reversed());
        return backups;
    }

    public BackupStats stats() {
        List<BackupInfo> backups = listBackups();
        Map<String, Integer> byTrigger = new TreeMap<>();
        long total = 0;
        for (BackupInfo backup : backups) {
            total += backup.size();
            byTrigger.merge(backup.trigger(), 1, Integer::sum);
        }
        Instant newest = backups.isEmpty() ? null : backups.get(0).created();
        Instant oldest = backups.isEmpty() ? null : backups.get(backups.size() - 1).created();
        return new BackupStats(backups.size(), total, oldest, newest, byTrigger);
    }

    /**
     * Read {@code metadata.json} from an archive.
     */
    public Optional<BackupMetadata> readMetadata(Path archive) {
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            ZipEntry entry = zip.getEntry(METADATA_ENTRY);
            if (entry == null) {
                return Optional.empty();
            }
            try (InputStream in = zip.getInputStream(entry)) {
                return Optional.of(objectMapper.readValue(in, BackupMetadata.class));
            }
        } catch (IOException e) {
            log.debug("No readable metadata in {}: {}", archive.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    // ── Restore ────────────────────────────────────────────────────────

    /**
     * Replace resources with the contents of an archive.
     * <p>
     * Requires {@code confirm}. The archive is read fully first; then a
     * {@value #TRIGGER_PRE_RESTORE} snapshot of the current state is taken;
     * then each resource found in the archive is restored on its own, so one
     * failure does not stop the others.
     *
     * @param archive archive path, or a bare file name inside the backup
     *                directory
     */
    public RestoreReport restore(Path archive, boolean confirm) {
        Path source = archive.isAbsolute() || Files.exists(archive) ? archive : backupDir.resolve(archive);
        if (!confirm) {
            log.warn("Restore from {} not confirmed, nothing changed", source.getFileName());
            return RestoreReport.aborted(RestoreReport.Status.NOT_CONFIRMED, source);
        }

        Map<String, byte[]> entries;
        try {
            entries = readEntries(source);
        } catch (IOException e) {
            log.error("Cannot read backup {}: {}", source, ErrorUtils.formatErrorMessage(e));
            return RestoreReport.aborted(RestoreReport.Status.UNREADABLE, source);
        }

        Optional<Path> preRestore = createSnapshot(TRIGGER_PRE_RESTORE);
        if (preRestore.isEmpty()) {
            log.error("Could not snapshot current state, refusing to restore from {}", source.getFileName());
            return RestoreReport.aborted(RestoreReport.Status.SNAPSHOT_FAILED, source);
        }
        log.info("Created pre-restore backup {}", preRestore.get().getFileName());

        List<String> restored = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (ResourceDefinition def : store.getCatalog().all()) {
            byte[] bytes = entries.remove(entryNameFor(def.key()));
            if (bytes == null) {
                continue;
            }
            try {
                if (store.restoreRaw(def.key(), bytes)) {
                    restored.add(def.key());
                    log.info("Restored {}", def.key());
                } else {
                    failed.put(def.key(), "write failed or content invalid");
                }
            } catch (RuntimeException e) {
                log.error("Failed to restore {}: {}", def.key(), e.getMessage());
                failed.put(def.key(), ErrorUtils.formatErrorMessage(e));
            }
        }
        entries.remove(METADATA_ENTRY);
        List<String> ignored = new ArrayList<>(entries.keySet());
        if (!ignored.isEmpty()) {
            log.info("Ignored {} unknown archive entries: {}", ignored.size(), ignored);
        }

        RestoreReport.Status status = failed.isEmpty() ? RestoreReport.Status.COMPLETED : RestoreReport.Status.PARTIAL;
        log.info("Restore from {} finished: {} restored, {} failed", source.getFileName(), restored.size(),
                failed.size());
        return new RestoreReport(status, source, preRestore.get(), restored, failed, ignored);
    }

    private static Map<String, byte[]> readEntries(Path archive) throws IOException {
        if (!Files.isRegularFile(archive)) {
            throw new IOException("backup not found: " + archive);
        }
        Map<String, byte[]> entries = new LinkedHashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new BufferedInputStream(Files.newInputStream(archive)))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory()) {
                    entries.put(entry.getName().replace('\\', '/'), zip.readAllBytes());
                }
                zip.closeEntry();
            }
        }
        if (entries.isEmpty()) {
            throw new IOException("not a backup archive (no entries): " + archive.getFileName());
        }
        return entries;
    }

    // ── Schedule ───────────────────────────────────────────────────────

    /**
     * Start the automatic snapshot check at the configured interval. An
     * interval of zero disables it.
     */
    public void start() {
        if (config.getIntervalHours() <= 0) {
            log.info("Automatic backups disabled");
            return;
        }
        start(Duration.ofHours(config.getIntervalHours()));
    }

    synchronized void start(Duration interval) {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "backup-scheduler");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::automaticSnapshot, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("Automatic backups every {} to {}", interval, backupDir);
    }

    private void automaticSnapshot() {
        try {
            snapshotIfChanged(TRIGGER_AUTOMATIC);
        } catch (RuntimeException e) {
            log.error("Automatic backup failed: {}", ErrorUtils.formatErrorChain(e), e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove partial archive {}: {}", path, e.getMessage());
        }
    }
}
