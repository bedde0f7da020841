package com.eventvault.store;

import com.eventvault.store.ResourceLocks.LockHandle;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Durable store of whole-document resources, one JSON file per key.
 * <p>
 * Every read and write of a key holds that key's lock; keys never block each
 * other. Writes go to a temp file in the data directory, the current file is
 * copied to a {@code .bak} sibling, and the temp file is atomically renamed
 * into place. A failed write leaves the previous document untouched.
 * Unparseable files are moved aside with a timestamp suffix instead of being
 * overwritten.
 */
@Slf4j
public class ResourceStore {

    public static final String BACKUP_SUFFIX = ".bak";
    public static final String QUARANTINE_SUFFIX = ".corrupt";
    private static final DateTimeFormatter QUARANTINE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS").withZone(ZoneOffset.UTC);

    private final Path dataDir;
    private final ResourceCatalog catalog;
    private final ResourceLocks locks;
    private final Clock clock;
    private final List<ResourceChangeListener> listeners = new CopyOnWriteArrayList<>();

    public ResourceStore(Path dataDir, ResourceCatalog catalog, Duration lockTimeout) {
        this(dataDir, catalog, lockTimeout, Clock.systemUTC());
    }

    public ResourceStore(Path dataDir, ResourceCatalog catalog, Duration lockTimeout, Clock clock) {
        this.dataDir = dataDir;
        this.catalog = catalog;
        this.locks = new ResourceLocks(lockTimeout);
        this.clock = clock;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public ResourceCatalog getCatalog() {
        return catalog;
    }

    public void addListener(ResourceChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ResourceChangeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Canonical on-disk location of a resource.
     *
     * @throws StoreException if the key is not declared
     */
    public Path pathFor(String key) {
        return dataDir.resolve(catalog.get(key).fileName());
    }

    // ── Reads ──────────────────────────────────────────────────────────

    /**
     * Load a resource, falling back to its documented default.
     */
    public JsonNode load(String key) {
        return load(key, catalog.get(key).defaultValue());
    }

    /**
     * Load a resource.
     *
     * @param defaultValue returned (as a copy) if the resource is absent or
     *                     unreadable; may be {@code null}
     */
    public JsonNode load(String key, JsonNode defaultValue) {
        ReadResult result = read(key);
        if (result.isOk()) {
            return result.value();
        }
        return defaultValue != null ? defaultValue.deepCopy() : null;
    }

    /**
     * Read a resource and report what was found. An unparseable file is
     * quarantined before this returns.
     */
    public ReadResult read(String key) {
        Path path = pathFor(key);
        try (LockHandle ignored = locks.acquire(key)) {
            return readUnlocked(key, path);
        }
    }

    /**
     * Raw bytes of a resource as stored, for archiving.
     */
    public Optional<byte[]> readRaw(String key) {
        Path path = pathFor(key);
        try (LockHandle ignored = locks.acquire(key)) {
            if (!Files.exists(path)) {
                return Optional.empty();
            }
            return Optional.of(Files.readAllBytes(path));
        } catch (IOException e) {
            log.error("Failed to read {} from {}: {}", key, path, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean exists(String key) {
        return Files.exists(pathFor(key));
    }

    public Optional<Instant> lastModified(String key) {
        Path path = pathFor(key);
        try {
            if (!Files.exists(path)) {
                return Optional.empty();
            }
            return Optional.of(Files.getLastModifiedTime(path).toInstant());
        } catch (IOException e) {
            log.warn("Cannot stat {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    // ── Writes ─────────────────────────────────────────────────────────

    /**
     * Atomically replace a resource and schedule it for mirroring.
     *
     * @return {@code true} if the new document is durably in place
     */
    public boolean save(String key, JsonNode value) {
        return save(key, value, true);
    }

    /**
     * Atomically replace a resource.
     *
     * @param notify {@code false} to suppress change listeners (no mirror
     *               sync for this write)
     */
    public boolean save(String key, JsonNode value, boolean notify) {
        Path path = pathFor(key);
        JsonNode snapshot = value.deepCopy();
        byte[] bytes;
        try {
            bytes = ResourceJson.toBytes(snapshot);
        } catch (IOException e) {
            log.error("Cannot serialize {}: {}", key, e.getMessage());
            return false;
        }
        try (LockHandle ignored = locks.acquire(key)) {
            boolean saved = writeAtomically(key, path, bytes);
            if (saved && notify) {
                fireSaved(key, snapshot);
            }
            return saved;
        }
    }

    /**
     * Load-modify-save under a single hold of the key's lock, so concurrent
     * updaters of the same key never lose each other's changes.
     *
     * @param defaultValue starting document when absent or quarantined
     * @param fn           produces the new document; returning {@code null}
     *                     aborts without writing
     * @return the saved document, or empty if aborted or the write failed
     */
    public Optional<JsonNode> update(String key, JsonNode defaultValue, UnaryOperator<JsonNode> fn) {
        Path path = pathFor(key);
        try (LockHandle ignored = locks.acquire(key)) {
            ReadResult current = readUnlocked(key, path);
            if (current.status() == ReadResult.Status.FAILED) {
                log.error("Not updating {}: existing file could not be read", key);
                return Optional.empty();
            }
            JsonNode base = current.isOk() ? current.value()
                    : defaultValue != null ? defaultValue.deepCopy() : catalog.get(key).newDefault();
            JsonNode next = fn.apply(base);
            if (next == null) {
                return Optional.empty();
            }
            JsonNode snapshot = next.deepCopy();
            boolean saved;
            try {
                saved = writeAtomically(key, path, ResourceJson.toBytes(snapshot));
            } catch (IOException e) {
                log.error("Cannot serialize {}: {}", key, e.getMessage());
                return Optional.empty();
            }
            if (!saved) {
                return Optional.empty();
            }
            fireSaved(key, snapshot);
            return Optional.of(snapshot.deepCopy());
        }
    }

    /**
     * Replace a resource with exact bytes (from an archive). The bytes must
     * parse as JSON; they go through the same atomic path as {@link #save}.
     */
    public boolean restoreRaw(String key, byte[] bytes) {
        Path path = pathFor(key);
        JsonNode parsed;
        try {
            parsed = ResourceJson.parse(bytes);
        } catch (IOException e) {
            log.error("Refusing to restore {}: content is not valid JSON ({})", key, e.getMessage());
            return false;
        }
        try (LockHandle ignored = locks.acquire(key)) {
            boolean saved = writeAtomically(key, path, bytes);
            if (saved) {
                fireSaved(key, parsed);
            }
            return saved;
        }
    }

    // ── Internals ──────────────────────────────────────────────────────

    private ReadResult readUnlocked(String key, Path path) {
        if (!Files.exists(path)) {
            log.debug("{} not found, using default", path);
            return ReadResult.absent();
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", path, e.getMessage());
            return ReadResult.failed();
        }
        try {
            return ReadResult.ok(ResourceJson.parse(bytes));
        } catch (IOException e) {
            log.warn("Corrupt document for {} at {}: {}", key, path, e.getMessage());
            return ReadResult.corrupt(quarantine(path));
        }
    }

    private Path quarantine(Path path) {
        Path target = path.resolveSibling(path.getFileName() + "."
                + QUARANTINE_STAMP.format(clock.instant()) + QUARANTINE_SUFFIX);
        try {
            Files.move(path, target, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Quarantined unreadable file {} -> {}", path, target.getFileName());
            return target;
        } catch (IOException e) {
            log.error("Failed to quarantine {}: {}", path, e.getMessage());
            return null;
        }
    }

    private boolean writeAtomically(String key, Path path, byte[] bytes) {
        Path temp = null;
        try {
            Files.createDirectories(dataDir);
            temp = Files.createTempFile(dataDir, path.getFileName() + ".", ".tmp");
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            if (Files.exists(path)) {
                Files.copy(path, path.resolveSibling(path.getFileName() + BACKUP_SUFFIX),
                        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            }
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported for {}, falling back to replace", path);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved {} ({} bytes)", key, bytes.length);
            return true;
        } catch (IOException e) {
            log.error("Failed to save {} to {}: {}", key, path, e.getMessage());
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    log.warn("Could not remove temp file {}: {}", temp, cleanup.getMessage());
                }
            }
            return false;
        }
    }

    /**
     * Runs under the key's lock so listeners see saves of one key in write
     * order. Listeners must not block.
     */
    private void fireSaved(String key, JsonNode snapshot) {
        for (ResourceChangeListener listener : listeners) {
            try {
                listener.onResourceSaved(key, snapshot.deepCopy());
            } catch (RuntimeException e) {
                log.warn("Change listener failed for {}: {}", key, e.getMessage());
            }
        }
    }
}
