package com.eventvault.backup;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One archive in the backup directory.
 *
 * @param path     archive location
 * @param size     archive size in bytes
 * @param created  archive modification time
 * @param metadata parsed {@code metadata.json}; {@code null} if unreadable
 */
public record BackupInfo(Path path, long size, Instant created, BackupMetadata metadata) {

    public String fileName() {
        return path.getFileName().toString();
    }

    /** Trigger from the metadata, or {@code "unknown"}. */
    public String trigger() {
        return metadata != null && metadata.getTrigger() != null ? metadata.getTrigger() : "unknown";
    }
}
