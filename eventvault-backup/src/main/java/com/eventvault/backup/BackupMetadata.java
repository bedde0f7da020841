package com.eventvault.backup;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Contents of {@code metadata.json} inside every snapshot archive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupMetadata {

    private Instant timestamp;
    private String trigger;
    @Builder.Default
    private List<FileEntry> files = new ArrayList<>();
    private long totalSize;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FileEntry {
        /** Resource key. */
        private String key;
        /** File name under the data directory. */
        private String fileName;
        /** Entry name inside the archive. */
        private String archiveName;
        private long size;
    }
}
