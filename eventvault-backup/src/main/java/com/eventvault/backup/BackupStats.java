package com.eventvault.backup;

import java.time.Instant;
import java.util.Map;

/**
 * Summary of the backup directory.
 *
 * @param count      number of archives
 * @param totalBytes combined archive size
 * @param oldest     creation time of the oldest archive, {@code null} if none
 * @param newest     creation time of the newest archive, {@code null} if none
 * @param byTrigger  archive count per trigger
 */
public record BackupStats(int count, long totalBytes, Instant oldest, Instant newest, Map<String, Integer> byTrigger) {

    public BackupStats {
        byTrigger = Map.copyOf(byTrigger);
    }

    public double totalMegabytes() {
        return Math.round(totalBytes / 1024.0 / 1024.0 * 100) / 100.0;
    }
}
