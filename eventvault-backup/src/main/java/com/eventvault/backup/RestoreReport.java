package com.eventvault.backup;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * What a restore did, per resource.
 *
 * @param status      overall outcome
 * @param archive     the archive restored from
 * @param preRestore  safety snapshot taken first, {@code null} if none was taken
 * @param restored    resource keys written from the archive
 * @param failed      resource key to failure description
 * @param ignored     archive entries that match no declared resource
 */
public record RestoreReport(Status status, Path archive, Path preRestore, List<String> restored,
        Map<String, String> failed, List<String> ignored) {

    public enum Status {
        /** Restore was not confirmed; nothing was touched. */
        NOT_CONFIRMED,
        /** Archive missing or not a readable zip; nothing was touched. */
        UNREADABLE,
        /** The safety snapshot could not be taken; nothing was touched. */
        SNAPSHOT_FAILED,
        /** Every resource in the archive was restored. */
        COMPLETED,
        /** Some resources failed; the others were restored. */
        PARTIAL
    }

    public RestoreReport {
        restored = List.copyOf(restored);
        failed = Map.copyOf(failed);
        ignored = List.copyOf(ignored);
    }

    static RestoreReport aborted(Status status, Path archive) {
        return new RestoreReport(status, archive, null, List.of(), Map.of(), List.of());
    }

    public boolean success() {
        return status == Status.COMPLETED;
    }
}
