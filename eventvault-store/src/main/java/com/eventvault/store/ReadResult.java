package com.eventvault.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;

/**
 * Outcome of reading one resource document from disk.
 *
 * @param status        what was found
 * @param value         the parsed document, only for {@link Status#OK}
 * @param quarantinedTo where an unparseable file was moved, if it was
 */
public record ReadResult(Status status, JsonNode value, Path quarantinedTo) {

    public enum Status {
        /** No file on disk. */
        ABSENT,
        /** Parsed successfully. */
        OK,
        /** File existed but did not parse; it has been quarantined. */
        CORRUPT,
        /** File could not be read at all (permissions, I/O). Left in place. */
        FAILED
    }

    public static ReadResult absent() {
        return new ReadResult(Status.ABSENT, null, null);
    }

    public static ReadResult ok(JsonNode value) {
        return new ReadResult(Status.OK, value, null);
    }

    public static ReadResult corrupt(Path quarantinedTo) {
        return new ReadResult(Status.CORRUPT, null, quarantinedTo);
    }

    public static ReadResult failed() {
        return new ReadResult(Status.FAILED, null, null);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
