package com.strata.eventstore;

/**
 * Outcome of a successful append.
 *
 * @param globalPosition global log position of the last appended event, -1 when nothing was appended
 * @param nextExpectedVersion stream version after the append, the expected version for the next one
 */
public record AppendResult(long globalPosition, long nextExpectedVersion) {

    public static final long NO_POSITION = -1;

    /** Result of a store call that had nothing to append. */
    public static AppendResult unchanged(long version) {
        return new AppendResult(NO_POSITION, version);
    }
}
