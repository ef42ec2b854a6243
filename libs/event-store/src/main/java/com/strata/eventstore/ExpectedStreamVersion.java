package com.strata.eventstore;

/**
 * Optimistic-concurrency guard for an append.
 *
 * <p>Versions are 0-based: the version of a stream is the position of its last event. An append
 * succeeds only when the stream's current version equals {@code value}, unless the value is
 * {@link #ANY}.
 */
public record ExpectedStreamVersion(long value) {

    public static final long NO_STREAM_VALUE = -1;
    public static final long ANY_VALUE = -2;

    /** The stream must not exist yet. */
    public static final ExpectedStreamVersion NO_STREAM = new ExpectedStreamVersion(NO_STREAM_VALUE);

    /** No version check. */
    public static final ExpectedStreamVersion ANY = new ExpectedStreamVersion(ANY_VALUE);

    public ExpectedStreamVersion {
        if (value < ANY_VALUE) {
            throw new IllegalArgumentException("Invalid expected version: " + value);
        }
    }

    public static ExpectedStreamVersion of(long value) {
        if (value == NO_STREAM_VALUE) {
            return NO_STREAM;
        }
        if (value == ANY_VALUE) {
            return ANY;
        }
        return new ExpectedStreamVersion(value);
    }

    public boolean isAny() {
        return value == ANY_VALUE;
    }

    public boolean isNoStream() {
        return value == NO_STREAM_VALUE;
    }

    /**
     * @param actualVersion the stream's current version, {@link #NO_STREAM_VALUE} when absent
     */
    public boolean matches(long actualVersion) {
        return isAny() || value == actualVersion;
    }

    @Override
    public String toString() {
        if (isAny()) {
            return "Any";
        }
        if (isNoStream()) {
            return "NoStream";
        }
        return Long.toString(value);
    }
}
