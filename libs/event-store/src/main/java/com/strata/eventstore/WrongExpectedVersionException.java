package com.strata.eventstore;

/**
 * The stream's version did not match the expected version of an append. Nothing was appended; the
 * caller should reload and retry.
 */
public class WrongExpectedVersionException extends RuntimeException {

    private final String streamId;
    private final ExpectedStreamVersion expectedVersion;
    private final long actualVersion;

    public WrongExpectedVersionException(String streamId, ExpectedStreamVersion expectedVersion, long actualVersion) {
        this(streamId, expectedVersion, actualVersion, null);
    }

    public WrongExpectedVersionException(
            String streamId, ExpectedStreamVersion expectedVersion, long actualVersion, Throwable cause) {
        super("Append to stream '" + streamId + "' failed: expected version " + expectedVersion
                + " but was " + (actualVersion == ExpectedStreamVersion.NO_STREAM_VALUE ? "NoStream" : actualVersion),
                cause);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String streamId() {
        return streamId;
    }

    public ExpectedStreamVersion expectedVersion() {
        return expectedVersion;
    }

    /** Current version of the stream, {@link ExpectedStreamVersion#NO_STREAM_VALUE} when it does not exist. */
    public long actualVersion() {
        return actualVersion;
    }
}
