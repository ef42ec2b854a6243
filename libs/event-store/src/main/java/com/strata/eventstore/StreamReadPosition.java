package com.strata.eventstore;

/** 0-based position within a stream from which a read starts. */
public record StreamReadPosition(long value) {

    public static final StreamReadPosition START = new StreamReadPosition(0);

    public StreamReadPosition {
        if (value < 0) {
            throw new IllegalArgumentException("Stream read position must be >= 0, got " + value);
        }
    }

    public static StreamReadPosition of(long value) {
        return value == 0 ? START : new StreamReadPosition(value);
    }
}
