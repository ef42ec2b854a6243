package com.strata.eventstore;

import com.strata.eventmodel.RecordedEvent;
import java.util.List;

/**
 * Reads the single total order across all streams. Used by live subscriptions.
 */
public interface GlobalLogReader {

    /**
     * @param fromGlobalPosition first global position to return, 0-based
     * @param maxCount maximum number of events, must be positive
     * @return events in global order, empty when the reader is at the head of the log
     */
    List<RecordedEvent> readAll(long fromGlobalPosition, int maxCount);

    /** Position of the last event in the log, -1 when the log is empty. */
    long lastGlobalPosition();
}
