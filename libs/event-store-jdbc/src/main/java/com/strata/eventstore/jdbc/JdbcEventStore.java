package com.strata.eventstore.jdbc;

import com.strata.eventmodel.EventData;
import com.strata.eventmodel.EventSerializer;
import com.strata.eventmodel.EventValidator;
import com.strata.eventmodel.RecordedEvent;
import com.strata.eventmodel.StreamEventEnvelope;
import com.strata.eventstore.AppendResult;
import com.strata.eventstore.DuplicateEventException;
import com.strata.eventstore.EventStore;
import com.strata.eventstore.EventStoreException;
import com.strata.eventstore.ExpectedStreamVersion;
import com.strata.eventstore.GlobalLogReader;
import com.strata.eventstore.StreamName;
import com.strata.eventstore.StreamPages;
import com.strata.eventstore.StreamReadPosition;
import com.strata.eventstore.WrongExpectedVersionException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable {@link EventStore} over JDBC.
 *
 * <p>Every append runs in one transaction that locks the stream row, checks the expected version,
 * takes the next global positions from the single-row {@code global_log_head} counter and inserts the
 * events. Because the counter row stays locked until commit, global positions are handed out
 * without gaps and become visible in order, which is what a catch-up subscription relies on. Events
 * removed because of a stream's max count ({@code stream_metadata}) leave holes that reads step
 * over.
 *
 * <p>The schema is created by {@link EventStoreSchemaMigrator}.
 */
public final class JdbcEventStore implements EventStore, GlobalLogReader {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    public static final int DEFAULT_PAGE_SIZE = 500;

    private static final String UNIQUE_VIOLATION = "23505";

    private static final String EVENT_COLUMNS =
            "stream_id, event_id, event_type, content_type, data, metadata, stream_position, global_position, created_at";

    private static final String SELECT_STREAM_EXISTS = "SELECT 1 FROM streams WHERE stream_id = ?";
    private static final String SELECT_STREAM_VERSION = "SELECT version FROM streams WHERE stream_id = ?";
    private static final String LOCK_STREAM = "SELECT version FROM streams WHERE stream_id = ? FOR UPDATE";
    private static final String INSERT_STREAM = "INSERT INTO streams (stream_id, version, created_at) VALUES (?, ?, ?)";
    private static final String UPDATE_STREAM = "UPDATE streams SET version = ? WHERE stream_id = ? AND version = ?";
    private static final String LOCK_LOG_HEAD = "SELECT last_position FROM global_log_head WHERE id = 1 FOR UPDATE";
    private static final String SELECT_LOG_HEAD = "SELECT last_position FROM global_log_head WHERE id = 1";
    private static final String UPDATE_LOG_HEAD = "UPDATE global_log_head SET last_position = ? WHERE id = 1";
    private static final String SELECT_EVENT_ID = "SELECT 1 FROM events WHERE event_id = ?";
    private static final String INSERT_EVENT = "INSERT INTO events (" + EVENT_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
    private static final String SELECT_STREAM_PAGE = "SELECT " + EVENT_COLUMNS
            + " FROM events WHERE stream_id = ? AND stream_position >= ? ORDER BY stream_position LIMIT ?";
    private static final String SELECT_LAST_EVENT = "SELECT " + EVENT_COLUMNS
            + " FROM events WHERE stream_id = ? ORDER BY stream_position DESC LIMIT 1";
    private static final String SELECT_MAX_COUNT = "SELECT max_count FROM stream_metadata WHERE stream_id = ?";
    private static final String UPDATE_MAX_COUNT = "UPDATE stream_metadata SET max_count = ? WHERE stream_id = ?";
    private static final String INSERT_MAX_COUNT = "INSERT INTO stream_metadata (stream_id, max_count) VALUES (?, ?)";
    private static final String DELETE_BEFORE = "DELETE FROM events WHERE stream_id = ? AND stream_position <= ?";
    private static final String SELECT_ALL_PAGE = "SELECT " + EVENT_COLUMNS
            + " FROM events WHERE global_position >= ? ORDER BY global_position LIMIT ?";

    private final DataSource dataSource;
    private final EventSerializer serializer;
    private final Clock clock;
    private final int pageSize;

    public JdbcEventStore(DataSource dataSource, EventSerializer serializer) {
        this(dataSource, serializer, Clock.systemUTC(), DEFAULT_PAGE_SIZE);
    }

    public JdbcEventStore(DataSource dataSource, EventSerializer serializer, Clock clock, int pageSize) {
        if (dataSource == null || serializer == null || clock == null) {
            throw new IllegalArgumentException("dataSource, serializer and clock must not be null");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.dataSource = dataSource;
        this.serializer = serializer;
        this.clock = clock;
        this.pageSize = pageSize;
    }

    @Override
    public boolean streamExists(String streamId) {
        StreamName.requireValid(streamId);
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(SELECT_STREAM_EXISTS)) {
            stmt.setString(1, streamId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new EventStoreException("Failed to check stream " + streamId, e);
        }
    }

    @Override
    public Iterable<StreamEventEnvelope<?>> readStream(String streamId, StreamReadPosition from, int maxCount) {
        StreamName.requireValid(streamId);
        return new StreamPages<RecordedEvent, StreamEventEnvelope<?>>(
                from.value(),
                maxCount,
                pageSize,
                (position, count) -> query(SELECT_STREAM_PAGE, "read stream " + streamId, stmt -> {
                    stmt.setString(1, streamId);
                    stmt.setLong(2, position);
                    stmt.setInt(3, count);
                }),
                RecordedEvent::streamPosition,
                serializer::decode);
    }

    @Override
    public Optional<StreamEventEnvelope<?>> readLastEvent(String streamId) {
        StreamName.requireValid(streamId);
        List<RecordedEvent> last = query(SELECT_LAST_EVENT, "read last event of " + streamId,
                stmt -> stmt.setString(1, streamId));
        return last.isEmpty() ? Optional.empty() : Optional.of(serializer.decode(last.get(0)));
    }

    @Override
    public void setStreamMaxCount(String streamId, int maxCount) {
        StreamName.requireValid(streamId);
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be positive, got " + maxCount);
        }
        for (int attempt = 1; ; attempt++) {
            try (Connection conn = dataSource.getConnection()) {
                inTransaction(conn, () -> {
                    upsertMaxCount(conn, streamId, maxCount);
                    OptionalLong version = lockStream(conn, streamId);
                    if (version.isPresent()) {
                        truncate(conn, streamId, version.getAsLong());
                    }
                    return null;
                });
                log.debug("Max count of {} set to {}", streamId, maxCount);
                return;
            } catch (SQLException e) {
                if (isUniqueViolation(e) && attempt == 1) {
                    log.debug("Metadata row of {} was created concurrently, retrying", streamId);
                    continue;
                }
                throw new EventStoreException("Failed to set max count of stream " + streamId, e);
            }
        }
    }

    @Override
    public List<RecordedEvent> readAll(long fromGlobalPosition, int maxCount) {
        if (fromGlobalPosition < 0) {
            throw new IllegalArgumentException("fromGlobalPosition must be >= 0");
        }
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be positive");
        }
        return query(SELECT_ALL_PAGE, "read global log", stmt -> {
            stmt.setLong(1, fromGlobalPosition);
            stmt.setInt(2, maxCount);
        });
    }

    @Override
    public long lastGlobalPosition() {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(SELECT_LOG_HEAD);
                ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                throw new EventStoreException("global_log_head row is missing; was the schema migrated?", null);
            }
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new EventStoreException("Failed to read the global log head", e);
        }
    }

    @Override
    public AppendResult appendEvents(
            String streamId, List<? extends StreamEventEnvelope<?>> events, ExpectedStreamVersion expected) {
        StreamName.requireValid(streamId);
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events must not be null or empty");
        }
        if (expected == null) {
            throw new IllegalArgumentException("expected version must not be null");
        }
        events.forEach(event -> EventValidator.validate(event).throwIfInvalid());
        requireUniqueWithinBatch(streamId, events);

        for (int attempt = 1; ; attempt++) {
            try (Connection conn = dataSource.getConnection()) {
                AppendResult result = inTransaction(conn, () -> append(conn, streamId, events, expected));
                log.debug("Appended {} event(s) to {} at version {}",
                        events.size(), streamId, result.nextExpectedVersion());
                return result;
            } catch (SQLException e) {
                if (!isUniqueViolation(e)) {
                    throw new EventStoreException("Failed to append to stream " + streamId, e);
                }
                if (expected.isAny() && attempt == 1) {
                    // the stream row now exists, so the second attempt locks it instead of inserting
                    log.debug("Stream {} was created concurrently, retrying the append", streamId);
                    continue;
                }
                // a concurrent writer created the stream or took the position first
                throw new WrongExpectedVersionException(streamId, expected, currentVersion(streamId), e);
            }
        }
    }

    private static <T> T inTransaction(Connection conn, TransactionWork<T> work) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            T result = work.run();
            conn.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    private AppendResult append(
            Connection conn, String streamId, List<? extends StreamEventEnvelope<?>> events, ExpectedStreamVersion expected)
            throws SQLException {
        OptionalLong current = lockStream(conn, streamId);
        long actual = current.orElse(ExpectedStreamVersion.NO_STREAM_VALUE);
        if (!expected.matches(actual)) {
            log.debug("Version conflict on {}: expected {}, actual {}", streamId, expected, actual);
            throw new WrongExpectedVersionException(streamId, expected, actual);
        }

        long head = lockLogHead(conn);
        requireUnknownEventIds(conn, streamId, events);

        long newVersion = actual + events.size();
        OffsetDateTime now = OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
        if (current.isEmpty()) {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_STREAM)) {
                stmt.setString(1, streamId);
                stmt.setLong(2, newVersion);
                stmt.setObject(3, now);
                stmt.executeUpdate();
            }
        } else {
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_STREAM)) {
                stmt.setLong(1, newVersion);
                stmt.setString(2, streamId);
                stmt.setLong(3, actual);
                if (stmt.executeUpdate() != 1) {
                    throw new WrongExpectedVersionException(streamId, expected, currentVersion(streamId));
                }
            }
        }

        long globalPosition = head;
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_EVENT)) {
            long streamPosition = actual;
            for (StreamEventEnvelope<?> event : events) {
                streamPosition++;
                globalPosition++;
                EventData data = serializer.encode(
                        event.withMetadata(event.metadata().withStreamPosition(streamPosition).withoutLogPosition()));
                stmt.setString(1, streamId);
                stmt.setString(2, data.eventId());
                stmt.setString(3, data.eventType());
                stmt.setString(4, data.contentType());
                stmt.setBytes(5, data.data());
                stmt.setBytes(6, data.metadata());
                stmt.setLong(7, streamPosition);
                stmt.setLong(8, globalPosition);
                stmt.setObject(9, now);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }

        try (PreparedStatement stmt = conn.prepareStatement(UPDATE_LOG_HEAD)) {
            stmt.setLong(1, globalPosition);
            stmt.executeUpdate();
        }
        truncate(conn, streamId, newVersion);
        return new AppendResult(globalPosition, newVersion);
    }

    private static void upsertMaxCount(Connection conn, String streamId, int maxCount) throws SQLException {
        try (PreparedStatement update = conn.prepareStatement(UPDATE_MAX_COUNT)) {
            update.setInt(1, maxCount);
            update.setString(2, streamId);
            if (update.executeUpdate() == 1) {
                return;
            }
        }
        try (PreparedStatement insert = conn.prepareStatement(INSERT_MAX_COUNT)) {
            insert.setString(1, streamId);
            insert.setInt(2, maxCount);
            insert.executeUpdate();
        }
    }

    /** Deletes the events of a stream at {@code version} that fall outside its max count. */
    private static void truncate(Connection conn, String streamId, long version) throws SQLException {
        int maxCount;
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_MAX_COUNT)) {
            stmt.setString(1, streamId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return;
                }
                maxCount = rs.getInt(1);
            }
        }
        try (PreparedStatement stmt = conn.prepareStatement(DELETE_BEFORE)) {
            stmt.setString(1, streamId);
            stmt.setLong(2, version - maxCount);
            int removed = stmt.executeUpdate();
            if (removed > 0) {
                log.debug("Removed {} event(s) from {} beyond max count {}", removed, streamId, maxCount);
            }
        }
    }

    private static OptionalLong lockStream(Connection conn, String streamId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(LOCK_STREAM)) {
            stmt.setString(1, streamId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
            }
        }
    }

    private static long lockLogHead(Connection conn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(LOCK_LOG_HEAD);
                ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                throw new EventStoreException("global_log_head row is missing; was the schema migrated?", null);
            }
            return rs.getLong(1);
        }
    }

    private static void requireUnknownEventIds(
            Connection conn, String streamId, List<? extends StreamEventEnvelope<?>> events) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_EVENT_ID)) {
            for (StreamEventEnvelope<?> event : events) {
                stmt.setString(1, event.eventId());
                try (ResultSet rs = stmt.executeQuery()) {
                    if (rs.next()) {
                        throw new DuplicateEventException(streamId, event.eventId());
                    }
                }
            }
        }
    }

    private static void requireUniqueWithinBatch(String streamId, List<? extends StreamEventEnvelope<?>> events) {
        Set<String> ids = new HashSet<>();
        for (StreamEventEnvelope<?> event : events) {
            if (!ids.add(event.eventId())) {
                throw new DuplicateEventException(streamId, event.eventId());
            }
        }
    }

    private long currentVersion(String streamId) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(SELECT_STREAM_VERSION)) {
            stmt.setString(1, streamId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : ExpectedStreamVersion.NO_STREAM_VALUE;
            }
        } catch (SQLException e) {
            throw new EventStoreException("Failed to read version of stream " + streamId, e);
        }
    }

    private List<RecordedEvent> query(String sql, String operation, StatementBinder binder) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                List<RecordedEvent> events = new ArrayList<>();
                while (rs.next()) {
                    events.add(toRecordedEvent(rs));
                }
                return events;
            }
        } catch (SQLException e) {
            throw new EventStoreException("Failed to " + operation, e);
        }
    }

    private static RecordedEvent toRecordedEvent(ResultSet rs) throws SQLException {
        return new RecordedEvent(
                rs.getString("stream_id"),
                rs.getString("event_id"),
                rs.getString("event_type"),
                rs.getString("content_type"),
                rs.getBytes("data"),
                rs.getBytes("metadata"),
                rs.getLong("stream_position"),
                rs.getLong("global_position"),
                rs.getObject("created_at", OffsetDateTime.class).toInstant());
    }

    private static boolean isUniqueViolation(SQLException e) {
        for (SQLException next = e; next != null; next = next.getNextException()) {
            if (UNIQUE_VIOLATION.equals(next.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    @FunctionalInterface
    private interface TransactionWork<T> {
        T run() throws SQLException;
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement stmt) throws SQLException;
    }
}
