package com.strata.eventstore;

/**
 * Name of one event stream, the partition key of the log.
 *
 * <p>Aggregate streams are named {@code "{AggregateTypeName}-{id}"}; checkpoint streams
 * {@code "checkpoint_{subscriptionId}"}. Callers treat the value as opaque.
 */
public record StreamName(String value) {

    public static final String CHECKPOINT_PREFIX = "checkpoint_";

    public StreamName {
        requireValid(value);
    }

    public static StreamName of(String value) {
        return new StreamName(value);
    }

    /**
     * @param aggregateType aggregate class, its simple name is the stream prefix
     * @param id aggregate id, converted with {@link String#valueOf(Object)}
     * @throws IllegalArgumentException if the id is null, empty or whitespace
     */
    public static StreamName forAggregate(Class<?> aggregateType, Object id) {
        if (aggregateType == null) {
            throw new IllegalArgumentException("aggregateType must not be null");
        }
        return new StreamName(aggregateType.getSimpleName() + "-" + requireId(id));
    }

    public static StreamName checkpoint(String subscriptionId) {
        if (subscriptionId == null || subscriptionId.isBlank()) {
            throw new IllegalArgumentException("subscriptionId must not be null or blank");
        }
        return new StreamName(CHECKPOINT_PREFIX + subscriptionId);
    }

    /**
     * Validates an aggregate id and returns its string form.
     */
    public static String requireId(Object id) {
        String text = id == null ? null : String.valueOf(id);
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Aggregate id must not be null, empty or whitespace");
        }
        return text;
    }

    /**
     * Validates a raw stream id.
     *
     * @return the same id
     */
    public static String requireValid(String streamId) {
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("streamId must not be null or blank");
        }
        return streamId;
    }

    @Override
    public String toString() {
        return value;
    }
}
