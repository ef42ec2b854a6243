package com.strata.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;

import com.strata.eventmodel.TestEvents.ItemAdded;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StreamEventEnvelope")
class StreamEventEnvelopeTest {

    @Nested
    @DisplayName("Creation")
    class Creation {

        @Test
        @DisplayName("domain events keep their own event id")
        void domainEventKeepsId() {
            ItemAdded event = TestEvents.itemAdded("SKU-1", 2);

            StreamEventEnvelope<ItemAdded> envelope = StreamEventEnvelope.of(event);

            assertThat(envelope.eventId()).isEqualTo(event.eventId());
            assertThat(envelope.metadata().streamPosition()).isNull();
            assertThat(envelope.metadata().logPosition()).isNull();
            assertThat(envelope.metadata().occurredAt()).isNotNull();
        }

        @Test
        @DisplayName("other payloads get a fresh event id")
        void plainPayloadGetsId() {
            StreamEventEnvelope<String> first = StreamEventEnvelope.of("a");
            StreamEventEnvelope<String> second = StreamEventEnvelope.of("a");

            assertThat(first.eventId()).isNotBlank().isNotEqualTo(second.eventId());
        }

        @Test
        @DisplayName("forDomainEvent stamps the stream position and aggregate id")
        void forDomainEvent() {
            StreamEventEnvelope<ItemAdded> envelope =
                    StreamEventEnvelope.forDomainEvent(TestEvents.itemAdded("SKU-2", 1), 3, "cart-7");

            assertThat(envelope.metadata().streamPosition()).isEqualTo(3L);
            assertThat(envelope.metadata().aggregateId()).isEqualTo("cart-7");
        }
    }

    @Test
    @DisplayName("metadata copies leave the original envelope untouched")
    void copiesAreIndependent() {
        StreamEventEnvelope<ItemAdded> original = StreamEventEnvelope.of(TestEvents.itemAdded("SKU-3", 1));

        StreamEventEnvelope<ItemAdded> positioned =
                original.withMetadata(original.metadata().withLogPosition(12));

        assertThat(positioned.metadata().logPosition()).isEqualTo(12L);
        assertThat(positioned.metadata().withoutLogPosition().logPosition()).isNull();
        assertThat(original.metadata().logPosition()).isNull();
        assertThat(positioned.payload()).isSameAs(original.payload());
    }
}
