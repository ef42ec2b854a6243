package com.strata.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.strata.eventmodel.TestEvents.ItemAdded;
import com.strata.eventmodel.TestEvents.PriceChanged;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EventSerializer")
class EventSerializerTest {

    private final EventSerializer serializer = new EventSerializer(TestEvents.registry());

    @Nested
    @DisplayName("encode()")
    class Encode {

        @Test
        @DisplayName("tags the payload with its registered name and JSON content type")
        void tagsPayload() {
            ItemAdded event = TestEvents.itemAdded("sku-1", 2);

            EventData data = serializer.encode(StreamEventEnvelope.of(event));

            assertThat(data.eventId()).isEqualTo(event.eventId());
            assertThat(data.eventType()).isEqualTo("ItemAdded");
            assertThat(data.contentType()).isEqualTo("application/json");
            assertThat(new String(data.data(), StandardCharsets.UTF_8)).contains("\"sku\":\"sku-1\"");
        }

        @Test
        @DisplayName("omits unassigned positions from the metadata")
        void omitsUnassignedPositions() {
            EventData data = serializer.encode(StreamEventEnvelope.of(TestEvents.itemAdded("a", 1)));
            String metadata = new String(data.metadata(), StandardCharsets.UTF_8);

            assertThat(metadata).contains("eventId").doesNotContain("logPosition").doesNotContain("streamPosition");
        }

        @Test
        @DisplayName("writes instants as ISO 8601 strings")
        void instantAsIso8601() {
            var event = new PriceChanged("e-1", 499, Instant.parse("2024-03-01T10:15:30Z"));

            EventData data = serializer.encode(StreamEventEnvelope.of(event));

            assertThat(new String(data.data(), StandardCharsets.UTF_8))
                    .contains("\"effectiveAt\":\"2024-03-01T10:15:30Z\"");
            assertThat(new String(data.metadata(), StandardCharsets.UTF_8))
                    .containsPattern("\"occurredAt\"\\s*:\\s*\"\\d{4}-\\d{2}-\\d{2}T");
        }

        @Test
        @DisplayName("rejects unregistered payload classes")
        void rejectsUnregistered() {
            assertThatThrownBy(() -> serializer.encode(StreamEventEnvelope.of("plain string")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("java.lang.String");
        }
    }

    @Nested
    @DisplayName("decode()")
    class Decode {

        @Test
        @DisplayName("restores the payload and takes positions from the record")
        void restoresPayload() {
            ItemAdded event = TestEvents.itemAdded("sku-9", 3);
            EventData data = serializer.encode(StreamEventEnvelope.forDomainEvent(event, 5, "cart-1"));

            StreamEventEnvelope<Object> decoded = serializer.decode(TestEvents.recorded(data, 4, 17));

            assertThat(decoded.payload()).isEqualTo(event);
            assertThat(decoded.metadata().eventId()).isEqualTo(event.eventId());
            assertThat(decoded.metadata().aggregateId()).isEqualTo("cart-1");
            assertThat(decoded.metadata().streamPosition()).isEqualTo(4L);
            assertThat(decoded.metadata().logPosition()).isEqualTo(17L);
        }

        @Test
        @DisplayName("keeps occurredAt across the round trip")
        void keepsOccurredAt() {
            StreamEventEnvelope<ItemAdded> envelope = StreamEventEnvelope.of(TestEvents.itemAdded("x", 1));
            EventData data = serializer.encode(envelope);

            StreamEventEnvelope<Object> decoded = serializer.decode(TestEvents.recorded(data, 0, 0));

            assertThat(decoded.metadata().occurredAt().truncatedTo(ChronoUnit.MILLIS))
                    .isEqualTo(envelope.metadata().occurredAt().truncatedTo(ChronoUnit.MILLIS));
        }

        @Test
        @DisplayName("throws on unknown event type")
        void throwsOnUnknownType() {
            EventData data = serializer.encode(StreamEventEnvelope.of(TestEvents.itemAdded("x", 1)));
            var unknown = new EventData(data.eventId(), "Renamed", data.contentType(), data.data(), data.metadata());

            assertThatThrownBy(() -> serializer.decode(TestEvents.recorded(unknown, 0, 0)))
                    .isInstanceOf(EventSerializer.EventSerializationException.class)
                    .hasMessageContaining("Renamed");
        }

        @Test
        @DisplayName("throws on malformed payload")
        void throwsOnMalformedPayload() {
            var broken = new EventData("e-1", "ItemAdded", "application/json",
                    "not-json{".getBytes(StandardCharsets.UTF_8), new byte[0]);

            assertThatThrownBy(() -> serializer.decode(TestEvents.recorded(broken, 0, 0)))
                    .isInstanceOf(EventSerializer.EventSerializationException.class)
                    .hasMessageContaining("e-1")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("uses a custom decoder when one is registered")
        void usesCustomDecoder() {
            var registry = new EventTypeRegistry().register("ItemAddedV1", ItemAdded.class,
                    (mapper, bytes) -> new ItemAdded("legacy", new String(bytes, StandardCharsets.UTF_8), 1));
            var legacy = new EventSerializer(registry);
            var data = new EventData("legacy", "ItemAddedV1", "text/plain",
                    "sku-old".getBytes(StandardCharsets.UTF_8), null);

            Object payload = legacy.decode(TestEvents.recorded(data, 0, 3)).payload();

            assertThat(payload).isEqualTo(new ItemAdded("legacy", "sku-old", 1));
        }
    }
}
