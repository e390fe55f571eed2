package dev.eventsourced.components.eventsourced.eventstore.serializer.json;

import dev.eventsourced.components.eventsourced.eventstore.*;
import dev.eventsourced.components.eventsourced.eventstore.OrderEvent.*;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.*;

import static org.assertj.core.api.Assertions.*;

class JacksonEventSerializerTest {
    private final JacksonEventSerializer serializer = new JacksonEventSerializer();

    @Test
    void verify_serialized_event_carries_metadata_and_iso_timestamps() {
        // Given
        var event = new OrderPlaced("order-1", "customer-1", new BigDecimal("10.50"), OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.ofHours(2)));

        // When
        var serialized = serializer.serialize(event);

        // Then
        assertThat(serialized.metadata.eventType).isEqualTo("OrderPlaced");
        assertThat(serialized.metadata.javaType).isEqualTo(OrderPlaced.class.getName());
        assertThat(serialized.metadata.revision).isEqualTo(EventMetadata.FIRST_REVISION);
        assertThat(serialized.payload).contains("\"orderId\":\"order-1\"")
                                      .contains("2024-03-01T12:00:00+02:00");
    }

    @Test
    void verify_deserialization_using_metadata_preserves_all_fields() {
        // Given
        var event      = new OrderPlaced("order-1", "customer-1", new BigDecimal("10.50"), OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.ofHours(2)));
        var serialized = serializer.serialize(event);

        // When
        OrderEvent deserialized = serializer.deserialize(serialized.payload, serialized.metadata);

        // Then
        assertThat(deserialized).isInstanceOf(OrderPlaced.class);
        var placed = (OrderPlaced) deserialized;
        assertThat(placed.orderId()).isEqualTo("order-1");
        assertThat(placed.customerId()).isEqualTo("customer-1");
        assertThat(placed.amount()).isEqualByComparingTo("10.50");
        assertThat(placed.occurredAt()).isEqualTo(event.occurredAt());
    }

    @Test
    void verify_unknown_properties_are_ignored() {
        // When
        var shipped = serializer.deserialize("{\"orderId\":\"order-1\",\"trackingNumber\":\"T-1\",\"occurredAt\":\"2024-03-01T12:00:00Z\",\"carrier\":\"DHL\"}",
                                             OrderShipped.class);

        // Then
        assertThat(shipped.trackingNumber()).isEqualTo("T-1");
        assertThat(shipped.occurredAt()).isEqualTo(OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC));
    }

    @Test
    void verify_an_unknown_java_type_fails_with_a_deserialization_exception() {
        assertThatThrownBy(() -> serializer.deserialize("{}", new EventMetadata("1", "Unknown", "com.example.DoesNotExist")))
                .isInstanceOf(JSONDeserializationException.class)
                .hasMessageContaining("com.example.DoesNotExist");
    }

    @Test
    void verify_a_java_type_that_is_not_an_event_is_rejected() {
        assertThatThrownBy(() -> serializer.deserialize("{}", new EventMetadata("1", "String", String.class.getName())))
                .isInstanceOf(JSONDeserializationException.class);
    }

    @Test
    void verify_malformed_json_fails_with_a_deserialization_exception() {
        assertThatThrownBy(() -> serializer.deserialize("{not json", OrderShipped.class))
                .isInstanceOf(JSONDeserializationException.class)
                .isInstanceOf(EventStoreException.class);
    }
}
