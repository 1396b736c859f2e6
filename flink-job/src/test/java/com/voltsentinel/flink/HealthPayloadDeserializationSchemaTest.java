package com.voltsentinel.flink;

import com.voltsentinel.core.model.HealthPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class HealthPayloadDeserializationSchemaTest {

    private static final Instant RECEIVED = Instant.parse("2024-05-01T08:00:00Z");

    private final HealthPayloadDeserializationSchema schema =
            new HealthPayloadDeserializationSchema(Clock.fixed(RECEIVED, ZoneOffset.UTC));

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("JSON object becomes a payload stamped with the receive time")
    void decodesObject() throws Exception {
        HealthPayload payload = schema.deserialize(bytes(
                "{\"carId\":\"car-7\",\"voltage\":12.4,\"soc\":\"81\",\"metadata\":{\"fw\":\"1.2\"}}"));

        assertThat(payload).isNotNull();
        assertThat(payload.getStringField("carId")).contains("car-7");
        assertThat(payload.getNumericField("voltage")).contains(12.4);
        assertThat(payload.getNumericField("soc")).contains(81.0);
        assertThat(payload.getMapField("metadata")).hasValueSatisfying(m -> assertThat(m).containsEntry("fw", "1.2"));
        assertThat(payload.getReceivedAt()).isEqualTo(RECEIVED);
    }

    @Test
    @DisplayName("Malformed JSON is dropped")
    void malformed() throws Exception {
        assertThat(schema.deserialize(bytes("{\"voltage\": 12.4"))).isNull();
    }

    @Test
    @DisplayName("Non-object JSON is dropped")
    void nonObject() throws Exception {
        assertThat(schema.deserialize(bytes("[1, 2, 3]"))).isNull();
        assertThat(schema.deserialize(bytes("\"12.4\""))).isNull();
    }

    @Test
    @DisplayName("Empty and null messages are dropped")
    void empty() throws Exception {
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
    }

    @Test
    @DisplayName("Stream never ends")
    void unbounded() {
        assertThat(schema.isEndOfStream(new HealthPayload())).isFalse();
    }
}
