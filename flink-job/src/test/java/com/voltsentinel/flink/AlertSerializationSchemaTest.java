package com.voltsentinel.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.AlertSeverity;
import com.voltsentinel.core.model.AlertType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AlertSerializationSchemaTest {

    @Test
    @DisplayName("Alert is written with wire tokens and an ISO-8601 timestamp")
    void writesWireFormat() throws Exception {
        AlertRecord alert = AlertRecord.builder()
                .id("alert_1714550400000_1")
                .vehicleId("car-7")
                .type(AlertType.BATTERY_LOW)
                .severity(AlertSeverity.CRITICAL)
                .title("Battery needs disposal")
                .message("Voltage 4.20V is at or below 4.50V")
                .timestamp(Instant.parse("2024-05-01T08:00:00Z"))
                .data(Map.of(AlertRecord.REASON_KEY, "absolute_dispose_<=4_5V", "voltage", 4.2))
                .build();

        byte[] bytes = new AlertSerializationSchema().serialize(alert);
        JsonNode json = new ObjectMapper().readTree(bytes);

        assertThat(json.get("id").asText()).isEqualTo("alert_1714550400000_1");
        assertThat(json.get("vehicleId").asText()).isEqualTo("car-7");
        assertThat(json.get("type").asText()).isEqualTo("battery_low");
        assertThat(json.get("severity").asText()).isEqualTo("critical");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-05-01T08:00:00Z");
        assertThat(json.get("read").asBoolean()).isFalse();
        assertThat(json.get("data").get("reason").asText()).isEqualTo("absolute_dispose_<=4_5V");
        assertThat(json.get("data").get("voltage").asDouble()).isEqualTo(4.2);
        assertThat(json.has("reason")).isFalse();
    }
}
