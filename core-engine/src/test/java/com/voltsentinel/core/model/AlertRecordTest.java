package com.voltsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertRecord} and the alert enums.
 */
class AlertRecordTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    @Test
    @DisplayName("Should return a read copy and leave the original untouched")
    void shouldMarkReadAsCopy() {
        AlertRecord alert = alert(Map.of("reason", "swap_detected"));

        AlertRecord read = alert.markedRead();

        assertThat(alert.isRead()).isFalse();
        assertThat(read.isRead()).isTrue();
        assertThat(read.getId()).isEqualTo(alert.getId());
        assertThat(read.getData()).isEqualTo(alert.getData());
        assertThat(read.markedRead()).isSameAs(read);
    }

    @Test
    @DisplayName("Should copy the data map and expose it read-only")
    void shouldCopyData() {
        Map<String, Object> data = new HashMap<>();
        data.put("reason", "swap_detected");
        AlertRecord alert = alert(data);

        data.put("reason", "changed");

        assertThat(alert.getReason()).contains("swap_detected");
        assertThat(alert.hasReason("swap_detected")).isTrue();
        assertThatThrownBy(() -> alert.getData().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should require id, vehicle, type, severity and timestamp")
    void shouldRequireMandatoryFields() {
        assertThatThrownBy(() -> AlertRecord.builder()
                .vehicleId("car-1")
                .type(AlertType.SENSOR_ERROR)
                .severity(AlertSeverity.INFO)
                .timestamp(T0)
                .build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should parse wire tokens with fallbacks for unknown values")
    void shouldParseWireTokens() {
        assertThat(AlertType.fromValue("sudden_drop")).isEqualTo(AlertType.SUDDEN_DROP);
        assertThat(AlertType.fromValue("nonsense")).isEqualTo(AlertType.SYSTEM_ERROR);
        assertThat(AlertSeverity.fromValue("CRITICAL")).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(AlertSeverity.fromValue(null)).isEqualTo(AlertSeverity.INFO);
        assertThat(BatteryStatus.fromValue("Dead")).isEqualTo(BatteryStatus.DEAD);
        assertThat(BatteryStatus.fromValue("exploded")).isEqualTo(BatteryStatus.UNKNOWN);
        assertThat(AlertSeverity.CRITICAL.isAtLeast(AlertSeverity.WARNING)).isTrue();
        assertThat(AlertSeverity.INFO.isAtLeast(AlertSeverity.WARNING)).isFalse();
    }

    @Test
    @DisplayName("Should derive attention flags from the reported status")
    void shouldDeriveStatusFlags() {
        HealthRecord weak = HealthRecord.builder().vehicleId("car-1").timestamp(T0)
                .status(BatteryStatus.WEAK).build();
        HealthRecord dead = weak.toBuilder().status(BatteryStatus.DEAD).build();
        HealthRecord good = weak.toBuilder().status(BatteryStatus.GOOD).build();

        assertThat(weak.needsAttention()).isTrue();
        assertThat(weak.isCritical()).isFalse();
        assertThat(dead.isCritical()).isTrue();
        assertThat(good.needsAttention()).isFalse();
        assertThat(good.getBatteryType()).isEqualTo("unknown");
    }

    private static AlertRecord alert(Map<String, Object> data) {
        return AlertRecord.builder()
                .id("alert_1")
                .vehicleId("car-1")
                .type(AlertType.SUDDEN_DROP)
                .severity(AlertSeverity.CRITICAL)
                .title("Sudden Voltage Drop")
                .timestamp(T0)
                .data(data)
                .build();
    }
}
