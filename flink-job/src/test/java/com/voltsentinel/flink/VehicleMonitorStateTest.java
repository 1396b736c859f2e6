package com.voltsentinel.flink;

import com.voltsentinel.core.config.MonitorConfig;
import com.voltsentinel.core.config.RetentionSettings;
import com.voltsentinel.core.detection.AlertDetector;
import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.AlertSeverity;
import com.voltsentinel.core.model.AlertType;
import com.voltsentinel.core.model.HealthRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VehicleMonitorStateTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    private final AlertDetector detector = new AlertDetector(MonitorConfig.defaults());

    private static HealthRecord record(long secondsOffset, double voltage) {
        return HealthRecord.builder()
                .vehicleId("car-1")
                .voltage(voltage)
                .stateOfCharge(80.0)
                .stateOfHealth(95.0)
                .batteryType("12V")
                .timestamp(T0.plusSeconds(secondsOffset))
                .build();
    }

    @Test
    @DisplayName("Raised alerts are retained so later records are debounced")
    void retainsAlertsForDebounce() {
        VehicleMonitorState state = new VehicleMonitorState("car-1", new RetentionSettings());

        List<AlertRecord> first = state.process(record(0, 4.0), detector);
        List<AlertRecord> second = state.process(record(10, 4.0), detector);

        assertThat(first).singleElement().satisfies(alert -> {
            assertThat(alert.getType()).isEqualTo(AlertType.BATTERY_LOW);
            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        });
        assertThat(second).isEmpty();
        assertThat(state.getHistory().size()).isEqualTo(2);
        assertThat(state.getAlerts()).containsExactlyElementsOf(first);
    }

    @Test
    @DisplayName("Alert list is bounded and newest first")
    void boundedAlerts() {
        RetentionSettings retention = new RetentionSettings();
        retention.setMaxAlerts(1);
        VehicleMonitorState state = new VehicleMonitorState("car-1", retention);

        state.process(record(0, 4.0), detector);
        state.process(record(60, 12.5), detector);
        List<AlertRecord> raised = state.process(record(120, 4.0), detector);

        assertThat(raised).isNotEmpty();
        assertThat(state.getAlerts()).containsExactly(raised.get(raised.size() - 1));
    }

    @Test
    @DisplayName("Prune removes history and alerts strictly older than the cutoff")
    void prune() {
        VehicleMonitorState state = new VehicleMonitorState("car-1", new RetentionSettings());
        state.process(record(0, 4.0), detector);
        state.process(record(3600, 12.5), detector);

        assertThat(state.prune(T0.plusSeconds(3600))).isEqualTo(2);
        assertThat(state.getHistory().size()).isEqualTo(1);
        assertThat(state.getAlerts()).isEmpty();
        assertThat(state.isEmpty()).isFalse();

        assertThat(state.prune(T0.plusSeconds(7200))).isEqualTo(1);
        assertThat(state.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Non-positive alert capacity is rejected")
    void rejectsZeroCapacity() {
        RetentionSettings retention = new RetentionSettings();
        retention.setMaxAlerts(0);

        assertThatThrownBy(() -> new VehicleMonitorState("car-1", retention))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxAlerts");
    }
}
