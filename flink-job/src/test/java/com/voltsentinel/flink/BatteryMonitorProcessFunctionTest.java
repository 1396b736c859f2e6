package com.voltsentinel.flink;

import com.voltsentinel.core.config.MonitorConfig;
import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.AlertType;
import com.voltsentinel.core.model.HealthPayload;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.streaming.api.operators.KeyedProcessOperator;
import org.apache.flink.streaming.util.KeyedOneInputStreamOperatorTestHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives {@link BatteryMonitorProcessFunction} through Flink's keyed operator
 * test harness with a manually advanced processing-time clock.
 */
class BatteryMonitorProcessFunctionTest {

    private static final long T0 = Instant.parse("2024-05-01T08:00:00Z").toEpochMilli();
    private static final long HOUR = Duration.ofHours(1).toMillis();

    private KeyedOneInputStreamOperatorTestHarness<String, HealthPayload, AlertRecord> harness;

    @BeforeEach
    void setUp() throws Exception {
        MonitorConfig config = MonitorConfig.defaults();
        config.getRetention().setRetentionHours(1);
        config.getRetention().setCleanupIntervalMinutes(60);

        harness = new KeyedOneInputStreamOperatorTestHarness<>(
                new KeyedProcessOperator<>(new BatteryMonitorProcessFunction(config)),
                new VehicleKeySelector("carId"),
                Types.STRING);
        harness.open();
    }

    @AfterEach
    void tearDown() throws Exception {
        harness.close();
    }

    private void ingestAt(long processingTime, String vehicleId, double voltage) throws Exception {
        harness.setProcessingTime(processingTime);
        harness.processElement(HealthPayload.of(Map.of(
                "carId", vehicleId,
                "voltage", voltage,
                "soc", 80.0,
                "soh", 95.0,
                "battery_type", "12V Lead-Acid")), processingTime);
    }

    @Test
    @DisplayName("Should collect alerts for a dropping voltage sequence")
    void shouldCollectAlertsForDroppingSequence() throws Exception {
        ingestAt(T0, "car-1", 12.8);
        assertThat(harness.extractOutputValues()).isEmpty();

        ingestAt(T0 + 10_000, "car-1", 11.0);

        List<AlertRecord> alerts = harness.extractOutputValues();
        assertThat(alerts).isNotEmpty();
        assertThat(alerts).extracting(AlertRecord::getType)
                .contains(AlertType.BATTERY_LOW, AlertType.SUDDEN_DROP);
        assertThat(alerts).allSatisfy(alert -> {
            assertThat(alert.getVehicleId()).isEqualTo("car-1");
            assertThat(alert.getTimestamp()).isEqualTo(Instant.ofEpochMilli(T0 + 10_000));
        });
    }

    @Test
    @DisplayName("Should keep vehicle histories apart per key")
    void shouldKeepKeysApart() throws Exception {
        ingestAt(T0, "car-1", 12.8);
        ingestAt(T0 + 10_000, "car-2", 11.0);

        assertThat(harness.extractOutputValues()).extracting(AlertRecord::getType)
                .containsExactly(AlertType.BATTERY_LOW);
        assertThat(harness.numProcessingTimeTimers()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should re-register the cleanup timer while a key still holds fresh entries")
    void shouldRescheduleCleanupForLiveKey() throws Exception {
        ingestAt(T0, "car-1", 12.8);
        ingestAt(T0 + 10_000, "car-1", 12.7);
        assertThat(harness.numProcessingTimeTimers()).isEqualTo(1);

        harness.setProcessingTime(T0 + HOUR);

        assertThat(harness.numProcessingTimeTimers()).isEqualTo(1);
        assertThat(harness.numKeyedStateEntries()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should prune and clear the state once processing time passes the retention period")
    void shouldClearStateAfterRetention() throws Exception {
        ingestAt(T0, "car-1", 12.8);
        ingestAt(T0 + 10_000, "car-1", 11.0);
        assertThat(harness.extractOutputValues()).isNotEmpty();

        harness.setProcessingTime(T0 + HOUR);
        harness.setProcessingTime(T0 + 2 * HOUR);

        assertThat(harness.numProcessingTimeTimers()).isZero();
        assertThat(harness.numKeyedStateEntries()).isZero();
    }

    @Test
    @DisplayName("Should start from fresh state after the key was cleared")
    void shouldStartFreshAfterClear() throws Exception {
        ingestAt(T0, "car-1", 12.8);
        harness.setProcessingTime(T0 + HOUR);
        harness.setProcessingTime(T0 + 2 * HOUR);

        ingestAt(T0 + 2 * HOUR + 1_000, "car-1", 11.0);

        assertThat(harness.extractOutputValues()).extracting(AlertRecord::getType)
                .containsExactly(AlertType.BATTERY_LOW);
        assertThat(harness.numProcessingTimeTimers()).isEqualTo(1);
    }
}
