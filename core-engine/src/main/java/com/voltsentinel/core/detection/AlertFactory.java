package com.voltsentinel.core.detection;

import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.AlertSeverity;
import com.voltsentinel.core.model.AlertType;
import com.voltsentinel.core.model.HealthRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds the alert records raised by the detection rules.
 *
 * <p>
 * Alerts are stamped with the triggering record's timestamp. Ids have the
 * form {@code alert_<epochMillis>_<sequence>}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertFactory {

    /** Reason tag of the absolute disposal alert. */
    public static final String REASON_DISPOSAL = "absolute_dispose_<=4_5V";

    /** Reason tag of a detected battery swap. */
    public static final String REASON_SWAP = "swap_detected";

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private AlertFactory() {
        // utility class
    }

    static String nextId(Instant timestamp) {
        return "alert_" + timestamp.toEpochMilli() + "_" + SEQUENCE.incrementAndGet();
    }

    public static AlertRecord disposal(HealthRecord record) {
        Map<String, Object> data = chargeData(record);
        data.put(AlertRecord.REASON_KEY, REASON_DISPOSAL);
        return base(record, AlertType.BATTERY_LOW, AlertSeverity.CRITICAL)
                .title("Battery Disposed/Dead")
                .message(String.format(Locale.ROOT,
                        "Voltage is at %.2fV (%.1f%%). This is <= 4.5V and indicates the battery "
                                + "should be disposed/replaced.",
                        record.getVoltage(), record.getStateOfCharge()))
                .data(data)
                .build();
    }

    public static AlertRecord criticalLevel(HealthRecord record) {
        return base(record, AlertType.BATTERY_LOW, AlertSeverity.CRITICAL)
                .title("Critical Battery Level")
                .message(String.format(Locale.ROOT,
                        "Battery voltage is critically low at %.2fV (%.1f%%). Immediate replacement required.",
                        record.getVoltage(), record.getStateOfCharge()))
                .data(chargeData(record))
                .build();
    }

    public static AlertRecord lowLevel(HealthRecord record) {
        return base(record, AlertType.BATTERY_LOW, AlertSeverity.WARNING)
                .title("Low Battery Level")
                .message(String.format(Locale.ROOT,
                        "Battery voltage is low at %.2fV (%.1f%%). Consider replacement soon.",
                        record.getVoltage(), record.getStateOfCharge()))
                .data(chargeData(record))
                .build();
    }

    /**
     * @param record     the degraded record
     * @param warningSoh below this SOH the alert is a warning, otherwise info
     */
    public static AlertRecord healthDegradation(HealthRecord record, double warningSoh) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("soh", record.getStateOfHealth());
        data.put("batteryType", record.getBatteryType());
        AlertSeverity severity = record.getStateOfHealth() < warningSoh
                ? AlertSeverity.WARNING
                : AlertSeverity.INFO;
        return base(record, AlertType.HEALTH_DEGRADATION, severity)
                .title("Battery Health Degradation")
                .message(String.format(Locale.ROOT,
                        "Battery health has degraded to %.1f%%. Monitor performance closely.",
                        record.getStateOfHealth()))
                .data(data)
                .build();
    }

    /**
     * @param previous  the reference sample the drop is measured from
     * @param current   the record under evaluation
     * @param extraData additional provenance merged over the standard drop data, may be {@code null}
     */
    public static AlertRecord suddenDrop(HealthRecord previous, HealthRecord current,
            Map<String, Object> extraData) {
        double drop = previous.getVoltage() - current.getVoltage();
        long seconds = Duration.between(previous.getTimestamp(), current.getTimestamp()).getSeconds();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("fromVoltage", previous.getVoltage());
        data.put("toVoltage", current.getVoltage());
        data.put("drop", drop);
        data.put("windowSeconds", seconds);
        data.put("batteryType", current.getBatteryType());
        if (extraData != null) {
            data.putAll(extraData);
        }

        return base(current, AlertType.SUDDEN_DROP, AlertSeverity.CRITICAL)
                .title("Sudden Voltage Drop")
                .message(String.format(Locale.ROOT,
                        "Voltage dropped by %.2fV in %ds (from %.2fV to %.2fV). "
                                + "Investigate possible failure or disconnection.",
                        drop, seconds, previous.getVoltage(), current.getVoltage()))
                .data(data)
                .build();
    }

    private static AlertRecord.Builder base(HealthRecord record, AlertType type, AlertSeverity severity) {
        return AlertRecord.builder()
                .id(nextId(record.getTimestamp()))
                .vehicleId(record.getVehicleId())
                .type(type)
                .severity(severity)
                .timestamp(record.getTimestamp());
    }

    private static Map<String, Object> chargeData(HealthRecord record) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("voltage", record.getVoltage());
        data.put("soc", record.getStateOfCharge());
        data.put("batteryType", record.getBatteryType());
        return data;
    }
}
