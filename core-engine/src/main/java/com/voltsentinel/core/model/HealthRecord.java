package com.voltsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One battery-health snapshot for a single vehicle.
 *
 * <p>
 * Instances are immutable. A negative {@code voltage} is only ever used as an
 * "unavailable" sentinel by the publisher; no consumer may assume voltages are
 * positive.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code vehicleId} and {@code timestamp} are
 * required; omitting either throws {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class HealthRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String vehicleId;
    private final double voltage;
    /** State of charge, percent. */
    private final double stateOfCharge;
    /** State of health, percent. */
    private final double stateOfHealth;
    private final BatteryStatus status;
    private final String recommendation;
    private final Double estimatedRuntimeHours;
    private final String batteryType;
    private final Instant timestamp;
    private final Map<String, Object> metadata;

    private HealthRecord(Builder builder) {
        this.vehicleId = Objects.requireNonNull(builder.vehicleId, "vehicleId must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.voltage = builder.voltage;
        this.stateOfCharge = builder.stateOfCharge;
        this.stateOfHealth = builder.stateOfHealth;
        this.status = builder.status != null ? builder.status : BatteryStatus.UNKNOWN;
        this.recommendation = builder.recommendation;
        this.estimatedRuntimeHours = builder.estimatedRuntimeHours;
        this.batteryType = builder.batteryType != null ? builder.batteryType : "unknown";
        this.metadata = builder.metadata != null && !builder.metadata.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata))
                : Collections.emptyMap();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this record's values
     */
    public Builder toBuilder() {
        return new Builder()
                .vehicleId(vehicleId)
                .voltage(voltage)
                .stateOfCharge(stateOfCharge)
                .stateOfHealth(stateOfHealth)
                .status(status)
                .recommendation(recommendation)
                .estimatedRuntimeHours(estimatedRuntimeHours)
                .batteryType(batteryType)
                .timestamp(timestamp)
                .metadata(metadata);
    }

    /**
     * Fluent builder for {@link HealthRecord} instances.
     */
    public static class Builder {
        private String vehicleId;
        private double voltage;
        private double stateOfCharge;
        private double stateOfHealth;
        private BatteryStatus status;
        private String recommendation;
        private Double estimatedRuntimeHours;
        private String batteryType;
        private Instant timestamp;
        private Map<String, Object> metadata;

        public Builder vehicleId(String vehicleId) {
            this.vehicleId = vehicleId;
            return this;
        }

        public Builder voltage(double voltage) {
            this.voltage = voltage;
            return this;
        }

        public Builder stateOfCharge(double stateOfCharge) {
            this.stateOfCharge = stateOfCharge;
            return this;
        }

        public Builder stateOfHealth(double stateOfHealth) {
            this.stateOfHealth = stateOfHealth;
            return this;
        }

        public Builder status(BatteryStatus status) {
            this.status = status;
            return this;
        }

        public Builder recommendation(String recommendation) {
            this.recommendation = recommendation;
            return this;
        }

        public Builder estimatedRuntimeHours(Double estimatedRuntimeHours) {
            this.estimatedRuntimeHours = estimatedRuntimeHours;
            return this;
        }

        public Builder batteryType(String batteryType) {
            this.batteryType = batteryType;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * @return a new {@link HealthRecord}
         * @throws NullPointerException if {@code vehicleId} or {@code timestamp} is {@code null}
         */
        public HealthRecord build() {
            return new HealthRecord(this);
        }
    }

    public String getVehicleId() {
        return vehicleId;
    }

    public double getVoltage() {
        return voltage;
    }

    public double getStateOfCharge() {
        return stateOfCharge;
    }

    public double getStateOfHealth() {
        return stateOfHealth;
    }

    public BatteryStatus getStatus() {
        return status;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public Optional<Double> getEstimatedRuntimeHours() {
        return Optional.ofNullable(estimatedRuntimeHours);
    }

    public String getBatteryType() {
        return batteryType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return unmodifiable metadata map, empty when none was supplied
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * @return {@code true} when the publisher reported the battery as dead or low
     */
    public boolean isCritical() {
        return status == BatteryStatus.DEAD || status == BatteryStatus.LOW;
    }

    /**
     * @return {@code true} when the battery is weak or critical
     */
    public boolean needsAttention() {
        return status == BatteryStatus.WEAK || isCritical();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HealthRecord that))
            return false;
        return Double.compare(voltage, that.voltage) == 0
                && Double.compare(stateOfCharge, that.stateOfCharge) == 0
                && Double.compare(stateOfHealth, that.stateOfHealth) == 0
                && vehicleId.equals(that.vehicleId)
                && timestamp.equals(that.timestamp)
                && Objects.equals(batteryType, that.batteryType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vehicleId, timestamp, voltage, stateOfCharge, stateOfHealth, batteryType);
    }

    @Override
    public String toString() {
        return "HealthRecord{" +
                "vehicleId='" + vehicleId + '\'' +
                ", voltage=" + voltage +
                ", soc=" + stateOfCharge +
                ", soh=" + stateOfHealth +
                ", status=" + status +
                ", batteryType='" + batteryType + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
