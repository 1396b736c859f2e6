package com.voltsentinel.core.ingest;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed form of a vehicle telemetry topic {@code car/{vehicleId}/<sensor>}.
 *
 * <p>
 * Recognised sensors: {@code voltage}, {@code temperature}, {@code battery},
 * {@code battery/health} and {@code alternator}. Only
 * {@link Kind#BATTERY_HEALTH} topics feed health ingestion.
 * </p>
 *
 * @since 1.0.0
 */
public final class TopicRoute {

    public static final String PREFIX = "car";

    /**
     * Sensor addressed by a topic.
     */
    public enum Kind {
        VOLTAGE("voltage"),
        TEMPERATURE("temperature"),
        BATTERY("battery"),
        BATTERY_HEALTH("battery/health"),
        ALTERNATOR("alternator"),
        UNKNOWN("");

        private final String suffix;

        Kind(String suffix) {
            this.suffix = suffix;
        }

        public String getSuffix() {
            return suffix;
        }

        static Kind fromSuffix(String suffix) {
            String token = suffix.toLowerCase(Locale.ROOT);
            for (Kind kind : values()) {
                if (kind != UNKNOWN && kind.suffix.equals(token)) {
                    return kind;
                }
            }
            return UNKNOWN;
        }
    }

    private final String vehicleId;
    private final Kind kind;

    private TopicRoute(String vehicleId, Kind kind) {
        this.vehicleId = vehicleId;
        this.kind = kind;
    }

    /**
     * Parse a topic string.
     *
     * @param topic topic such as {@code car/car-1/battery/health}
     * @return the route, or empty if the topic is not a {@code car/{id}/...} topic
     */
    public static Optional<TopicRoute> parse(String topic) {
        if (topic == null) {
            return Optional.empty();
        }
        String[] parts = topic.trim().split("/", 3);
        if (parts.length < 3 || !PREFIX.equals(parts[0]) || parts[1].isBlank() || parts[2].isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new TopicRoute(parts[1], Kind.fromSuffix(parts[2])));
    }

    /**
     * Build the topic string for a vehicle and sensor.
     */
    public static String topicFor(String vehicleId, Kind kind) {
        Objects.requireNonNull(vehicleId, "vehicleId must not be null");
        if (kind == Kind.UNKNOWN) {
            throw new IllegalArgumentException("Cannot build a topic for an unknown sensor");
        }
        return PREFIX + "/" + vehicleId + "/" + kind.getSuffix();
    }

    public String getVehicleId() {
        return vehicleId;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isBatteryHealth() {
        return kind == Kind.BATTERY_HEALTH;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TopicRoute that))
            return false;
        return vehicleId.equals(that.vehicleId) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(vehicleId, kind);
    }

    @Override
    public String toString() {
        return "TopicRoute{vehicleId='" + vehicleId + "', kind=" + kind + '}';
    }
}
