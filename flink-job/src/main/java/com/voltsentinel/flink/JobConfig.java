package com.voltsentinel.flink;

import java.io.Serializable;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Typed, immutable deployment configuration for the Volt Sentinel Flink job.
 *
 * <p>
 * Values are resolved from environment variables with defaults suited to a
 * local Kafka broker. Detection thresholds are not configured here; they live
 * in {@code monitor.yml} whose location is {@link #getMonitorConfigPath()}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic and test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_HEALTH_TOPIC = "battery-health";
    public static final String DEFAULT_ALERT_TOPIC = "battery-alerts";
    public static final String DEFAULT_GROUP_ID = "volt-sentinel";
    public static final String DEFAULT_VEHICLE_ID_FIELD = "carId";

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaHealthTopic;
    private final String kafkaAlertTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Monitor
    // ---------------------------------------------------------------
    private final String monitorConfigPath;
    private final String vehicleIdField;

    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaHealthTopic = b.kafkaHealthTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.monitorConfigPath = b.monitorConfigPath;
        this.vehicleIdField = b.vehicleIdField;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromLookup(System::getenv);
    }

    /**
     * Build a {@link JobConfig} from an arbitrary variable lookup.
     *
     * @param lookup maps a variable name to its value, or {@code null} if unset
     * @return fully populated configuration
     */
    static JobConfig fromLookup(UnaryOperator<String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        try {
            return new Builder()
                    .kafkaBootstrapServers(env(lookup, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaHealthTopic(env(lookup, "KAFKA_HEALTH_TOPIC", DEFAULT_HEALTH_TOPIC))
                    .kafkaAlertTopic(env(lookup, "KAFKA_ALERT_TOPIC", DEFAULT_ALERT_TOPIC))
                    .kafkaGroupId(env(lookup, "KAFKA_GROUP_ID", DEFAULT_GROUP_ID))
                    .parallelism(Integer.parseInt(env(lookup, "FLINK_PARALLELISM", "1")))
                    .checkpointIntervalMs(Long.parseLong(env(lookup, "FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .monitorConfigPath(env(lookup, "MONITOR_CONFIG_PATH", ""))
                    .vehicleIdField(env(lookup, "VEHICLE_ID_FIELD", DEFAULT_VEHICLE_ID_FIELD))
                    .healthPort(Integer.parseInt(env(lookup, "HEALTH_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaHealthTopic() {
        return kafkaHealthTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /**
     * @return path to a {@code monitor.yml} file, or an empty string to use the
     *         classpath resource
     */
    public String getMonitorConfigPath() {
        return monitorConfigPath;
    }

    public String getVehicleIdField() {
        return vehicleIdField;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} checks parallelism &gt; 0, checkpoint interval &gt; 0,
     * port in [1, 65535] and non-blank topic, group and field names.
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaHealthTopic = DEFAULT_HEALTH_TOPIC;
        private String kafkaAlertTopic = DEFAULT_ALERT_TOPIC;
        private String kafkaGroupId = DEFAULT_GROUP_ID;
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String monitorConfigPath = "";
        private String vehicleIdField = DEFAULT_VEHICLE_ID_FIELD;
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaHealthTopic(String v) {
            this.kafkaHealthTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder monitorConfigPath(String v) {
            this.monitorConfigPath = v;
            return this;
        }

        public Builder vehicleIdField(String v) {
            this.vehicleIdField = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaHealthTopic, "kafkaHealthTopic");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(vehicleIdField, "vehicleIdField");
            if (monitorConfigPath == null) {
                monitorConfigPath = "";
            }

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (kafkaHealthTopic.equals(kafkaAlertTopic)) {
                throw new IllegalArgumentException(
                        "kafkaHealthTopic and kafkaAlertTopic must differ, both are: " + kafkaHealthTopic);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(UnaryOperator<String> lookup, String name, String defaultValue) {
        String value = lookup.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaHealthTopic='" + kafkaHealthTopic + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", monitorConfigPath='" + monitorConfigPath + '\'' +
                ", vehicleIdField='" + vehicleIdField + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
