package com.voltsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobConfigTest {

    @Test
    @DisplayName("Unset variables resolve to defaults")
    void defaults() {
        JobConfig config = JobConfig.fromLookup(name -> null);

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaHealthTopic()).isEqualTo("battery-health");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("battery-alerts");
        assertThat(config.getKafkaGroupId()).isEqualTo("volt-sentinel");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getCheckpointIntervalMs()).isEqualTo(60_000L);
        assertThat(config.getMonitorConfigPath()).isEmpty();
        assertThat(config.getVehicleIdField()).isEqualTo("carId");
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Variables override defaults and blank values are ignored")
    void overrides() {
        Map<String, String> env = new HashMap<>();
        env.put("KAFKA_BOOTSTRAP_SERVERS", "kafka:29092");
        env.put("KAFKA_HEALTH_TOPIC", "fleet-health");
        env.put("FLINK_PARALLELISM", " 4 ");
        env.put("MONITOR_CONFIG_PATH", "/etc/volt/monitor.yml");
        env.put("VEHICLE_ID_FIELD", "vehicle_id");
        env.put("KAFKA_GROUP_ID", "   ");

        JobConfig config = JobConfig.fromLookup(env::get);

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("kafka:29092");
        assertThat(config.getKafkaHealthTopic()).isEqualTo("fleet-health");
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getMonitorConfigPath()).isEqualTo("/etc/volt/monitor.yml");
        assertThat(config.getVehicleIdField()).isEqualTo("vehicle_id");
        assertThat(config.getKafkaGroupId()).isEqualTo("volt-sentinel");
    }

    @Test
    @DisplayName("Non-numeric values fail with IllegalStateException")
    void unparsableNumber() {
        assertThatThrownBy(() -> JobConfig.fromLookup(name -> "HEALTH_PORT".equals(name) ? "http" : null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("numeric");
    }

    @Test
    @DisplayName("Builder rejects out-of-range values")
    void builderValidation() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("checkpointIntervalMs");
        assertThatThrownBy(() -> new JobConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> new JobConfig.Builder().vehicleIdField(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("vehicleIdField");
    }

    @Test
    @DisplayName("Health and alert topics must differ")
    void topicsMustDiffer() {
        assertThatThrownBy(() -> new JobConfig.Builder()
                .kafkaHealthTopic("battery").kafkaAlertTopic("battery").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must differ");
    }
}
