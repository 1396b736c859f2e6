package com.voltsentinel.flink;

import com.esotericsoftware.kryo.Serializer;
import com.voltsentinel.core.config.MonitorConfig;
import com.voltsentinel.core.config.MonitorConfigLoader;
import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.HealthPayload;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.java.typeutils.runtime.kryo.JavaSerializer;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Volt Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (health topic)
 *     → Deserialize JSON → HealthPayload
 *     → Drop payloads without a vehicle id
 *     → Key by vehicle id field (default carId)
 *     → BatteryMonitorProcessFunction (normalise, record history, detect)
 *     → Serialize AlertRecord → JSON
 *     → Kafka (alert topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Deployment settings come from environment variables via {@link JobConfig};
 * thresholds and windows come from {@code monitor.yml} via
 * {@link MonitorConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing keeps per-vehicle history and alert state
 * consistent across restarts.
 * </p>
 *
 * @since 1.0.0
 */
public final class BatteryMonitorJob {

    private static final Logger LOG = LoggerFactory.getLogger(BatteryMonitorJob.class);

    private BatteryMonitorJob() {
    }

    public static void main(String[] args) throws Exception {
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Volt Sentinel with config: {}", config);

        MonitorConfig monitorConfig = loadMonitorConfig(config);
        LOG.info("Loaded monitor configuration: {}", monitorConfig);

        HealthServer healthServer = new HealthServer();
        healthServer.start(config.getHealthPort());
        Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(config.getParallelism());
        // keyed state holds unmodifiable JDK collections that Kryo cannot rebuild
        env.getConfig().addDefaultKryoSerializer(VehicleMonitorState.class,
                (Class<? extends Serializer<?>>) (Class<?>) JavaSerializer.class);
        configureCheckpointing(env, config);

        buildPipeline(env, config, monitorConfig);
        healthServer.markReady();

        env.execute("Volt Sentinel - Battery Monitoring");
    }

    // ---------------------------------------------------------------
    // Pipeline assembly
    // ---------------------------------------------------------------

    /**
     * Build the Kafka → Flink → Kafka pipeline.
     */
    static void buildPipeline(StreamExecutionEnvironment env,
            JobConfig config,
            MonitorConfig monitorConfig) {
        KafkaSource<HealthPayload> kafkaSource = KafkaSource.<HealthPayload>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getKafkaHealthTopic())
                .setGroupId(config.getKafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setValueOnlyDeserializer(new HealthPayloadDeserializationSchema())
                .build();

        DataStream<HealthPayload> payloads = env.fromSource(
                kafkaSource,
                WatermarkStrategy.noWatermarks(),
                "kafka-health-source");

        VehicleKeySelector keySelector = new VehicleKeySelector(config.getVehicleIdField());
        DataStream<AlertRecord> alerts = payloads
                .filter(keySelector::hasVehicleId)
                .name("require-vehicle-id")
                .keyBy(keySelector)
                .process(new BatteryMonitorProcessFunction(monitorConfig))
                .name("battery-monitor");

        KafkaSink<AlertRecord> kafkaSink = KafkaSink.<AlertRecord>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setRecordSerializer(
                        KafkaRecordSerializationSchema.builder()
                                .setTopic(config.getKafkaAlertTopic())
                                .setValueSerializationSchema(new AlertSerializationSchema())
                                .build())
                .build();

        alerts.sinkTo(kafkaSink).name("kafka-alerts-sink");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static MonitorConfig loadMonitorConfig(JobConfig config) {
        String path = config.getMonitorConfigPath();
        if (path != null && !path.isBlank()) {
            return MonitorConfigLoader.fromFile(path);
        }
        return MonitorConfigLoader.load();
    }

    private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
        long interval = config.getCheckpointIntervalMs();
        env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

        CheckpointConfig cpConfig = env.getCheckpointConfig();
        cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
        cpConfig.setCheckpointTimeout(interval * 2);
        cpConfig.setMaxConcurrentCheckpoints(1);
        cpConfig.setExternalizedCheckpointCleanup(
                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
    }
}
