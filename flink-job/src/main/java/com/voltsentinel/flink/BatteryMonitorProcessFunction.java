package com.voltsentinel.flink;

import com.voltsentinel.core.config.MonitorConfig;
import com.voltsentinel.core.detection.AlertDetector;
import com.voltsentinel.core.ingest.HealthRecordNormalizer;
import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.HealthPayload;
import com.voltsentinel.core.model.HealthRecord;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.TimerService;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Flink {@link KeyedProcessFunction} that runs the alert detector for one
 * vehicle per key.
 *
 * <h3>State Management</h3>
 * <p>
 * A {@code ValueState<VehicleMonitorState>} holds the vehicle's history and
 * recent alerts. It is created lazily on the first record for a key and is
 * snapshotted with every checkpoint.
 * </p>
 *
 * <h3>Retention</h3>
 * <p>
 * The first record for a key registers a processing-time timer at the
 * configured cleanup interval. Each firing prunes entries older than the
 * retention period, clears the state once it is empty, and otherwise
 * re-registers itself.
 * </p>
 *
 * @since 1.0.0
 */
public class BatteryMonitorProcessFunction
        extends KeyedProcessFunction<String, HealthPayload, AlertRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(BatteryMonitorProcessFunction.class);

    private final MonitorConfig config;
    private final AlertDetector detector;

    private transient ValueState<VehicleMonitorState> monitorState;
    private transient ValueState<Long> cleanupTimer;
    private transient MonitorMetrics metrics;

    /**
     * @param config validated monitor configuration; must not be {@code null}
     */
    public BatteryMonitorProcessFunction(MonitorConfig config) {
        this.config = Objects.requireNonNull(config, "MonitorConfig must not be null");
        config.validate();
        this.detector = new AlertDetector(config);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        monitorState = getRuntimeContext().getState(new ValueStateDescriptor<>(
                "vehicle-monitor-state", TypeInformation.of(VehicleMonitorState.class)));
        cleanupTimer = getRuntimeContext().getState(new ValueStateDescriptor<>(
                "retention-cleanup-timer", TypeInformation.of(Long.class)));

        metrics = new MonitorMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("BatteryMonitorProcessFunction opened with {} rule(s)", detector.getRules().size());
    }

    @Override
    public void close() {
        LOG.info("BatteryMonitorProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(HealthPayload payload,
            KeyedProcessFunction<String, HealthPayload, AlertRecord>.Context ctx,
            Collector<AlertRecord> out) throws Exception {
        long startNanos = System.nanoTime();
        String vehicleId = ctx.getCurrentKey();

        HealthRecord record;
        try {
            record = HealthRecordNormalizer.normalize(vehicleId, payload,
                    Instant.ofEpochMilli(ctx.timerService().currentProcessingTime()));
        } catch (RuntimeException e) {
            metrics.incrementMalformedRecords();
            LOG.warn("Dropping health payload for {} that could not be normalised: {}",
                    vehicleId, e.getMessage());
            return;
        }

        VehicleMonitorState state = monitorState.value();
        if (state == null) {
            state = new VehicleMonitorState(vehicleId, config.getRetention());
        }

        List<AlertRecord> raised = state.process(record, detector);
        monitorState.update(state);

        for (AlertRecord alert : raised) {
            out.collect(alert);
        }
        if (!raised.isEmpty()) {
            metrics.incrementAlertsEmitted(raised.size());
        }

        if (cleanupTimer.value() == null) {
            scheduleCleanup(ctx.timerService().currentProcessingTime(), ctx.timerService());
        }

        metrics.incrementRecordsIngested();
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, HealthPayload, AlertRecord>.OnTimerContext ctx,
            Collector<AlertRecord> out) throws Exception {
        VehicleMonitorState state = monitorState.value();
        if (state == null) {
            cleanupTimer.clear();
            return;
        }

        Instant cutoff = Instant.ofEpochMilli(timestamp).minus(config.getRetention().retentionPeriod());
        int removed = state.prune(cutoff);
        if (removed > 0) {
            LOG.debug("Retention cleanup removed {} entries for {}", removed, ctx.getCurrentKey());
        }

        if (state.isEmpty()) {
            monitorState.clear();
            cleanupTimer.clear();
            LOG.debug("Cleared idle monitor state for {}", ctx.getCurrentKey());
            return;
        }
        monitorState.update(state);
        scheduleCleanup(timestamp, ctx.timerService());
    }

    private void scheduleCleanup(long fromMillis, TimerService timerService)
            throws Exception {
        long next = fromMillis + config.getRetention().cleanupInterval().toMillis();
        timerService.registerProcessingTimeTimer(next);
        cleanupTimer.update(next);
    }

    AlertDetector getDetector() {
        return detector;
    }
}
