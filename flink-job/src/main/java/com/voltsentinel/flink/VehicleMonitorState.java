package com.voltsentinel.flink;

import com.voltsentinel.core.config.RetentionSettings;
import com.voltsentinel.core.detection.AlertDetector;
import com.voltsentinel.core.history.HistoryStore;
import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.HealthRecord;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-vehicle state held in Flink keyed state: the bounded record history and
 * the newest-first list of alerts the detector has raised for the vehicle.
 *
 * <p>
 * The alert list plays the part of the ledger in the streaming deployment.
 * It exists so that debounce and hysteresis rules can see earlier alerts; read
 * flags are not tracked here because alerts leave the job through Kafka.
 * </p>
 *
 * @since 1.0.0
 */
public class VehicleMonitorState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final HistoryStore history;
    private final int maxAlerts;
    private final List<AlertRecord> alerts = new ArrayList<>();

    public VehicleMonitorState(String vehicleId, RetentionSettings retention) {
        Objects.requireNonNull(retention, "RetentionSettings must not be null");
        this.history = new HistoryStore(vehicleId, retention.getMaxHistoryEntries());
        if (retention.getMaxAlerts() < 1) {
            throw new IllegalArgumentException("maxAlerts must be >= 1, got: " + retention.getMaxAlerts());
        }
        this.maxAlerts = retention.getMaxAlerts();
    }

    /**
     * Append {@code record} to the history and evaluate the detector against it.
     *
     * @param record   the normalised record
     * @param detector the detector to run
     * @return the alerts raised for this record, in rule order
     */
    public List<AlertRecord> process(HealthRecord record, AlertDetector detector) {
        Objects.requireNonNull(record, "HealthRecord must not be null");
        Objects.requireNonNull(detector, "AlertDetector must not be null");

        history.append(record);
        List<AlertRecord> raised = detector.evaluate(record, history.snapshot(), List.copyOf(alerts));
        for (AlertRecord alert : raised) {
            alerts.add(0, alert);
        }
        while (alerts.size() > maxAlerts) {
            alerts.remove(alerts.size() - 1);
        }
        return raised;
    }

    /**
     * Drop history entries and alerts strictly older than {@code cutoff}.
     *
     * @return number of entries removed across history and alerts
     */
    public int prune(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        int removed = history.pruneOlderThan(cutoff);
        int before = alerts.size();
        alerts.removeIf(alert -> alert.getTimestamp().isBefore(cutoff));
        return removed + (before - alerts.size());
    }

    public boolean isEmpty() {
        return history.isEmpty() && alerts.isEmpty();
    }

    public HistoryStore getHistory() {
        return history;
    }

    /**
     * @return unmodifiable newest-first view of the retained alerts
     */
    public List<AlertRecord> getAlerts() {
        return Collections.unmodifiableList(alerts);
    }

    @Override
    public String toString() {
        return "VehicleMonitorState{vehicleId='" + history.getVehicleId()
                + "', records=" + history.size() + ", alerts=" + alerts.size() + '}';
    }
}
