package com.voltsentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for Volt Sentinel.
 * <p>
 * Flink exposes these via its configured metric reporters. The reporter is
 * configured at cluster level; the job only defines the metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code records_ingested_total}: health records normalised and evaluated</li>
 *   <li>{@code alerts_emitted_total}: alerts raised by the detector</li>
 *   <li>{@code malformed_records_total}: payloads dropped before detection</li>
 *   <li>{@code processing_latency_ms}: histogram of per-record latency</li>
 * </ul>
 */
public class MonitorMetrics {

    public static final String GROUP = "volt_sentinel";

    private final Counter recordsIngested;
    private final Counter alertsEmitted;
    private final Counter malformedRecords;
    private final Histogram processingLatency;

    public MonitorMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup(GROUP);

        this.recordsIngested = group.counter("records_ingested_total");
        this.alertsEmitted = group.counter("alerts_emitted_total");
        this.malformedRecords = group.counter("malformed_records_total");
        // sliding window of 350 samples
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementRecordsIngested() {
        recordsIngested.inc();
    }

    public void incrementAlertsEmitted(int count) {
        alertsEmitted.inc(count);
    }

    public void incrementMalformedRecords() {
        malformedRecords.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
