package com.voltsentinel.core.service;

import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.HealthRecord;

/**
 * Write-through hook for durable storage of ingested records and raised alerts.
 *
 * <p>
 * Called synchronously on the ingesting thread after the in-memory state has
 * been updated. Exceptions are logged by the caller and never abort ingestion.
 * </p>
 *
 * @since 1.0.0
 */
public interface RecordSink {

    void onHealthRecord(HealthRecord record);

    void onAlert(AlertRecord alert);

    /**
     * @return a sink that discards everything
     */
    static RecordSink noop() {
        return new RecordSink() {
            @Override
            public void onHealthRecord(HealthRecord record) {
                // discard
            }

            @Override
            public void onAlert(AlertRecord alert) {
                // discard
            }
        };
    }
}
