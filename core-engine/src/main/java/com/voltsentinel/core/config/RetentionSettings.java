package com.voltsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Buffer capacities and the age-based retention policy.
 *
 * @since 1.0.0
 */
public class RetentionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int maxHistoryEntries = 1000;
    private int maxAlerts = 100;
    private long retentionHours = 7 * 24;
    private long cleanupIntervalMinutes = 60;

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (maxHistoryEntries < 1) {
            errors.add("'maxHistoryEntries' must be >= 1");
        }
        if (maxAlerts < 1) {
            errors.add("'maxAlerts' must be >= 1");
        }
        if (retentionHours < 1) {
            errors.add("'retentionHours' must be >= 1");
        }
        if (cleanupIntervalMinutes < 1) {
            errors.add("'cleanupIntervalMinutes' must be >= 1");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid retention settings: " + String.join("; ", errors));
        }
    }

    public Duration retentionPeriod() {
        return Duration.ofHours(retentionHours);
    }

    public Duration cleanupInterval() {
        return Duration.ofMinutes(cleanupIntervalMinutes);
    }

    public int getMaxHistoryEntries() {
        return maxHistoryEntries;
    }

    public void setMaxHistoryEntries(int maxHistoryEntries) {
        this.maxHistoryEntries = maxHistoryEntries;
    }

    public int getMaxAlerts() {
        return maxAlerts;
    }

    public void setMaxAlerts(int maxAlerts) {
        this.maxAlerts = maxAlerts;
    }

    public long getRetentionHours() {
        return retentionHours;
    }

    public void setRetentionHours(long retentionHours) {
        this.retentionHours = retentionHours;
    }

    public long getCleanupIntervalMinutes() {
        return cleanupIntervalMinutes;
    }

    public void setCleanupIntervalMinutes(long cleanupIntervalMinutes) {
        this.cleanupIntervalMinutes = cleanupIntervalMinutes;
    }

    @Override
    public String toString() {
        return "RetentionSettings{" +
                "maxHistoryEntries=" + maxHistoryEntries +
                ", maxAlerts=" + maxAlerts +
                ", retentionHours=" + retentionHours +
                ", cleanupIntervalMinutes=" + cleanupIntervalMinutes +
                '}';
    }
}
