package com.voltsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;

/**
 * Parameters of the rolling analytics window and trend classification.
 *
 * @since 1.0.0
 */
public class AnalyticsSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private long defaultPeriodHours = 24;
    /** Below this many samples the trend is always "stable". */
    private int trendMinDataPoints = 10;
    /** Half-window SOH means must differ by more than this to leave "stable". */
    private double trendDelta = 2.0;

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        if (defaultPeriodHours < 1 || trendMinDataPoints < 2 || trendDelta < 0) {
            throw new IllegalStateException("Invalid analytics settings: " + this);
        }
    }

    public Duration defaultPeriod() {
        return Duration.ofHours(defaultPeriodHours);
    }

    public long getDefaultPeriodHours() {
        return defaultPeriodHours;
    }

    public void setDefaultPeriodHours(long defaultPeriodHours) {
        this.defaultPeriodHours = defaultPeriodHours;
    }

    public int getTrendMinDataPoints() {
        return trendMinDataPoints;
    }

    public void setTrendMinDataPoints(int trendMinDataPoints) {
        this.trendMinDataPoints = trendMinDataPoints;
    }

    public double getTrendDelta() {
        return trendDelta;
    }

    public void setTrendDelta(double trendDelta) {
        this.trendDelta = trendDelta;
    }

    @Override
    public String toString() {
        return "AnalyticsSettings{" +
                "defaultPeriodHours=" + defaultPeriodHours +
                ", trendMinDataPoints=" + trendMinDataPoints +
                ", trendDelta=" + trendDelta +
                '}';
    }
}
