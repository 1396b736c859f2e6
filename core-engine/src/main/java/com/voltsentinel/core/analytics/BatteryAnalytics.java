package com.voltsentinel.core.analytics;

import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;

/**
 * Aggregate statistics over one vehicle's history window.
 *
 * <p>
 * Averages are already rounded: voltage to 2 decimal places, SOC and SOH to
 * one. An empty window yields {@link #empty(Duration)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class BatteryAnalytics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double averageVoltage;
    private final double averageSoc;
    private final double averageSoh;
    private final double minVoltage;
    private final double maxVoltage;
    private final HealthTrend healthTrend;
    private final int dataPoints;
    private final String period;

    public BatteryAnalytics(double averageVoltage, double averageSoc, double averageSoh,
            double minVoltage, double maxVoltage, HealthTrend healthTrend,
            int dataPoints, String period) {
        this.averageVoltage = averageVoltage;
        this.averageSoc = averageSoc;
        this.averageSoh = averageSoh;
        this.minVoltage = minVoltage;
        this.maxVoltage = maxVoltage;
        this.healthTrend = Objects.requireNonNull(healthTrend, "healthTrend must not be null");
        this.dataPoints = dataPoints;
        this.period = period;
    }

    /**
     * @param period the requested window
     * @return the zero-filled result for a window without samples
     */
    public static BatteryAnalytics empty(Duration period) {
        return new BatteryAnalytics(0.0, 0.0, 0.0, 0.0, 0.0, HealthTrend.STABLE, 0, periodLabel(period));
    }

    static String periodLabel(Duration period) {
        return period.toHours() + " hours";
    }

    public double getAverageVoltage() {
        return averageVoltage;
    }

    public double getAverageSoc() {
        return averageSoc;
    }

    public double getAverageSoh() {
        return averageSoh;
    }

    public double getMinVoltage() {
        return minVoltage;
    }

    public double getMaxVoltage() {
        return maxVoltage;
    }

    public HealthTrend getHealthTrend() {
        return healthTrend;
    }

    public int getDataPoints() {
        return dataPoints;
    }

    public String getPeriod() {
        return period;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BatteryAnalytics that))
            return false;
        return Double.compare(averageVoltage, that.averageVoltage) == 0
                && Double.compare(averageSoc, that.averageSoc) == 0
                && Double.compare(averageSoh, that.averageSoh) == 0
                && Double.compare(minVoltage, that.minVoltage) == 0
                && Double.compare(maxVoltage, that.maxVoltage) == 0
                && dataPoints == that.dataPoints
                && healthTrend == that.healthTrend
                && Objects.equals(period, that.period);
    }

    @Override
    public int hashCode() {
        return Objects.hash(averageVoltage, averageSoc, averageSoh, minVoltage, maxVoltage,
                healthTrend, dataPoints, period);
    }

    @Override
    public String toString() {
        return "BatteryAnalytics{" +
                "averageVoltage=" + averageVoltage +
                ", averageSoc=" + averageSoc +
                ", averageSoh=" + averageSoh +
                ", voltageRange=[" + minVoltage + ", " + maxVoltage + "]" +
                ", healthTrend=" + healthTrend +
                ", dataPoints=" + dataPoints +
                ", period='" + period + '\'' +
                '}';
    }
}
