package com.voltsentinel.core.analytics;

import com.voltsentinel.core.config.AnalyticsSettings;
import com.voltsentinel.core.model.HealthRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Computes {@link BatteryAnalytics} over a window of health records.
 *
 * <p>
 * The engine is stateless: callers select the window (typically
 * {@code HistoryStore.query(now - period, now)}) and pass it in.
 * </p>
 *
 * <h3>Trend</h3>
 * <p>
 * With at least {@code trendMinDataPoints} samples, the SOH series is split
 * at {@code floor(n / 2)}; the second half's mean exceeding the first half's
 * by more than {@code trendDelta} is {@code improving}, falling short by more
 * than {@code trendDelta} is {@code declining}, anything else is
 * {@code stable}.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsEngine {

    private final int trendMinDataPoints;
    private final double trendDelta;

    public AnalyticsEngine() {
        this(new AnalyticsSettings());
    }

    public AnalyticsEngine(AnalyticsSettings settings) {
        Objects.requireNonNull(settings, "AnalyticsSettings must not be null");
        this.trendMinDataPoints = settings.getTrendMinDataPoints();
        this.trendDelta = settings.getTrendDelta();
    }

    /**
     * @param window records inside the analytics window, in stored order
     * @param period the window length, used for the result's period label
     * @return the aggregate statistics; zero-filled for an empty window
     */
    public BatteryAnalytics compute(List<HealthRecord> window, Duration period) {
        Objects.requireNonNull(period, "period must not be null");
        if (window == null || window.isEmpty()) {
            return BatteryAnalytics.empty(period);
        }

        int n = window.size();
        double voltageSum = 0;
        double socSum = 0;
        double sohSum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double[] soh = new double[n];

        for (int i = 0; i < n; i++) {
            HealthRecord record = window.get(i);
            double v = record.getVoltage();
            voltageSum += v;
            socSum += record.getStateOfCharge();
            sohSum += record.getStateOfHealth();
            min = Math.min(min, v);
            max = Math.max(max, v);
            soh[i] = record.getStateOfHealth();
        }

        return new BatteryAnalytics(
                round(voltageSum / n, 2),
                round(socSum / n, 1),
                round(sohSum / n, 1),
                min,
                max,
                classifyTrend(soh),
                n,
                BatteryAnalytics.periodLabel(period));
    }

    HealthTrend classifyTrend(double[] soh) {
        if (soh.length < trendMinDataPoints) {
            return HealthTrend.STABLE;
        }
        int split = soh.length / 2;
        double firstMean = mean(soh, 0, split);
        double secondMean = mean(soh, split, soh.length);

        if (secondMean > firstMean + trendDelta) {
            return HealthTrend.IMPROVING;
        }
        if (secondMean < firstMean - trendDelta) {
            return HealthTrend.DECLINING;
        }
        return HealthTrend.STABLE;
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    private static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
