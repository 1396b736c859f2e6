package com.voltsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Thresholds and debounce windows shared by all battery classes.
 *
 * <p>
 * Windows are configured in seconds; the {@code *Window()} accessors expose
 * them as {@link Duration}s for the detection rules.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- Disposal (ultra-low) ---
    private double disposalVoltage = 4.5;
    /** A new disposal alert is only allowed after a reading above disposalVoltage + margin. */
    private double disposalRecoveryMargin = 0.2;

    // --- Charge tiers ---
    private double criticalSoc = 10.0;
    private double lowSoc = 25.0;
    private long lowDebounceSeconds = 30 * 60;

    // --- Health degradation ---
    private double healthDegradationSoh = 70.0;
    /** Below this SOH a degradation alert is a warning instead of info. */
    private double healthWarningSoh = 60.0;
    private long healthDebounceSeconds = 24 * 60 * 60;

    // --- Swap detection ---
    private double swapVoltage = 5.0;
    private double goodVoltageMargin = 0.5;
    private long swapMaxGapSeconds = 120;
    private long swapDebounceSeconds = 15;

    // --- Sudden drop ---
    private double suddenDropDelta = 1.0;
    private long suddenDropWindowSeconds = 30;

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (disposalRecoveryMargin < 0) {
            errors.add("'disposalRecoveryMargin' must be >= 0");
        }
        if (lowSoc < criticalSoc) {
            errors.add("'lowSoc' must be >= 'criticalSoc'");
        }
        if (healthWarningSoh > healthDegradationSoh) {
            errors.add("'healthWarningSoh' must be <= 'healthDegradationSoh'");
        }
        if (goodVoltageMargin < 0) {
            errors.add("'goodVoltageMargin' must be >= 0");
        }
        if (suddenDropDelta <= 0) {
            errors.add("'suddenDropDelta' must be > 0");
        }
        if (lowDebounceSeconds < 0 || healthDebounceSeconds < 0 || swapDebounceSeconds < 0) {
            errors.add("debounce windows must be >= 0");
        }
        if (swapMaxGapSeconds <= 0 || suddenDropWindowSeconds <= 0) {
            errors.add("'swapMaxGapSeconds' and 'suddenDropWindowSeconds' must be > 0");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid detection settings: " + String.join("; ", errors));
        }
    }

    public Duration lowDebounceWindow() {
        return Duration.ofSeconds(lowDebounceSeconds);
    }

    public Duration healthDebounceWindow() {
        return Duration.ofSeconds(healthDebounceSeconds);
    }

    public Duration swapMaxGap() {
        return Duration.ofSeconds(swapMaxGapSeconds);
    }

    public Duration swapDebounceWindow() {
        return Duration.ofSeconds(swapDebounceSeconds);
    }

    public Duration suddenDropWindow() {
        return Duration.ofSeconds(suddenDropWindowSeconds);
    }

    public double getDisposalVoltage() {
        return disposalVoltage;
    }

    public void setDisposalVoltage(double disposalVoltage) {
        this.disposalVoltage = disposalVoltage;
    }

    public double getDisposalRecoveryMargin() {
        return disposalRecoveryMargin;
    }

    public void setDisposalRecoveryMargin(double disposalRecoveryMargin) {
        this.disposalRecoveryMargin = disposalRecoveryMargin;
    }

    public double getCriticalSoc() {
        return criticalSoc;
    }

    public void setCriticalSoc(double criticalSoc) {
        this.criticalSoc = criticalSoc;
    }

    public double getLowSoc() {
        return lowSoc;
    }

    public void setLowSoc(double lowSoc) {
        this.lowSoc = lowSoc;
    }

    public long getLowDebounceSeconds() {
        return lowDebounceSeconds;
    }

    public void setLowDebounceSeconds(long lowDebounceSeconds) {
        this.lowDebounceSeconds = lowDebounceSeconds;
    }

    public double getHealthDegradationSoh() {
        return healthDegradationSoh;
    }

    public void setHealthDegradationSoh(double healthDegradationSoh) {
        this.healthDegradationSoh = healthDegradationSoh;
    }

    public double getHealthWarningSoh() {
        return healthWarningSoh;
    }

    public void setHealthWarningSoh(double healthWarningSoh) {
        this.healthWarningSoh = healthWarningSoh;
    }

    public long getHealthDebounceSeconds() {
        return healthDebounceSeconds;
    }

    public void setHealthDebounceSeconds(long healthDebounceSeconds) {
        this.healthDebounceSeconds = healthDebounceSeconds;
    }

    public double getSwapVoltage() {
        return swapVoltage;
    }

    public void setSwapVoltage(double swapVoltage) {
        this.swapVoltage = swapVoltage;
    }

    public double getGoodVoltageMargin() {
        return goodVoltageMargin;
    }

    public void setGoodVoltageMargin(double goodVoltageMargin) {
        this.goodVoltageMargin = goodVoltageMargin;
    }

    public long getSwapMaxGapSeconds() {
        return swapMaxGapSeconds;
    }

    public void setSwapMaxGapSeconds(long swapMaxGapSeconds) {
        this.swapMaxGapSeconds = swapMaxGapSeconds;
    }

    public long getSwapDebounceSeconds() {
        return swapDebounceSeconds;
    }

    public void setSwapDebounceSeconds(long swapDebounceSeconds) {
        this.swapDebounceSeconds = swapDebounceSeconds;
    }

    public double getSuddenDropDelta() {
        return suddenDropDelta;
    }

    public void setSuddenDropDelta(double suddenDropDelta) {
        this.suddenDropDelta = suddenDropDelta;
    }

    public long getSuddenDropWindowSeconds() {
        return suddenDropWindowSeconds;
    }

    public void setSuddenDropWindowSeconds(long suddenDropWindowSeconds) {
        this.suddenDropWindowSeconds = suddenDropWindowSeconds;
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "disposalVoltage=" + disposalVoltage +
                ", criticalSoc=" + criticalSoc +
                ", lowSoc=" + lowSoc +
                ", healthDegradationSoh=" + healthDegradationSoh +
                ", swapVoltage=" + swapVoltage +
                ", suddenDropDelta=" + suddenDropDelta +
                ", suddenDropWindowSeconds=" + suddenDropWindowSeconds +
                '}';
    }
}
