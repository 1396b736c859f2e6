package com.voltsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the monitor YAML configuration.
 *
 * <p>
 * Expected YAML structure (every section is optional and falls back to the
 * built-in defaults):
 * </p>
 *
 * <pre>
 * profiles:
 *   - name: 9V
 *     matchTokens: [9v, alkaline]
 *     criticalVoltage: 6.5
 *     lowVoltage: 7.5
 *   - name: 12V
 *     criticalVoltage: 11.5
 *     lowVoltage: 12.0
 * detection:
 *   suddenDropDelta: 1.0
 * retention:
 *   maxHistoryEntries: 1000
 * analytics:
 *   trendMinDataPoints: 10
 * rules: [disposal, critical_level, low_level, health_degradation, swap_detection, sudden_drop]
 * </pre>
 *
 * <p>
 * {@code rules} lists alert rules by name in evaluation order. Leaving it out
 * runs every built-in rule.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<ThresholdProfile> profiles = defaultProfiles();
    private DetectionSettings detection = new DetectionSettings();
    private RetentionSettings retention = new RetentionSettings();
    private AnalyticsSettings analytics = new AnalyticsSettings();
    /** {@code null} selects every built-in rule. */
    private List<String> rules;

    /**
     * @return a configuration holding only built-in defaults
     */
    public static MonitorConfig defaults() {
        return new MonitorConfig();
    }

    /**
     * Pick the threshold profile for a battery type.
     *
     * @param batteryType battery type string from a health record, may be {@code null}
     * @return the first profile whose tokens match, otherwise the fallback profile
     */
    public ThresholdProfile resolveProfile(String batteryType) {
        ThresholdProfile fallback = null;
        for (ThresholdProfile profile : profiles) {
            if (profile.matches(batteryType)) {
                return profile;
            }
            if (fallback == null && profile.acceptsAnyType()) {
                fallback = profile;
            }
        }
        // validate() guarantees a fallback; the last profile covers unvalidated configs
        return fallback != null ? fallback : profiles.get(profiles.size() - 1);
    }

    /**
     * Validate every section. Collects all errors and throws a single exception.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (profiles.isEmpty()) {
            errors.add("At least one threshold profile is required");
        }
        long fallbacks = profiles.stream().filter(ThresholdProfile::acceptsAnyType).count();
        if (!profiles.isEmpty() && fallbacks != 1) {
            errors.add("Exactly one profile without 'matchTokens' (the fallback) is required, found " + fallbacks);
        }
        for (int i = 0; i < profiles.size(); i++) {
            ThresholdProfile profile = Objects.requireNonNull(profiles.get(i),
                    "Profile at index " + i + " is null");
            collect(profile::validate, errors);
        }
        collect(detection::validate, errors);
        collect(retention::validate, errors);
        collect(analytics::validate, errors);

        if (rules != null) {
            if (rules.isEmpty()) {
                errors.add("rules must not be empty; omit the section to run every built-in rule");
            }
            Set<String> seen = new HashSet<>();
            for (String rule : rules) {
                if (rule == null || rule.isBlank()) {
                    errors.add("rules must not contain blank names");
                } else if (!seen.add(rule.trim().toLowerCase(Locale.ROOT))) {
                    errors.add("rules lists '" + rule + "' more than once");
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Monitor configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public List<ThresholdProfile> getProfiles() {
        return Collections.unmodifiableList(profiles);
    }

    /**
     * Set the profiles (used by SnakeYAML during deserialization).
     *
     * @param profiles threshold profiles; {@code null} restores the defaults
     */
    public void setProfiles(List<ThresholdProfile> profiles) {
        this.profiles = profiles != null ? new ArrayList<>(profiles) : defaultProfiles();
    }

    public DetectionSettings getDetection() {
        return detection;
    }

    public void setDetection(DetectionSettings detection) {
        this.detection = detection != null ? detection : new DetectionSettings();
    }

    public RetentionSettings getRetention() {
        return retention;
    }

    public void setRetention(RetentionSettings retention) {
        this.retention = retention != null ? retention : new RetentionSettings();
    }

    public AnalyticsSettings getAnalytics() {
        return analytics;
    }

    public void setAnalytics(AnalyticsSettings analytics) {
        this.analytics = analytics != null ? analytics : new AnalyticsSettings();
    }

    /**
     * @return configured rule names in evaluation order, empty when unset
     */
    public List<String> getRules() {
        return rules != null ? Collections.unmodifiableList(rules) : List.of();
    }

    /**
     * @param rules rule names; {@code null} restores the built-in rule set
     */
    public void setRules(List<String> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : null;
    }

    /**
     * @return {@code true} if no {@code rules} section was given
     */
    public boolean usesDefaultRules() {
        return rules == null;
    }

    private static List<ThresholdProfile> defaultProfiles() {
        List<ThresholdProfile> defaults = new ArrayList<>();
        defaults.add(new ThresholdProfile("9V", List.of("9v", "alkaline"), 6.5, 7.5));
        defaults.add(new ThresholdProfile("12V", List.of(), 11.5, 12.0));
        return defaults;
    }

    private static void collect(Runnable validation, List<String> errors) {
        try {
            validation.run();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "profiles=" + profiles +
                ", detection=" + detection +
                ", retention=" + retention +
                ", analytics=" + analytics +
                ", rules=" + (rules != null ? rules : "default") +
                '}';
    }
}
