package com.voltsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Voltage thresholds for one battery class (e.g. 9V alkaline, 12V lead-acid).
 *
 * <p>
 * A profile applies to a record when the lower-cased battery type contains
 * any of its {@code matchTokens}. A profile with no tokens is the fallback
 * and applies to every battery type no other profile claims.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdProfile implements Serializable {

    private static final long serialVersionUID = 1L;

    private String name;
    private List<String> matchTokens = new ArrayList<>();
    /** At or below this voltage the battery is critically low. */
    private double criticalVoltage;
    /** At or below this voltage the battery is low. */
    private double lowVoltage;

    public ThresholdProfile() {
    }

    public ThresholdProfile(String name, List<String> matchTokens, double criticalVoltage, double lowVoltage) {
        this.name = name;
        setMatchTokens(matchTokens);
        this.criticalVoltage = criticalVoltage;
        this.lowVoltage = lowVoltage;
    }

    /**
     * @param batteryType battery type string from a health record, may be {@code null}
     * @return {@code true} if one of this profile's tokens occurs in the type
     */
    public boolean matches(String batteryType) {
        if (batteryType == null) {
            return false;
        }
        String normalized = batteryType.toLowerCase(Locale.ROOT);
        for (String token : matchTokens) {
            if (normalized.contains(token)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return {@code true} if this profile has no tokens and therefore acts as the fallback
     */
    public boolean acceptsAnyType() {
        return matchTokens.isEmpty();
    }

    /**
     * Validate the profile.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add("Profile 'name' is required");
        }
        if (criticalVoltage <= 0) {
            errors.add("Profile '" + name + "' requires 'criticalVoltage' > 0");
        }
        if (lowVoltage < criticalVoltage) {
            errors.add("Profile '" + name + "' requires 'lowVoltage' >= 'criticalVoltage'");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid ThresholdProfile: " + String.join("; ", errors));
        }
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getMatchTokens() {
        return Collections.unmodifiableList(matchTokens);
    }

    /**
     * Set the match tokens, normalised to lowercase.
     *
     * @param matchTokens tokens; {@code null} means none
     */
    public void setMatchTokens(List<String> matchTokens) {
        List<String> normalized = new ArrayList<>();
        if (matchTokens != null) {
            for (String token : matchTokens) {
                if (token != null && !token.isBlank()) {
                    normalized.add(token.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.matchTokens = normalized;
    }

    public double getCriticalVoltage() {
        return criticalVoltage;
    }

    public void setCriticalVoltage(double criticalVoltage) {
        this.criticalVoltage = criticalVoltage;
    }

    public double getLowVoltage() {
        return lowVoltage;
    }

    public void setLowVoltage(double lowVoltage) {
        this.lowVoltage = lowVoltage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdProfile that))
            return false;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "ThresholdProfile{" +
                "name='" + name + '\'' +
                ", matchTokens=" + matchTokens +
                ", criticalVoltage=" + criticalVoltage +
                ", lowVoltage=" + lowVoltage +
                '}';
    }
}
