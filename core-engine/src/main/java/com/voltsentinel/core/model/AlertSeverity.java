package com.voltsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Alert severity. Declaration order is significant: {@code INFO < WARNING < CRITICAL}.
 *
 * @since 1.0.0
 */
public enum AlertSeverity {

    INFO("info"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    AlertSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @param other severity to compare with
     * @return {@code true} if this severity is at least as severe as {@code other}
     */
    public boolean isAtLeast(AlertSeverity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Resolve a severity from its wire token; unknown tokens map to {@link #INFO}.
     *
     * @param value the token, may be {@code null}
     * @return the matching severity
     */
    public static AlertSeverity fromValue(String value) {
        if (value != null) {
            String token = value.trim().toLowerCase(Locale.ROOT);
            for (AlertSeverity severity : values()) {
                if (severity.value.equals(token)) {
                    return severity;
                }
            }
        }
        return INFO;
    }
}
