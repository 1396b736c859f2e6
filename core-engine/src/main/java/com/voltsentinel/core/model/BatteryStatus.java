package com.voltsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Battery condition as reported by the edge publisher.
 *
 * @since 1.0.0
 */
public enum BatteryStatus {

    FRESH("fresh"),
    GOOD("good"),
    WEAK("weak"),
    LOW("low"),
    DEAD("dead"),
    UNKNOWN("unknown");

    private final String value;

    BatteryStatus(String value) {
        this.value = value;
    }

    /**
     * @return the lower-case wire token
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolve a status from its wire token.
     *
     * @param value the token, may be {@code null}
     * @return the matching status, or {@link #UNKNOWN} when nothing matches
     */
    public static BatteryStatus fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String token = value.trim().toLowerCase(Locale.ROOT);
        for (BatteryStatus status : values()) {
            if (status.value.equals(token)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
