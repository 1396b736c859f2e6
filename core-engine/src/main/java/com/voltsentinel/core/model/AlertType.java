package com.voltsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Category of a battery alert.
 *
 * @since 1.0.0
 */
public enum AlertType {

    BATTERY_LOW("battery_low"),
    HEALTH_DEGRADATION("health_degradation"),
    SUDDEN_DROP("sudden_drop"),
    CONNECTION_LOST("connection_lost"),
    SENSOR_ERROR("sensor_error"),
    SYSTEM_ERROR("system_error");

    private final String value;

    AlertType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolve a type from its wire token; unknown tokens map to {@link #SYSTEM_ERROR}.
     *
     * @param value the token, may be {@code null}
     * @return the matching type
     */
    public static AlertType fromValue(String value) {
        if (value != null) {
            String token = value.trim().toLowerCase(Locale.ROOT);
            for (AlertType type : values()) {
                if (type.value.equals(token)) {
                    return type;
                }
            }
        }
        return SYSTEM_ERROR;
    }
}
