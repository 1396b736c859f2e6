package com.voltsentinel.core.analytics;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of the state-of-health series over an analytics window.
 */
public enum HealthTrend {

    IMPROVING("improving"),
    STABLE("stable"),
    DECLINING("declining");

    private final String value;

    HealthTrend(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
