package com.voltsentinel.flink;

import com.voltsentinel.core.model.HealthPayload;
import org.apache.flink.api.java.functions.KeySelector;

import java.util.Objects;

/**
 * Keys health payloads by the vehicle id carried in a configurable field.
 * Payloads without a usable id yield an empty key and are filtered out
 * upstream via {@link #hasVehicleId(HealthPayload)}.
 */
public class VehicleKeySelector implements KeySelector<HealthPayload, String> {

    private static final long serialVersionUID = 1L;

    private final String field;

    public VehicleKeySelector(String field) {
        this.field = Objects.requireNonNull(field, "field must not be null");
    }

    @Override
    public String getKey(HealthPayload payload) {
        return payload.getStringField(field).map(String::trim).orElse("");
    }

    public boolean hasVehicleId(HealthPayload payload) {
        return payload != null && !getKey(payload).isEmpty();
    }

    public String getField() {
        return field;
    }
}
