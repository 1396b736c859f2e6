package com.voltsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoded battery-health payload as delivered by the transport.
 *
 * <p>
 * Payloads arrive as free-form JSON objects. This class keeps every field in
 * a {@link Map} so the normalizer can read the recognised keys and carry the
 * rest through as metadata without requiring a rigid schema.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. An instance is built by one
 * deserializer and then handed off to a single ingestion call.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthPayload implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Map<String, Object> fields = new LinkedHashMap<>();

    /** Instant the transport handed the payload over; fallback for a missing timestamp. */
    private Instant receivedAt;

    public HealthPayload() {
    }

    /**
     * Build a payload from an already decoded map.
     *
     * @param fields decoded fields; {@code null} yields an empty payload
     * @return a new payload holding a copy of {@code fields}
     */
    public static HealthPayload of(Map<String, ?> fields) {
        HealthPayload payload = new HealthPayload();
        if (fields != null) {
            fields.forEach((key, value) -> {
                if (key != null) {
                    payload.setField(key, value);
                }
            });
        }
        return payload;
    }

    /**
     * Set a field value. Called by Jackson for every JSON property.
     *
     * @param key   the JSON key; must not be {@code null}
     * @param value the JSON value
     * @throws NullPointerException if {@code key} is {@code null}
     */
    @JsonAnySetter
    public void setField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        fields.put(key, value);
    }

    /**
     * @return unmodifiable view of all fields
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public boolean hasField(String fieldName) {
        return fields.get(fieldName) != null;
    }

    public Optional<Object> getField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * Retrieve a numeric field, coercing JSON numbers and numeric strings.
     *
     * @param fieldName the JSON key
     * @return the value as a {@code double}, or empty if absent or not numeric
     */
    public Optional<Double> getNumericField(String fieldName) {
        Object raw = fields.get(fieldName);
        if (raw instanceof Number n) {
            double value = n.doubleValue();
            return Double.isNaN(value) ? Optional.empty() : Optional.of(value);
        }
        if (raw instanceof String s) {
            try {
                double value = Double.parseDouble(s.trim());
                return Double.isNaN(value) ? Optional.empty() : Optional.of(value);
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<String> getStringField(String fieldName) {
        Object raw = fields.get(fieldName);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    /**
     * Retrieve a nested object field.
     *
     * @param fieldName the JSON key
     * @return the nested map, or empty if absent or not an object
     */
    public Optional<Map<String, Object>> getMapField(String fieldName) {
        Object raw = fields.get(fieldName);
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return Optional.of(copy);
        }
        return Optional.empty();
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public void setReceivedAt(Instant receivedAt) {
        this.receivedAt = receivedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HealthPayload that))
            return false;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "HealthPayload" + fields;
    }
}
