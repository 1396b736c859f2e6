package com.voltsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Alert raised by the detector for one vehicle.
 *
 * <p>
 * Instances are immutable. The only state transition an alert goes through
 * after creation, unread to read, produces a new instance via
 * {@link #markedRead()}; everything else is fixed at build time.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code vehicleId}, {@code type},
 * {@code severity} and {@code timestamp} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Key of the provenance tag inside {@link #getData()}. */
    public static final String REASON_KEY = "reason";

    private final String id;
    private final String vehicleId;
    private final AlertType type;
    private final AlertSeverity severity;
    private final String title;
    private final String message;
    private final Instant timestamp;
    private final boolean read;
    private final Map<String, Object> data;

    private AlertRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.vehicleId = Objects.requireNonNull(builder.vehicleId, "vehicleId must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.title = builder.title;
        this.message = builder.message;
        this.read = builder.read;
        // Defensive copy to prevent mutation by callers
        this.data = builder.data != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.data))
                : Collections.emptyMap();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AlertRecord} instances.
     */
    public static class Builder {
        private String id;
        private String vehicleId;
        private AlertType type;
        private AlertSeverity severity;
        private String title;
        private String message;
        private Instant timestamp;
        private boolean read;
        private Map<String, Object> data;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder vehicleId(String vehicleId) {
            this.vehicleId = vehicleId;
            return this;
        }

        public Builder type(AlertType type) {
            this.type = type;
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder read(boolean read) {
            this.read = read;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        /**
         * @return a new {@link AlertRecord}
         * @throws NullPointerException if a required field is missing
         */
        public AlertRecord build() {
            return new AlertRecord(this);
        }
    }

    /**
     * @return this alert if it is already read, otherwise a read copy of it
     */
    public AlertRecord markedRead() {
        if (read) {
            return this;
        }
        return new Builder()
                .id(id)
                .vehicleId(vehicleId)
                .type(type)
                .severity(severity)
                .title(title)
                .message(message)
                .timestamp(timestamp)
                .read(true)
                .data(data)
                .build();
    }

    public String getId() {
        return id;
    }

    public String getVehicleId() {
        return vehicleId;
    }

    public AlertType getType() {
        return type;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isRead() {
        return read;
    }

    /**
     * @return unmodifiable provenance data, empty when none was attached
     */
    public Map<String, Object> getData() {
        return data;
    }

    /**
     * @return the {@value #REASON_KEY} tag, if present
     */
    @JsonIgnore
    public Optional<String> getReason() {
        Object reason = data.get(REASON_KEY);
        return reason == null ? Optional.empty() : Optional.of(reason.toString());
    }

    public boolean hasReason(String reason) {
        return getReason().map(reason::equals).orElse(false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRecord that))
            return false;
        return read == that.read && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, read);
    }

    @Override
    public String toString() {
        return "AlertRecord{" +
                "id='" + id + '\'' +
                ", vehicleId='" + vehicleId + '\'' +
                ", type=" + type +
                ", severity=" + severity +
                ", title='" + title + '\'' +
                ", timestamp=" + timestamp +
                ", read=" + read +
                '}';
    }
}
