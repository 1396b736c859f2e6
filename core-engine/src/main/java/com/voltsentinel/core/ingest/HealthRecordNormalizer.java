package com.voltsentinel.core.ingest;

import com.voltsentinel.core.model.BatteryStatus;
import com.voltsentinel.core.model.HealthPayload;
import com.voltsentinel.core.model.HealthRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a decoded {@link HealthPayload} into a {@link HealthRecord}.
 *
 * <h3>Defaulting</h3>
 * <ul>
 * <li>{@code voltage}, {@code soc}, {@code soh}: missing or non-numeric become {@code 0.0}
 * (logged at WARN)</li>
 * <li>{@code status}: missing or unknown token becomes {@link BatteryStatus#UNKNOWN}</li>
 * <li>{@code battery_type}: missing becomes {@code "unknown"}</li>
 * <li>{@code recommendation}: missing becomes {@value #DEFAULT_RECOMMENDATION}</li>
 * <li>{@code timestamp}: missing or unparseable becomes the payload's receive
 * time, else {@code now}</li>
 * </ul>
 *
 * <p>
 * Snake-case and camel-case keys are both accepted. Unrecognised top-level
 * fields are folded into the record's metadata without overriding entries of
 * an explicit {@code metadata} object.
 * </p>
 *
 * @since 1.0.0
 */
public final class HealthRecordNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthRecordNormalizer.class);

    public static final String DEFAULT_RECOMMENDATION = "No recommendation available";

    private static final String VOLTAGE = "voltage";
    private static final String SOC = "soc";
    private static final String SOH = "soh";
    private static final String STATUS = "status";
    private static final String RECOMMENDATION = "recommendation";
    private static final String TIMESTAMP = "timestamp";
    private static final String METADATA = "metadata";
    private static final List<String> ESTIMATED_HOURS = List.of("estimated_hours", "estimatedHours");
    private static final List<String> BATTERY_TYPE = List.of("battery_type", "batteryType");

    /** Keys consumed by the normalizer or identifying the vehicle; never folded into metadata. */
    private static final Set<String> RESERVED = Set.of(
            VOLTAGE, SOC, SOH, STATUS, RECOMMENDATION, TIMESTAMP, METADATA,
            "estimated_hours", "estimatedHours", "battery_type", "batteryType",
            "carId", "car_id", "vehicleId", "vehicle_id");

    private HealthRecordNormalizer() {
        // utility class
    }

    /**
     * Normalize a payload.
     *
     * @param vehicleId owning vehicle; must not be {@code null}
     * @param payload   decoded payload; {@code null} is treated as empty
     * @param now       fallback timestamp when the payload carries none and has no receive time
     * @return the normalized record
     */
    public static HealthRecord normalize(String vehicleId, HealthPayload payload, Instant now) {
        Objects.requireNonNull(vehicleId, "vehicleId must not be null");
        Objects.requireNonNull(now, "now must not be null");
        HealthPayload source = payload != null ? payload : new HealthPayload();

        List<String> defaulted = new ArrayList<>();
        double voltage = numeric(source, VOLTAGE, defaulted);
        double soc = numeric(source, SOC, defaulted);
        double soh = numeric(source, SOH, defaulted);
        if (!defaulted.isEmpty()) {
            LOG.warn("Health payload for {} is missing numeric field(s) {} - defaulting to 0.0",
                    vehicleId, defaulted);
        }

        Instant fallback = source.getReceivedAt() != null ? source.getReceivedAt() : now;

        return HealthRecord.builder()
                .vehicleId(vehicleId)
                .voltage(voltage)
                .stateOfCharge(soc)
                .stateOfHealth(soh)
                .status(BatteryStatus.fromValue(source.getStringField(STATUS).orElse(null)))
                .recommendation(source.getStringField(RECOMMENDATION).orElse(DEFAULT_RECOMMENDATION))
                .estimatedRuntimeHours(firstNumeric(source, ESTIMATED_HOURS).orElse(null))
                .batteryType(firstString(source, BATTERY_TYPE).orElse("unknown"))
                .timestamp(timestamp(vehicleId, source, fallback))
                .metadata(metadata(source))
                .build();
    }

    /**
     * Parse an ISO-8601 timestamp. Accepts instants ({@code ...Z}), offset
     * date-times and local date-times, the latter read as UTC.
     *
     * @param text the timestamp text
     * @return the instant, or empty if unparseable
     */
    public static Optional<Instant> parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text.trim(),
                    OffsetDateTime::from, LocalDateTime::from);
            return Optional.of(parsed instanceof OffsetDateTime odt
                    ? odt.toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static double numeric(HealthPayload payload, String key, List<String> defaulted) {
        Optional<Double> value = payload.getNumericField(key);
        if (value.isEmpty()) {
            defaulted.add(key);
        }
        return value.orElse(0.0);
    }

    private static Optional<Double> firstNumeric(HealthPayload payload, List<String> keys) {
        for (String key : keys) {
            Optional<Double> value = payload.getNumericField(key);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstString(HealthPayload payload, List<String> keys) {
        for (String key : keys) {
            Optional<String> value = payload.getStringField(key);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private static Instant timestamp(String vehicleId, HealthPayload payload, Instant fallback) {
        Optional<Object> raw = payload.getField(TIMESTAMP);
        if (raw.isEmpty()) {
            return fallback;
        }
        Optional<Instant> parsed = raw.get() instanceof Number n
                ? Optional.of(Instant.ofEpochMilli(n.longValue()))
                : parseTimestamp(raw.get().toString());
        if (parsed.isEmpty()) {
            LOG.warn("Unparseable timestamp '{}' in health payload for {} - using {}",
                    raw.get(), vehicleId, fallback);
        }
        return parsed.orElse(fallback);
    }

    private static Map<String, Object> metadata(HealthPayload payload) {
        Map<String, Object> metadata = new LinkedHashMap<>(payload.getMapField(METADATA).orElse(Map.of()));
        payload.getFields().forEach((key, value) -> {
            if (!RESERVED.contains(key) && value != null) {
                metadata.putIfAbsent(key, value);
            }
        });
        return metadata;
    }
}
